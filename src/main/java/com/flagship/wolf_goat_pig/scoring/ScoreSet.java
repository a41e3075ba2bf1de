package com.flagship.wolf_goat_pig.scoring;

import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Gross strokes per player for one hole.
 */
@Value
public class ScoreSet {
    int holeNumber;
    Map<PlayerId, Integer> strokes;

    public ScoreSet(int holeNumber, Map<PlayerId, Integer> strokes) {
        this.holeNumber = holeNumber;
        this.strokes = Collections.unmodifiableMap(new LinkedHashMap<>(strokes));
    }

    public OptionalInt strokesOf(PlayerId player) {
        Integer value = strokes.get(player);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    /**
     * Lowest strokes among {@code players}.
     *
     * @throws IllegalArgumentException if any player has no strokes recorded
     */
    public int bestBall(Collection<PlayerId> players) {
        return players.stream()
            .mapToInt(p -> strokesOf(p).orElseThrow(
                () -> new IllegalArgumentException("No strokes recorded for " + p)))
            .min()
            .orElseThrow(() -> new IllegalArgumentException("Best ball of an empty side"));
    }
}
