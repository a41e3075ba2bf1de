package com.flagship.wolf_goat_pig.distribution;

import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signed points change per player for one hole or correction.
 *
 * Invariant: a delta that is committed sums to exactly zero.
 */
@Value
public class PointsDelta {
    Map<PlayerId, Quarters> changes;

    private PointsDelta(Map<PlayerId, Quarters> changes) {
        this.changes = Collections.unmodifiableMap(new LinkedHashMap<>(changes));
    }

    public static PointsDelta of(Map<PlayerId, Quarters> changes) {
        changes.forEach((player, amount) -> {
            if (player == null || amount == null) {
                throw new IllegalArgumentException("Delta entries need a player and an amount");
            }
        });
        return new PointsDelta(changes);
    }

    /**
     * All-zero delta for the given players.
     */
    public static PointsDelta zero(Collection<PlayerId> players) {
        Map<PlayerId, Quarters> changes = new LinkedHashMap<>();
        players.forEach(p -> changes.put(p, Quarters.ZERO));
        return new PointsDelta(changes);
    }

    public Quarters changeOf(PlayerId player) {
        return changes.getOrDefault(player, Quarters.ZERO);
    }

    public Quarters total() {
        return Quarters.sum(changes.values());
    }

    public boolean isZeroSum() {
        return total().isZero();
    }

    public boolean isAllZero() {
        return changes.values().stream().allMatch(Quarters::isZero);
    }
}
