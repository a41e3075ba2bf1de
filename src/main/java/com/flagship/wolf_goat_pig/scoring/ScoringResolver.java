package com.flagship.wolf_goat_pig.scoring;

import com.flagship.wolf_goat_pig.config.EngineProperties;
import com.flagship.wolf_goat_pig.exception.ValidationException;
import com.flagship.wolf_goat_pig.exception.ValidationFailure;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.team.Side;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides who won a hole from strokes and teams.
 *
 * Best ball per side: the lower side minimum wins, equal minimums tie no matter
 * what the other balls were. The resolver holds no state; the same inputs
 * always produce the same {@link Outcome}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScoringResolver {

    private final EngineProperties properties;

    /**
     * @throws ValidationException if the score set does not match the teams
     */
    public Outcome resolve(ScoreSet scores, TeamAssignment assignment) {
        validate(scores, assignment);

        int captainBest = scores.bestBall(assignment.membersOf(Side.CAPTAIN));
        int opponentsBest = scores.bestBall(assignment.membersOf(Side.OPPONENTS));

        if (captainBest == opponentsBest) {
            log.debug("Hole {} tied on best ball {}", scores.getHoleNumber(), captainBest);
            return Outcome.builder()
                .type(OutcomeType.TIE)
                .captainBestBall(captainBest)
                .opponentsBestBall(opponentsBest)
                .build();
        }

        Side winner = captainBest < opponentsBest ? Side.CAPTAIN : Side.OPPONENTS;
        Optional<PlayerId> outlier = findOutlier(scores, assignment, winner.opposite());

        OutcomeType type = outlier.isPresent()
            ? OutcomeType.UNEVEN_PAYOFF
            : winner == Side.CAPTAIN ? OutcomeType.CAPTAIN_WINS : OutcomeType.OPPONENTS_WIN;

        return Outcome.builder()
            .type(type)
            .winningSide(winner)
            .captainBestBall(captainBest)
            .opponentsBestBall(opponentsBest)
            .outlier(outlier.orElse(null))
            .build();
    }

    /**
     * A player who finished at least the threshold behind every other player,
     * counted only when on the losing side with a teammate.
     */
    private Optional<PlayerId> findOutlier(ScoreSet scores, TeamAssignment assignment, Side losingSide) {
        List<PlayerId> losers = assignment.membersOf(losingSide);
        if (losers.size() < 2) {
            return Optional.empty();
        }
        for (PlayerId candidate : losers) {
            int candidateStrokes = scores.getStrokes().get(candidate);
            boolean clear = scores.getStrokes().entrySet().stream()
                .filter(e -> !e.getKey().equals(candidate))
                .allMatch(e -> candidateStrokes - e.getValue() >= properties.getOutlierThreshold());
            if (clear) {
                log.info("Hole {}: {} is an outlier at {} strokes", scores.getHoleNumber(), candidate, candidateStrokes);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private void validate(ScoreSet scores, TeamAssignment assignment) {
        if (assignment == null || !assignment.isScorable()) {
            throw new ValidationException(ValidationFailure.ASSIGNMENT_NOT_SCORABLE,
                "Teams must be resolved before strokes can be scored");
        }

        List<PlayerId> players = new ArrayList<>(assignment.membersOf(Side.CAPTAIN));
        players.addAll(assignment.membersOf(Side.OPPONENTS));

        List<String> missing = players.stream()
            .filter(p -> !scores.getStrokes().containsKey(p))
            .map(PlayerId::getValue)
            .sorted()
            .toList();
        if (!missing.isEmpty()) {
            throw new ValidationException(ValidationFailure.MISSING_STROKES,
                "Missing strokes for " + missing, Map.of("players", String.join(",", missing)));
        }

        List<String> unknown = scores.getStrokes().keySet().stream()
            .filter(p -> !players.contains(p))
            .map(PlayerId::getValue)
            .sorted()
            .toList();
        if (!unknown.isEmpty()) {
            throw new ValidationException(ValidationFailure.UNKNOWN_PLAYER,
                "Strokes submitted for players not on this hole: " + unknown,
                Map.of("players", String.join(",", unknown)));
        }

        scores.getStrokes().forEach((player, strokes) -> {
            if (strokes == null || strokes < 1) {
                throw new ValidationException(ValidationFailure.INVALID_STROKES,
                    String.format("Strokes for %s must be at least 1, got %s", player, strokes),
                    Map.of("player", player.getValue()));
            }
        });
    }
}
