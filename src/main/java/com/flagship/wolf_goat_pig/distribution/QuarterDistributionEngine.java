package com.flagship.wolf_goat_pig.distribution;

import com.flagship.wolf_goat_pig.config.EngineProperties;
import com.flagship.wolf_goat_pig.exception.InternalConsistencyException;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.scoring.Outcome;
import com.flagship.wolf_goat_pig.team.Side;
import com.flagship.wolf_goat_pig.team.Solo;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import com.flagship.wolf_goat_pig.wager.WagerState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a hole outcome and its locked wager into per-player points.
 *
 * With {@code U} the wager plus any incoming carry:
 * <ul>
 *   <li>Solo: the captain wins or loses {@code 3U}; a Duncan win pays
 *       {@code 3/2} of that.</li>
 *   <li>Partnership: each winner gets {@code 3U/2}, each loser pays it.</li>
 * </ul>
 * A side total is split by weight. Everyone weighs the same unless personal
 * stakes were taken; on the losing side an outlier's weight is doubled.
 *
 * Every result is checked to sum to zero before it is returned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuarterDistributionEngine {

    private static final Quarters DUNCAN_BONUS = Quarters.of(3, 2);
    private static final long OUTLIER_WEIGHT_FACTOR = 2;

    private final EngineProperties properties;

    /**
     * @param holeNumber hole being settled, recorded as the carry origin on a tie
     * @throws InternalConsistencyException if the deltas do not sum to zero
     */
    public DistributionResult distribute(Outcome outcome, WagerState wager, TeamAssignment assignment,
                                         CarryOver carryIn, int holeNumber) {
        if (!assignment.isScorable()) {
            throw new IllegalArgumentException("Cannot distribute points for an unresolved assignment");
        }
        List<PlayerId> players = new ArrayList<>(assignment.membersOf(Side.CAPTAIN));
        players.addAll(assignment.membersOf(Side.OPPONENTS));

        if (outcome.isTie()) {
            return settleTie(players, wager, carryIn, holeNumber);
        }

        long effectiveUnits = Math.addExact(wager.getCurrentUnits(), carryIn.getPendingUnits());
        Quarters captainSideTotal = captainSideTotal(outcome, assignment, Quarters.of(effectiveUnits));

        Map<PlayerId, Quarters> changes = new LinkedHashMap<>();
        split(captainSideTotal, assignment.membersOf(Side.CAPTAIN), outcome, Side.CAPTAIN, wager, changes);
        split(captainSideTotal.negate(), assignment.membersOf(Side.OPPONENTS), outcome, Side.OPPONENTS, wager, changes);

        PointsDelta delta = PointsDelta.of(changes);
        verifyZeroSum(delta, holeNumber);

        if (carryIn.isPending()) {
            log.info("Hole {} consumed {} carried units from hole {}",
                holeNumber, carryIn.getPendingUnits(), carryIn.getOriginHole());
        }
        return DistributionResult.builder()
            .delta(delta)
            .carryOut(CarryOver.none())
            .effectiveUnits(effectiveUnits)
            .forfeitedUnits(0)
            .build();
    }

    private DistributionResult settleTie(List<PlayerId> players, WagerState wager, CarryOver carryIn, int holeNumber) {
        CarryOver carried = carryIn.accumulate(holeNumber, wager.getCurrentUnits());
        DistributionResult.DistributionResultBuilder result = DistributionResult.builder()
            .delta(PointsDelta.zero(players))
            .effectiveUnits(carried.getPendingUnits());

        if (carried.getConsecutiveCarries() >= properties.getCarryOverLimit()) {
            log.warn("Hole {} tied for the {} time in a row; {} carried units forfeited",
                holeNumber, carried.getConsecutiveCarries(), carried.getPendingUnits());
            return result.carryOut(CarryOver.none()).forfeitedUnits(carried.getPendingUnits()).build();
        }

        log.info("Hole {} tied, carrying {} units (streak {})",
            holeNumber, carried.getPendingUnits(), carried.getConsecutiveCarries());
        return result.carryOut(carried).forfeitedUnits(0).build();
    }

    private Quarters captainSideTotal(Outcome outcome, TeamAssignment assignment, Quarters units) {
        boolean captainWins = outcome.getWinningSide() == Side.CAPTAIN;
        return switch (assignment.getType()) {
            case SOLO -> {
                Quarters stake = units.multiply(3);
                if (!captainWins) {
                    yield stake.negate();
                }
                yield ((Solo) assignment).isDeclaredBeforeResults() ? stake.multiply(DUNCAN_BONUS) : stake;
            }
            case PARTNERSHIP -> {
                Quarters stake = units.multiply(3);
                yield captainWins ? stake : stake.negate();
            }
            case DEFERRED, PARTNER_REQUESTED ->
                throw new IllegalArgumentException("Unresolved assignment has no payoff");
        };
    }

    private void split(Quarters sideTotal, List<PlayerId> members, Outcome outcome, Side side,
                       WagerState wager, Map<PlayerId, Quarters> changes) {
        boolean losing = outcome.getWinningSide() != side;
        Map<PlayerId, Quarters> weights = new LinkedHashMap<>();
        for (PlayerId member : members) {
            Quarters weight = wager.weightOf(member);
            if (losing && member.equals(outcome.getOutlier())) {
                weight = weight.multiply(OUTLIER_WEIGHT_FACTOR);
            }
            weights.put(member, weight);
        }
        Quarters totalWeight = Quarters.sum(weights.values());
        weights.forEach((member, weight) ->
            changes.put(member, sideTotal.multiply(weight).divide(totalWeight)));
    }

    private static void verifyZeroSum(PointsDelta delta, int holeNumber) {
        Quarters total = delta.total();
        if (!total.isZero()) {
            log.error("Hole {} points do not balance: sum={} deltas={}", holeNumber, total, delta.getChanges());
            throw new InternalConsistencyException(
                String.format("Hole %d points sum to %s instead of zero", holeNumber, total),
                Map.of("hole", String.valueOf(holeNumber), "sum", total.toString()));
        }
    }
}
