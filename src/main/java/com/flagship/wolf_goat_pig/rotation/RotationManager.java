package com.flagship.wolf_goat_pig.rotation;

import com.flagship.wolf_goat_pig.config.EngineProperties;
import com.flagship.wolf_goat_pig.exception.RejectionReason;
import com.flagship.wolf_goat_pig.exception.RuleRejectedException;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.round.RoundSetup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Derives the captain and tee order of every hole.
 *
 * Normal phase: captaincy moves one seat along the base order each hole.
 * Special phase: the player with the worst running total takes the captain
 * slot ("choose your spot"), ties going to the lower tee-order index. The
 * others follow in their normal rotated order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RotationManager {

    public static final int FLOAT_TOKENS_PER_ROUND = 1;

    private final EngineProperties properties;

    /**
     * Rotation for hole 1: the first player of the base order is captain.
     */
    public RotationState start(RoundSetup setup) {
        List<PlayerId> baseOrder = setup.playerIds();
        boolean special = properties.isSpecialPhaseHole(1, setup.holeCount());
        return new RotationState(1, special, 0, 0, baseOrder, baseOrder, Map.of());
    }

    /**
     * Rotation for the hole after {@code previous}.
     *
     * @param runningTotals cumulative points before the new hole, used in the
     *                      special phase only
     * @throws IllegalStateException if {@code previous} is the final hole
     */
    public RotationState advance(RotationState previous, RoundSetup setup, Map<PlayerId, Quarters> runningTotals) {
        if (previous.getHoleNumber() >= setup.holeCount()) {
            throw new IllegalStateException(
                String.format("Cannot advance past final hole %d", setup.holeCount()));
        }

        int nextHole = previous.getHoleNumber() + 1;
        List<PlayerId> baseOrder = previous.getBaseOrder();
        int pointer = (previous.getRotationPointer() + 1) % baseOrder.size();
        boolean special = properties.isSpecialPhaseHole(nextHole, setup.holeCount());

        List<PlayerId> rotated = rotate(baseOrder, pointer);
        if (!special) {
            log.debug("Hole {} captain by rotation: {}", nextHole, rotated.get(0));
            return new RotationState(nextHole, false, pointer, pointer, baseOrder, rotated,
                previous.getFloatTokensSpent());
        }

        PlayerId lowPlayer = worstFirst(baseOrder, runningTotals).get(0);
        List<PlayerId> teeOrder = new ArrayList<>();
        teeOrder.add(lowPlayer);
        rotated.stream().filter(p -> !p.equals(lowPlayer)).forEach(teeOrder::add);

        log.info("Hole {} is special phase, low player {} takes captaincy", nextHole, lowPlayer);
        return new RotationState(nextHole, true, pointer, baseOrder.indexOf(lowPlayer), baseOrder, teeOrder,
            previous.getFloatTokensSpent());
    }

    /**
     * Records a Float for {@code player}.
     *
     * @throws RuleRejectedException with {@link RejectionReason#RULE_ALREADY_USED}
     *         if the player's Float budget is spent; {@code state} is untouched
     */
    public RotationState spendFloat(RotationState state, PlayerId player) {
        if (state.floatTokensSpentBy(player) >= FLOAT_TOKENS_PER_ROUND) {
            throw new RuleRejectedException(RejectionReason.RULE_ALREADY_USED,
                String.format("Player %s has already used their Float this round", player),
                Map.of("player", player.getValue(), "rule", "FLOAT"));
        }
        return state.withFloatSpent(player);
    }

    /**
     * The Option is pending when the captain is the furthest-down player
     * (ties included) and that player is below zero.
     */
    public boolean isOptionPending(RotationState state, Map<PlayerId, Quarters> runningTotals) {
        Quarters lowest = state.getBaseOrder().stream()
            .map(p -> runningTotals.getOrDefault(p, Quarters.ZERO))
            .min(Comparator.naturalOrder())
            .orElse(Quarters.ZERO);
        Quarters captainTotal = runningTotals.getOrDefault(state.getCaptain(), Quarters.ZERO);
        return lowest.signum() < 0 && captainTotal.equals(lowest);
    }

    /**
     * Players ordered from worst running total to best, ties by base order.
     */
    public List<PlayerId> worstFirst(List<PlayerId> baseOrder, Map<PlayerId, Quarters> runningTotals) {
        Comparator<PlayerId> byTotal = Comparator.comparing(p -> runningTotals.getOrDefault(p, Quarters.ZERO));
        return baseOrder.stream()
            .sorted(byTotal.thenComparingInt(baseOrder::indexOf))
            .toList();
    }

    private static List<PlayerId> rotate(List<PlayerId> order, int start) {
        List<PlayerId> rotated = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            rotated.add(order.get((start + i) % order.size()));
        }
        return rotated;
    }
}
