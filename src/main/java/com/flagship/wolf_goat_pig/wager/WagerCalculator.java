package com.flagship.wolf_goat_pig.wager;

import com.flagship.wolf_goat_pig.config.EngineProperties;
import com.flagship.wolf_goat_pig.exception.RejectionReason;
import com.flagship.wolf_goat_pig.exception.RuleRejectedException;
import com.flagship.wolf_goat_pig.round.Hole;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.team.SpecialInvocation;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes the opening wager of a hole.
 *
 * Rules apply in this order:
 * 1. base units
 * 2. solo: x2
 * 3. double-points window: x2 (stacks with solo)
 * 4. low player sets stakes: overrides 1-3 with a value from the allowed set
 * 5. personal opt-ins: per-player stakes above the team value
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WagerCalculator {

    private final EngineProperties properties;

    /**
     * @throws RuleRejectedException if an invocation is not allowed on this hole
     * @throws IllegalArgumentException if the assignment is not scorable
     */
    public WagerState computeBaseWager(Hole hole, TeamAssignment assignment, List<SpecialInvocation> invocations) {
        WagerState wager = WagerState.initial(properties.getBaseUnits());

        wager = switch (assignment.getType()) {
            case SOLO -> wager.multiply(WagerRule.SOLO, 2, null);
            case PARTNERSHIP -> wager;
            case DEFERRED, PARTNER_REQUESTED ->
                throw new IllegalArgumentException("An unresolved assignment has no wager");
        };

        if (properties.isDoublePointsHole(hole.getNumber())) {
            wager = wager.multiply(WagerRule.DOUBLE_POINTS_WINDOW, 2, null);
        }

        List<SpecialInvocation.PersonalOptIn> optIns = new ArrayList<>();
        boolean stakesSet = false;
        for (SpecialInvocation invocation : invocations) {
            if (invocation == null) {
                throw new RuleRejectedException(RejectionReason.INVALID_DECLARATION,
                    "Special invocations must not contain null entries");
            }
            wager = switch (invocation.getKind()) {
                case LOW_PLAYER_SETS_STAKES -> {
                    if (stakesSet) {
                        throw new RuleRejectedException(RejectionReason.INVALID_CUSTOM_WAGER,
                            "Stakes can only be set once per hole");
                    }
                    stakesSet = true;
                    yield applyCustomWager(hole, wager, (SpecialInvocation.LowPlayerSetsStakes) invocation);
                }
                case PERSONAL_OPT_IN -> {
                    optIns.add((SpecialInvocation.PersonalOptIn) invocation);
                    yield wager;
                }
                // payoff shape and formation only
                case DUNCAN, BIG_DICK -> wager;
            };
        }

        for (SpecialInvocation.PersonalOptIn optIn : optIns) {
            wager = applyOptIn(wager, assignment, optIn);
        }

        log.debug("Hole {} opening wager: {} units ({} events)",
            hole.getNumber(), wager.getCurrentUnits(), wager.getEvents().size());
        return wager;
    }

    private WagerState applyCustomWager(Hole hole, WagerState wager, SpecialInvocation.LowPlayerSetsStakes custom) {
        if (!hole.isSpecialPhase()) {
            throw new RuleRejectedException(RejectionReason.CUSTOM_WAGER_OUTSIDE_SPECIAL_PHASE,
                String.format("Stakes can only be set in the special phase, hole %d is not", hole.getNumber()),
                Map.of("hole", String.valueOf(hole.getNumber())));
        }
        if (!properties.getCustomWagerValues().contains(custom.getUnits())) {
            throw new RuleRejectedException(RejectionReason.INVALID_CUSTOM_WAGER,
                String.format("Stakes must be one of %s, got %d",
                    properties.getCustomWagerValues(), custom.getUnits()));
        }
        log.info("Hole {}: low player sets stakes to {} (was {})",
            hole.getNumber(), custom.getUnits(), wager.getCurrentUnits());
        return wager.override(WagerRule.LOW_PLAYER_SETS_STAKES, custom.getUnits());
    }

    private WagerState applyOptIn(WagerState wager, TeamAssignment assignment, SpecialInvocation.PersonalOptIn optIn) {
        PlayerId player = optIn.getPlayer();
        if (player == null || assignment.sideOf(player).isEmpty()) {
            throw new RuleRejectedException(RejectionReason.UNKNOWN_PLAYER,
                "Opt-in by a player not playing this hole: " + player);
        }
        if (wager.hasPersonalStake(player)) {
            throw new RuleRejectedException(RejectionReason.DUPLICATE_OPT_IN,
                String.format("Player %s has already opted in on this hole", player));
        }
        if (optIn.getStake() <= wager.getCurrentUnits()) {
            throw new RuleRejectedException(RejectionReason.OPT_IN_STAKE_TOO_LOW,
                String.format("Opt-in stake %d must exceed the team wager of %d",
                    optIn.getStake(), wager.getCurrentUnits()),
                Map.of("player", player.getValue(),
                    "stake", String.valueOf(optIn.getStake()),
                    "teamWager", String.valueOf(wager.getCurrentUnits())));
        }
        return wager.withPersonalStake(player, optIn.getStake());
    }
}
