package com.flagship.wolf_goat_pig.wager;

import com.flagship.wolf_goat_pig.exception.RejectionReason;
import com.flagship.wolf_goat_pig.exception.RuleRejectedException;
import com.flagship.wolf_goat_pig.team.Side;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pre-hole escalation of the wager.
 *
 * Either side may double when no counter is pending. The other side then holds
 * exactly one counter: redouble (which hands the counter back) or decline
 * (which closes the chain). There is no depth cap.
 *
 * A batch of requests is applied all-or-nothing.
 */
@Component
@Slf4j
public class DoublingNegotiator {

    /**
     * Marks The Option as pending for the captain's side.
     */
    public WagerState offerOption(WagerState wager) {
        return wager.withOptionPending(true);
    }

    /**
     * Applies escalation requests in order.
     *
     * @return the escalated wager; the input is never modified
     * @throws RuleRejectedException {@link RejectionReason#LATE_ESCALATION} once
     *         locked, {@link RejectionReason#NOT_DECLARED} before teams exist,
     *         {@link RejectionReason#INVALID_ESCALATION} for an out-of-turn move
     */
    public WagerState negotiate(WagerState wager, TeamAssignment assignment, List<EscalationRequest> requests) {
        if (wager.isLocked()) {
            throw new RuleRejectedException(RejectionReason.LATE_ESCALATION,
                "Strokes have been recorded; the wager is locked");
        }
        if (assignment == null || !assignment.isScorable()) {
            throw new RuleRejectedException(RejectionReason.NOT_DECLARED,
                "Teams must be declared before the wager can be escalated");
        }

        if (requests == null) {
            throw invalid("Escalation requests are required");
        }

        WagerState working = wager;
        for (EscalationRequest request : requests) {
            working = apply(working, request);
        }
        if (working.getCurrentUnits() != wager.getCurrentUnits()) {
            log.info("Wager escalated from {} to {} units", wager.getCurrentUnits(), working.getCurrentUnits());
        }
        return working;
    }

    /**
     * Locks the wager, folding in The Option unless it was declined.
     */
    public WagerState lock(WagerState wager) {
        WagerState locked = wager.lock();
        if (wager.isOptionPending()) {
            log.info("The Option applied at lock: {} -> {} units", wager.getCurrentUnits(), locked.getCurrentUnits());
        }
        return locked;
    }

    private WagerState apply(WagerState wager, EscalationRequest request) {
        if (request == null) {
            throw invalid("Escalation requests must not contain null entries");
        }
        Side side = request.getSide();
        if (side == null || request.getKind() == null) {
            throw invalid("Escalation needs a side and a kind");
        }
        Side counter = wager.getPendingCounter();

        return switch (request.getKind()) {
            case DOUBLE -> {
                if (counter != null) {
                    throw invalid(String.format("%s must answer the pending escalation before a new double", counter));
                }
                yield wager.multiply(WagerRule.DOUBLE, 2, side).withPendingCounter(side.opposite());
            }
            case REDOUBLE -> {
                if (counter != side) {
                    throw invalid(String.format("%s holds no counter to redouble", side));
                }
                yield wager.multiply(WagerRule.REDOUBLE, 2, side).withPendingCounter(side.opposite());
            }
            case DECLINE -> {
                if (counter != side) {
                    throw invalid(String.format("%s has no pending escalation to decline", side));
                }
                yield wager.withPendingCounter(null);
            }
            case DECLINE_OPTION -> {
                if (side != Side.CAPTAIN || !wager.isOptionPending()) {
                    throw invalid("Only the captain can decline a pending Option");
                }
                yield wager.withOptionPending(false);
            }
        };
    }

    private static RuleRejectedException invalid(String message) {
        return new RuleRejectedException(RejectionReason.INVALID_ESCALATION, message);
    }
}
