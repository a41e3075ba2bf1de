package com.flagship.wolf_goat_pig.wager;

import com.flagship.wolf_goat_pig.team.Side;
import lombok.Value;

/**
 * A single move in the pre-hole doubling negotiation.
 */
@Value
public class EscalationRequest {
    Side side;
    EscalationKind kind;

    public static EscalationRequest doubleBy(Side side) {
        return new EscalationRequest(side, EscalationKind.DOUBLE);
    }

    public static EscalationRequest redoubleBy(Side side) {
        return new EscalationRequest(side, EscalationKind.REDOUBLE);
    }

    public static EscalationRequest declineBy(Side side) {
        return new EscalationRequest(side, EscalationKind.DECLINE);
    }

    public static EscalationRequest declineOption() {
        return new EscalationRequest(Side.CAPTAIN, EscalationKind.DECLINE_OPTION);
    }
}
