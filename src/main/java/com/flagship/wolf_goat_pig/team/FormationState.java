package com.flagship.wolf_goat_pig.team;

/**
 * States of the per-hole team formation machine.
 *
 * AWAITING_DECLARATION -> SOLO | PARTNERSHIP | PARTNER_PENDING | DEFERRED
 * DEFERRED -> SOLO | PARTNERSHIP | PARTNER_PENDING
 * PARTNER_PENDING -> PARTNERSHIP (accepted) | SOLO (declined)
 */
public enum FormationState {
    AWAITING_DECLARATION,
    DEFERRED,
    PARTNER_PENDING,
    SOLO,
    PARTNERSHIP;

    public boolean isResolved() {
        return this == SOLO || this == PARTNERSHIP;
    }
}
