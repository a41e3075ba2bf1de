package com.flagship.wolf_goat_pig.exception;

public enum RejectionReason {
    INVALID_PARTNER,
    UNKNOWN_PLAYER,
    RULE_ALREADY_USED,
    INVALID_DECLARATION,
    ALREADY_DECLARED,
    PARTNER_REQUEST_PENDING,
    NO_PENDING_PARTNER_REQUEST,
    NOT_DECLARED,
    BIG_DICK_OUTSIDE_FINAL_HOLE,
    CUSTOM_WAGER_OUTSIDE_SPECIAL_PHASE,
    INVALID_CUSTOM_WAGER,
    OPT_IN_STAKE_TOO_LOW,
    DUPLICATE_OPT_IN,
    INVALID_ESCALATION,
    LATE_ESCALATION
}
