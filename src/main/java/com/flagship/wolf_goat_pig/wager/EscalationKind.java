package com.flagship.wolf_goat_pig.wager;

public enum EscalationKind {
    DOUBLE,
    REDOUBLE,
    DECLINE,
    DECLINE_OPTION
}
