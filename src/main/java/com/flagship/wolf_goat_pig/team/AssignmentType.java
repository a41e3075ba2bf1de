package com.flagship.wolf_goat_pig.team;

public enum AssignmentType {
    SOLO,
    PARTNERSHIP,
    PARTNER_REQUESTED,
    DEFERRED
}
