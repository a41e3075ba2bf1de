package com.flagship.wolf_goat_pig.exception;

public enum ValidationFailure {
    MISSING_STROKES,
    INVALID_STROKES,
    UNKNOWN_PLAYER,
    ASSIGNMENT_NOT_SCORABLE,
    TEAMS_NOT_DECLARED,
    STROKES_ALREADY_SUBMITTED,
    STROKES_NOT_SUBMITTED,
    HOLE_NOT_ACTIVE,
    HOLE_ALREADY_COMMITTED,
    HOLE_OUT_OF_SEQUENCE,
    ROUND_COMPLETE,
    UNBALANCED_CORRECTION
}
