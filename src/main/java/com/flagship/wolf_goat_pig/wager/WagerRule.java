package com.flagship.wolf_goat_pig.wager;

/**
 * The rule that produced a change to a hole's wager.
 */
public enum WagerRule {
    BASE,
    SOLO,
    DOUBLE_POINTS_WINDOW,
    LOW_PLAYER_SETS_STAKES,
    PERSONAL_OPT_IN,
    DOUBLE,
    REDOUBLE,
    THE_OPTION
}
