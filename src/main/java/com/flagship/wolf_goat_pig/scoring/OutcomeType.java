package com.flagship.wolf_goat_pig.scoring;

public enum OutcomeType {
    CAPTAIN_WINS,
    OPPONENTS_WIN,
    TIE,
    /**
     * A side won, but a losing player's blow-up shifts how the losing side pays.
     */
    UNEVEN_PAYOFF
}
