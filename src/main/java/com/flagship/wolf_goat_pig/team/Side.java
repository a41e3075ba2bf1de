package com.flagship.wolf_goat_pig.team;

/**
 * One of the two sides of a hole: the captain's side (captain alone when solo)
 * and the opponents.
 */
public enum Side {
    CAPTAIN,
    OPPONENTS;

    public Side opposite() {
        return this == CAPTAIN ? OPPONENTS : CAPTAIN;
    }
}
