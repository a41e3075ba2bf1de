package com.flagship.wolf_goat_pig.distribution;

import lombok.Value;

/**
 * Units pushed forward by consecutive tied holes.
 *
 * {@code originHole} is the first tied hole of the current streak, 0 when
 * nothing is pending.
 */
@Value
public class CarryOver {
    private static final CarryOver NONE = new CarryOver(0, 0, 0);

    long pendingUnits;
    int originHole;
    int consecutiveCarries;

    public static CarryOver none() {
        return NONE;
    }

    public boolean isPending() {
        return pendingUnits > 0;
    }

    /**
     * Adds a tied hole's wager to the streak.
     */
    public CarryOver accumulate(int holeNumber, long units) {
        int origin = isPending() ? originHole : holeNumber;
        return new CarryOver(Math.addExact(pendingUnits, units), origin, consecutiveCarries + 1);
    }
}
