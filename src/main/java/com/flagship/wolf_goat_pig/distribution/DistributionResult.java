package com.flagship.wolf_goat_pig.distribution;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DistributionResult {
    PointsDelta delta;
    CarryOver carryOut;
    /**
     * Wager plus incoming carry the hole was settled at.
     */
    long effectiveUnits;
    /**
     * Units written off because the carry-over limit was reached; 0 otherwise.
     */
    long forfeitedUnits;

    public boolean isForfeited() {
        return forfeitedUnits > 0;
    }
}
