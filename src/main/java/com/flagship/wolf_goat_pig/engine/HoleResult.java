package com.flagship.wolf_goat_pig.engine;

import com.flagship.wolf_goat_pig.distribution.CarryOver;
import com.flagship.wolf_goat_pig.distribution.PointsDelta;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.scoring.Outcome;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * What a committed hole produced.
 */
@Value
@Builder
public class HoleResult {
    int holeNumber;
    Outcome outcome;
    long wagerUnits;
    long effectiveUnits;
    PointsDelta delta;
    Map<PlayerId, Quarters> runningTotals;
    boolean zeroSumCheck;
    CarryOver carryOver;
    long forfeitedUnits;
    boolean roundComplete;
}
