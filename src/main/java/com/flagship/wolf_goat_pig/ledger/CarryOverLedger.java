package com.flagship.wolf_goat_pig.ledger;

import com.flagship.wolf_goat_pig.distribution.CarryOver;
import com.flagship.wolf_goat_pig.distribution.DistributionResult;

/**
 * Pending carry-over of one round.
 *
 * Only {@link #commit(DistributionResult)} changes it, and only after the
 * round ledger accepted the same hole.
 */
public class CarryOverLedger {

    private CarryOver current = CarryOver.none();
    private long totalForfeited;

    public CarryOver current() {
        return current;
    }

    public long totalForfeited() {
        return totalForfeited;
    }

    public void commit(DistributionResult result) {
        this.current = result.getCarryOut();
        this.totalForfeited = Math.addExact(totalForfeited, result.getForfeitedUnits());
    }
}
