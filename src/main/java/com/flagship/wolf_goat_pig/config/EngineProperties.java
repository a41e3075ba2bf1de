package com.flagship.wolf_goat_pig.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule configuration for the quarters engine.
 *
 * Bound from {@code wgp.engine.*}. Defaults describe the standard four-player
 * round: the last two holes are the special phase, holes 13-16 play for double
 * points, a tie may carry over at most three holes in a row.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "wgp.engine")
public class EngineProperties {

    /**
     * Starting wager of every hole, in quarters.
     */
    @Min(1)
    private int baseUnits = 1;

    /**
     * Number of terminal holes played under special-phase rules.
     */
    @Min(1)
    @Max(2)
    private int specialPhaseHoles = 2;

    @Min(1)
    private int doublePointsStartHole = 13;

    @Min(1)
    private int doublePointsEndHole = 16;

    /**
     * Consecutive tied holes after which the pending carry-over is forfeited.
     */
    @Min(1)
    private int carryOverLimit = 3;

    /**
     * Strokes by which one player must trail every other player for the
     * uneven distribution to apply.
     */
    @Min(1)
    private int outlierThreshold = 3;

    /**
     * Values the low player may choose from when setting stakes in the
     * special phase.
     */
    @NotEmpty
    private List<Integer> customWagerValues = new ArrayList<>(List.of(2, 4, 8));

    @AssertTrue(message = "doublePointsStartHole must not be after doublePointsEndHole")
    public boolean isDoublePointsWindowOrdered() {
        return doublePointsStartHole <= doublePointsEndHole;
    }

    public boolean isDoublePointsHole(int holeNumber) {
        return holeNumber >= doublePointsStartHole && holeNumber <= doublePointsEndHole;
    }

    public boolean isSpecialPhaseHole(int holeNumber, int holeCount) {
        return holeNumber > holeCount - specialPhaseHoles;
    }
}
