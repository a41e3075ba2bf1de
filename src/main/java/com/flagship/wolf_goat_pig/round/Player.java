package com.flagship.wolf_goat_pig.round;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A player seated for the round.
 *
 * The handicap is carried for the surrounding collaborators only; strokes are
 * submitted to the engine already net of any handicap adjustment.
 */
@Value
public class Player {
    PlayerId id;
    String name;
    int teeOrderIndex;
    BigDecimal handicap;
}
