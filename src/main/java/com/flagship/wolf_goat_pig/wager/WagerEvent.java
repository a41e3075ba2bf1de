package com.flagship.wolf_goat_pig.wager;

import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.team.Side;
import lombok.Value;

/**
 * One applied multiplier or override, in application order.
 * {@code player} is set for personal opt-ins, {@code side} for escalations.
 */
@Value
public class WagerEvent {
    WagerRule rule;
    long unitsBefore;
    long unitsAfter;
    PlayerId player;
    Side side;
}
