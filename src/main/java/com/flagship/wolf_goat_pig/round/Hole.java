package com.flagship.wolf_goat_pig.round;

import lombok.Value;

/**
 * A hole of the round. The special phase flag marks the terminal holes where
 * the low player takes captaincy and may set the stakes.
 */
@Value
public class Hole {
    int number;
    int par;
    boolean specialPhase;
}
