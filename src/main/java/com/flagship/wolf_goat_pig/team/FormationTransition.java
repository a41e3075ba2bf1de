package com.flagship.wolf_goat_pig.team;

import com.flagship.wolf_goat_pig.rotation.RotationState;
import lombok.Value;

/**
 * Result of a successful declaration: the new formation state, the assignment
 * it produced and the rotation state (changed only when a Float was spent).
 */
@Value
public class FormationTransition {
    FormationState state;
    TeamAssignment assignment;
    RotationState rotation;
}
