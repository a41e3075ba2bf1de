package com.flagship.wolf_goat_pig.team;

import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Value;

import java.util.List;

/**
 * The captain floated the decision. Must become {@link Solo} or
 * {@link Partnership} before strokes are scored.
 */
@Value
public class Deferred implements TeamAssignment {
    PlayerId invokedBy;

    @Override
    public AssignmentType getType() {
        return AssignmentType.DEFERRED;
    }

    @Override
    public PlayerId getCaptain() {
        return invokedBy;
    }

    @Override
    public List<PlayerId> membersOf(Side side) {
        throw new IllegalStateException("Deferred assignment has no sides yet");
    }
}
