package com.flagship.wolf_goat_pig.team;

import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Value;

import java.util.List;

/**
 * The captain asked a player to partner and is waiting for the answer.
 * Becomes a {@link Partnership} if accepted and a {@link Solo} if declined.
 */
@Value
public class PartnerRequest implements TeamAssignment {
    PlayerId captain;
    PlayerId requested;

    @Override
    public AssignmentType getType() {
        return AssignmentType.PARTNER_REQUESTED;
    }

    @Override
    public List<PlayerId> membersOf(Side side) {
        throw new IllegalStateException("Partner request has not been answered yet");
    }
}
