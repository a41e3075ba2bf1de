package com.flagship.wolf_goat_pig.engine;

import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.team.FormationState;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only view of the hole in play.
 *
 * {@code wagerUnits} is 0 until teams are declared and includes a pending
 * Option once they are.
 */
@Value
@Builder
public class HoleSnapshot {
    int holeNumber;
    int par;
    boolean specialPhase;
    PlayerId captain;
    List<PlayerId> teeOrder;
    FormationState formationState;
    TeamAssignment assignment;
    long wagerUnits;
    boolean optionPending;
    boolean wagerLocked;
    boolean strokesSubmitted;
}
