package com.flagship.wolf_goat_pig.engine;

import com.flagship.wolf_goat_pig.rotation.RotationState;
import com.flagship.wolf_goat_pig.round.Hole;
import com.flagship.wolf_goat_pig.scoring.Outcome;
import com.flagship.wolf_goat_pig.scoring.ScoreSet;
import com.flagship.wolf_goat_pig.team.FormationState;
import com.flagship.wolf_goat_pig.team.SpecialInvocation;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import com.flagship.wolf_goat_pig.wager.WagerState;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Working state of the hole currently in play. Owned by a single
 * {@link RoundEngine}; every field is replaced only after the operation that
 * produced the new value has fully succeeded.
 */
@Getter
@Setter
class HoleSession {
    private final Hole hole;
    private RotationState rotation;
    private FormationState formationState = FormationState.AWAITING_DECLARATION;
    private TeamAssignment assignment;
    /**
     * Invocations given with a partner request, applied once it is answered.
     */
    private List<SpecialInvocation> pendingInvocations = List.of();
    private WagerState wager;
    private ScoreSet scores;
    private Outcome outcome;

    HoleSession(Hole hole, RotationState rotation) {
        this.hole = hole;
        this.rotation = rotation;
    }

    boolean isStrokesSubmitted() {
        return outcome != null;
    }
}
