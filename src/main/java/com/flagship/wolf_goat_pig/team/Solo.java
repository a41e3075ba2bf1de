package com.flagship.wolf_goat_pig.team;

import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Value;

import java.util.List;

/**
 * Captain against the other three.
 *
 * {@code declaredBeforeResults} is the Duncan flag and changes the winning
 * payoff shape only. {@code bigDick} marks a final-hole solo invoked by a
 * player other than the rotation captain; that player is the captain here.
 */
@Value
public class Solo implements TeamAssignment {
    PlayerId captain;
    List<PlayerId> opponents;
    boolean declaredBeforeResults;
    boolean bigDick;

    public Solo(PlayerId captain, List<PlayerId> opponents, boolean declaredBeforeResults, boolean bigDick) {
        this.captain = captain;
        this.opponents = List.copyOf(opponents);
        this.declaredBeforeResults = declaredBeforeResults;
        this.bigDick = bigDick;
        if (this.opponents.size() != 3 || this.opponents.contains(captain)) {
            throw new IllegalArgumentException("Solo needs three opponents distinct from the captain");
        }
    }

    @Override
    public AssignmentType getType() {
        return AssignmentType.SOLO;
    }

    @Override
    public List<PlayerId> membersOf(Side side) {
        return side == Side.CAPTAIN ? List.of(captain) : opponents;
    }
}
