package com.flagship.wolf_goat_pig.team;

import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Value;

import java.util.List;

/**
 * Captain and one partner against the remaining two.
 *
 * {@code forced} is set when the special-phase default picked the partner
 * because the captain never declared.
 */
@Value
public class Partnership implements TeamAssignment {
    PlayerId captain;
    PlayerId partner;
    List<PlayerId> opponents;
    boolean forced;

    public Partnership(PlayerId captain, PlayerId partner, List<PlayerId> opponents, boolean forced) {
        this.captain = captain;
        this.partner = partner;
        this.opponents = List.copyOf(opponents);
        this.forced = forced;
        if (captain.equals(partner)) {
            throw new IllegalArgumentException("Captain cannot partner with themselves");
        }
        if (this.opponents.size() != 2 || this.opponents.contains(captain) || this.opponents.contains(partner)) {
            throw new IllegalArgumentException("Partnership needs two opponents distinct from the team");
        }
    }

    @Override
    public AssignmentType getType() {
        return AssignmentType.PARTNERSHIP;
    }

    @Override
    public List<PlayerId> membersOf(Side side) {
        return side == Side.CAPTAIN ? List.of(captain, partner) : opponents;
    }
}
