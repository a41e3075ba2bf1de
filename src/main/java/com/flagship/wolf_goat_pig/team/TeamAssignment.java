package com.flagship.wolf_goat_pig.team;

import com.flagship.wolf_goat_pig.round.PlayerId;

import java.util.List;
import java.util.Optional;

/**
 * How the players are split for one hole.
 *
 * Closed set of variants. Consumers switch on {@link #getType()} so that a new
 * variant fails compilation wherever it is not handled.
 */
public sealed interface TeamAssignment permits Solo, Partnership, PartnerRequest, Deferred {

    AssignmentType getType();

    PlayerId getCaptain();

    /**
     * Whether strokes can be resolved against this assignment.
     * {@link Deferred} and {@link PartnerRequest} never are.
     */
    default boolean isScorable() {
        return getType() == AssignmentType.SOLO || getType() == AssignmentType.PARTNERSHIP;
    }

    /**
     * Members of the given side.
     *
     * @throws IllegalStateException for an unresolved assignment
     */
    List<PlayerId> membersOf(Side side);

    default Optional<Side> sideOf(PlayerId player) {
        if (!isScorable()) {
            return Optional.empty();
        }
        if (membersOf(Side.CAPTAIN).contains(player)) {
            return Optional.of(Side.CAPTAIN);
        }
        if (membersOf(Side.OPPONENTS).contains(player)) {
            return Optional.of(Side.OPPONENTS);
        }
        return Optional.empty();
    }
}
