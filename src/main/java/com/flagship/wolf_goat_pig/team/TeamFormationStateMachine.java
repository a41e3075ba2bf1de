package com.flagship.wolf_goat_pig.team;

import com.flagship.wolf_goat_pig.exception.RejectionReason;
import com.flagship.wolf_goat_pig.exception.RuleRejectedException;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.rotation.RotationManager;
import com.flagship.wolf_goat_pig.rotation.RotationState;
import com.flagship.wolf_goat_pig.round.Hole;
import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Drives the captain's team formation decision for a hole.
 *
 * Pure: every method returns a new {@link FormationTransition} and never
 * touches its inputs, so a rejected declaration leaves the caller's rotation
 * state and assignment exactly as they were.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TeamFormationStateMachine {

    private final RotationManager rotationManager;

    /**
     * Applies a captain's declaration.
     *
     * @param hole      the hole being played
     * @param holeCount number of holes in the round (Big Dick is final-hole only)
     * @param rotation  current rotation; the captain is its first tee
     * @param current   formation state before the declaration
     * @throws RuleRejectedException if a rule forbids the declaration
     */
    public FormationTransition declare(Hole hole, int holeCount, RotationState rotation,
                                       FormationState current, Declaration declaration) {
        if (declaration == null || declaration.getChoice() == null) {
            throw new RuleRejectedException(RejectionReason.INVALID_DECLARATION, "A captain choice is required");
        }
        if (declaration.getInvocations().contains(null)) {
            throw new RuleRejectedException(RejectionReason.INVALID_DECLARATION,
                "Special invocations must not contain null entries");
        }
        if (current.isResolved()) {
            throw new RuleRejectedException(RejectionReason.ALREADY_DECLARED,
                String.format("Teams for hole %d are already declared (%s)", hole.getNumber(), current));
        }
        if (current == FormationState.PARTNER_PENDING) {
            throw new RuleRejectedException(RejectionReason.PARTNER_REQUEST_PENDING,
                String.format("Hole %d has a partner request waiting for an answer", hole.getNumber()));
        }

        PlayerId captain = rotation.getCaptain();

        return switch (declaration.getChoice()) {
            case FLOAT -> floatDecision(hole, rotation, current, declaration, captain);
            case SOLO -> solo(hole, holeCount, rotation, declaration, captain);
            case PARTNER -> partnership(rotation, declaration, captain);
            case REQUEST_PARTNER -> partnerRequest(hole, rotation, declaration, captain);
        };
    }

    /**
     * Applies the requested player's answer. Accepting forms the partnership;
     * declining leaves the captain on their own, played as a solo.
     *
     * @param pending assignment currently held for the hole
     * @throws RuleRejectedException {@code NO_PENDING_PARTNER_REQUEST} when no
     *         request is open or {@code responder} is not the requested player
     */
    public FormationTransition respondToPartnerRequest(RotationState rotation, FormationState current,
                                                       TeamAssignment pending, PlayerId responder,
                                                       boolean accept) {
        if (current != FormationState.PARTNER_PENDING || !(pending instanceof PartnerRequest)) {
            throw new RuleRejectedException(RejectionReason.NO_PENDING_PARTNER_REQUEST,
                String.format("No partner request is open on hole %d", rotation.getHoleNumber()));
        }
        PartnerRequest request = (PartnerRequest) pending;
        if (!request.getRequested().equals(responder)) {
            throw new RuleRejectedException(RejectionReason.NO_PENDING_PARTNER_REQUEST,
                "No pending partner request for player " + responder,
                Map.of("requested", request.getRequested().getValue()));
        }

        PlayerId captain = request.getCaptain();
        if (accept) {
            log.info("Hole {}: {} accepts {}'s partner request", rotation.getHoleNumber(), responder, captain);
            return new FormationTransition(FormationState.PARTNERSHIP,
                new Partnership(captain, responder, othersInTeeOrder(rotation, captain, responder), false),
                rotation);
        }
        log.info("Hole {}: {} declines, captain {} goes solo", rotation.getHoleNumber(), responder, captain);
        return new FormationTransition(FormationState.SOLO,
            new Solo(captain, othersInTeeOrder(rotation, captain), false, false), rotation);
    }

    /**
     * Special-phase default when the captain never declared: partner with the
     * second-worst running total. The result is flagged {@code forced}.
     */
    public FormationTransition forceDefault(RotationState rotation, FormationState current,
                                            Map<PlayerId, Quarters> runningTotals) {
        if (current.isResolved()) {
            throw new IllegalStateException("Teams already declared; no default to apply");
        }
        if (!rotation.isSpecialPhase()) {
            throw new IllegalStateException("Forced partnership only applies in the special phase");
        }
        PlayerId captain = rotation.getCaptain();
        PlayerId partner = rotationManager.worstFirst(rotation.getBaseOrder(), runningTotals).stream()
            .filter(p -> !p.equals(captain))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No partner available for forced partnership"));

        Partnership forced = new Partnership(captain, partner, othersInTeeOrder(rotation, captain, partner), true);
        log.warn("Hole {}: captain {} did not declare, forcing partnership with {}",
            rotation.getHoleNumber(), captain, partner);
        return new FormationTransition(FormationState.PARTNERSHIP, forced, rotation);
    }

    private FormationTransition floatDecision(Hole hole, RotationState rotation, FormationState current,
                                              Declaration declaration, PlayerId captain) {
        if (!declaration.getInvocations().isEmpty()) {
            throw new RuleRejectedException(RejectionReason.INVALID_DECLARATION,
                "No special rule may be invoked together with a Float");
        }
        if (current == FormationState.DEFERRED) {
            throw new RuleRejectedException(RejectionReason.INVALID_DECLARATION,
                String.format("Hole %d is already deferred", hole.getNumber()));
        }
        RotationState spent = rotationManager.spendFloat(rotation, captain);
        log.info("Hole {}: captain {} floats the decision", hole.getNumber(), captain);
        return new FormationTransition(FormationState.DEFERRED, new Deferred(captain), spent);
    }

    private FormationTransition solo(Hole hole, int holeCount, RotationState rotation,
                                     Declaration declaration, PlayerId captain) {
        if (declaration.getPartner() != null) {
            throw new RuleRejectedException(RejectionReason.INVALID_DECLARATION,
                "A solo declaration cannot name a partner");
        }
        boolean duncan = declaration.has(SpecialInvocation.Kind.DUNCAN);

        var bigDick = declaration.find(SpecialInvocation.BigDick.class);
        if (bigDick.isPresent()) {
            if (hole.getNumber() != holeCount) {
                throw new RuleRejectedException(RejectionReason.BIG_DICK_OUTSIDE_FINAL_HOLE,
                    String.format("Big Dick can only be invoked on hole %d, not hole %d",
                        holeCount, hole.getNumber()));
            }
            PlayerId lone = bigDick.get().getPlayer();
            if (lone == null || !rotation.isInRotation(lone)) {
                throw new RuleRejectedException(RejectionReason.UNKNOWN_PLAYER,
                    "Big Dick invoked by a player not in the round: " + lone);
            }
            log.info("Hole {}: {} invokes Big Dick against the field", hole.getNumber(), lone);
            return new FormationTransition(FormationState.SOLO,
                new Solo(lone, othersInTeeOrder(rotation, lone), duncan, true), rotation);
        }

        return new FormationTransition(FormationState.SOLO,
            new Solo(captain, othersInTeeOrder(rotation, captain), duncan, false), rotation);
    }

    private FormationTransition partnership(RotationState rotation, Declaration declaration, PlayerId captain) {
        PlayerId partner = validPartner(rotation, declaration, captain);
        return new FormationTransition(FormationState.PARTNERSHIP,
            new Partnership(captain, partner, othersInTeeOrder(rotation, captain, partner), false), rotation);
    }

    private FormationTransition partnerRequest(Hole hole, RotationState rotation, Declaration declaration,
                                               PlayerId captain) {
        PlayerId partner = validPartner(rotation, declaration, captain);
        log.info("Hole {}: captain {} asks {} to partner", hole.getNumber(), captain, partner);
        return new FormationTransition(FormationState.PARTNER_PENDING, new PartnerRequest(captain, partner), rotation);
    }

    private PlayerId validPartner(RotationState rotation, Declaration declaration, PlayerId captain) {
        if (declaration.has(SpecialInvocation.Kind.DUNCAN) || declaration.has(SpecialInvocation.Kind.BIG_DICK)) {
            throw new RuleRejectedException(RejectionReason.INVALID_DECLARATION,
                "Duncan and Big Dick are solo-only rules");
        }
        PlayerId partner = declaration.getPartner();
        if (partner == null) {
            throw new RuleRejectedException(RejectionReason.INVALID_PARTNER, "A partnership needs a partner");
        }
        if (partner.equals(captain)) {
            throw new RuleRejectedException(RejectionReason.INVALID_PARTNER,
                "Captain cannot partner with themselves",
                Map.of("captain", captain.getValue(), "partner", partner.getValue()));
        }
        if (!rotation.isInRotation(partner)) {
            throw new RuleRejectedException(RejectionReason.INVALID_PARTNER,
                "Partner is not in the rotation: " + partner,
                Map.of("partner", partner.getValue()));
        }
        return partner;
    }

    private static List<PlayerId> othersInTeeOrder(RotationState rotation, PlayerId... excluded) {
        List<PlayerId> skip = List.of(excluded);
        return rotation.getTeeOrder().stream()
            .filter(p -> !skip.contains(p))
            .toList();
    }
}
