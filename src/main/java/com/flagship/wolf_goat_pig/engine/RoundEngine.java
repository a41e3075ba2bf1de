package com.flagship.wolf_goat_pig.engine;

import com.flagship.wolf_goat_pig.distribution.CarryOver;
import com.flagship.wolf_goat_pig.distribution.DistributionResult;
import com.flagship.wolf_goat_pig.distribution.PointsDelta;
import com.flagship.wolf_goat_pig.event.CarryOverForfeitedEvent;
import com.flagship.wolf_goat_pig.event.ForcedPartnershipEvent;
import com.flagship.wolf_goat_pig.event.HoleCommittedEvent;
import com.flagship.wolf_goat_pig.event.LedgerCorrectedEvent;
import com.flagship.wolf_goat_pig.exception.EngineException;
import com.flagship.wolf_goat_pig.exception.RejectionReason;
import com.flagship.wolf_goat_pig.exception.RuleRejectedException;
import com.flagship.wolf_goat_pig.exception.ValidationException;
import com.flagship.wolf_goat_pig.exception.ValidationFailure;
import com.flagship.wolf_goat_pig.ledger.CarryOverLedger;
import com.flagship.wolf_goat_pig.ledger.LedgerEntry;
import com.flagship.wolf_goat_pig.ledger.RoundLedger;
import com.flagship.wolf_goat_pig.ledger.Standing;
import com.flagship.wolf_goat_pig.observability.RoundContext;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.rotation.RotationState;
import com.flagship.wolf_goat_pig.round.Hole;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.round.RoundSetup;
import com.flagship.wolf_goat_pig.scoring.Outcome;
import com.flagship.wolf_goat_pig.scoring.ScoreSet;
import com.flagship.wolf_goat_pig.team.CaptainChoice;
import com.flagship.wolf_goat_pig.team.Declaration;
import com.flagship.wolf_goat_pig.team.FormationState;
import com.flagship.wolf_goat_pig.team.FormationTransition;
import com.flagship.wolf_goat_pig.team.Partnership;
import com.flagship.wolf_goat_pig.team.SpecialInvocation;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import com.flagship.wolf_goat_pig.wager.EscalationRequest;
import com.flagship.wolf_goat_pig.wager.WagerState;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Plays one round, hole by hole.
 *
 * Per hole the caller goes through: declare teams (answering a partner
 * request if the captain made one), optionally negotiate the wager, submit
 * strokes, commit. Committing a hole opens the next one until the
 * final hole, after which the round is complete.
 *
 * Key principles:
 * - Every operation either fully succeeds or leaves the round untouched
 * - The ledger sums to zero after every commit
 * - Journal events are written only after the state they describe
 *
 * Instances are thread-safe; operations on one round are serialized.
 */
@Slf4j
public class RoundEngine {

    private final UUID roundId;
    private final RoundSetup setup;
    private final RoundEngineFactory components;
    private final RoundLedger ledger;
    private final CarryOverLedger carryOverLedger = new CarryOverLedger();

    private HoleSession session;
    private boolean complete;

    RoundEngine(UUID roundId, RoundSetup setup, RoundEngineFactory components) {
        this.roundId = roundId;
        this.setup = setup;
        this.components = components;
        this.ledger = new RoundLedger(setup.playerIds());
        this.session = openHole(components.getRotationManager().start(setup));
    }

    public UUID getRoundId() {
        return roundId;
    }

    public RoundSetup getSetup() {
        return setup;
    }

    public synchronized boolean isComplete() {
        return complete;
    }

    /**
     * @throws ValidationException {@code ROUND_COMPLETE} once every hole is committed
     */
    public synchronized HoleSnapshot currentHole() {
        requireInProgress();
        WagerState wager = session.getWager();
        RotationState rotation = session.getRotation();
        return HoleSnapshot.builder()
            .holeNumber(session.getHole().getNumber())
            .par(session.getHole().getPar())
            .specialPhase(session.getHole().isSpecialPhase())
            .captain(rotation.getCaptain())
            .teeOrder(rotation.getTeeOrder())
            .formationState(session.getFormationState())
            .assignment(session.getAssignment())
            .wagerUnits(wager == null ? 0 : wager.isLocked() ? wager.getCurrentUnits() : wager.projectedUnits())
            .optionPending(wager != null && wager.isOptionPending())
            .wagerLocked(wager != null && wager.isLocked())
            .strokesSubmitted(session.isStrokesSubmitted())
            .build();
    }

    /**
     * Applies the captain's team formation call.
     *
     * @return the resulting assignment; a Float returns a deferred assignment
     *         and the captain must declare again
     */
    public synchronized TeamAssignment declare(int holeNumber, CaptainChoice choice, PlayerId partner,
                                               List<SpecialInvocation> invocations) {
        return run("declare", holeNumber, () -> {
            requireActiveHole(holeNumber);
            Hole hole = session.getHole();
            List<SpecialInvocation> special = invocations == null ? List.of() : invocations;
            Declaration declaration = Declaration.builder()
                .choice(choice)
                .partner(partner)
                .invocations(special)
                .build();

            FormationTransition transition = components.getFormationStateMachine().declare(
                hole, setup.holeCount(), session.getRotation(), session.getFormationState(), declaration);

            WagerState wager = null;
            if (transition.getState().isResolved()) {
                wager = openingWager(hole, transition.getAssignment(), special);
            }

            session.setRotation(transition.getRotation());
            session.setFormationState(transition.getState());
            session.setAssignment(transition.getAssignment());
            session.setWager(wager);
            session.setPendingInvocations(transition.getState() == FormationState.PARTNER_PENDING
                ? List.copyOf(special) : List.of());

            log.info("Teams declared: {} ({})", transition.getState(), transition.getAssignment());
            return transition.getAssignment();
        });
    }

    /**
     * Records the requested player's answer to the captain's partner request.
     * Invocations given with the request are applied to the resulting wager.
     *
     * @return the partnership if accepted, the captain's solo if declined
     */
    public synchronized TeamAssignment respondToPartnerRequest(int holeNumber, PlayerId player, boolean accept) {
        return run("respondToPartnerRequest", holeNumber, () -> {
            requireActiveHole(holeNumber);
            FormationTransition transition = components.getFormationStateMachine().respondToPartnerRequest(
                session.getRotation(), session.getFormationState(), session.getAssignment(), player, accept);
            WagerState wager = openingWager(session.getHole(), transition.getAssignment(),
                session.getPendingInvocations());

            session.setFormationState(transition.getState());
            session.setAssignment(transition.getAssignment());
            session.setWager(wager);
            session.setPendingInvocations(List.of());

            log.info("Partner request answered: {} ({})", transition.getState(), transition.getAssignment());
            return transition.getAssignment();
        });
    }

    /**
     * Applies a batch of double/redouble/decline requests to the open wager.
     */
    public synchronized WagerState negotiate(int holeNumber, List<EscalationRequest> requests) {
        return run("negotiate", holeNumber, () -> {
            requireActiveHole(holeNumber);
            if (session.getWager() == null) {
                throw new RuleRejectedException(RejectionReason.NOT_DECLARED,
                    "Teams must be declared before the wager can be escalated");
            }
            WagerState escalated = components.getDoublingNegotiator()
                .negotiate(session.getWager(), session.getAssignment(), requests);
            session.setWager(escalated);
            return escalated;
        });
    }

    /**
     * Records strokes and resolves the hole. Locks the wager.
     *
     * In the special phase a captain who has not declared is given the default
     * partnership here.
     */
    public synchronized Outcome submitStrokes(int holeNumber, Map<PlayerId, Integer> strokes) {
        return run("submitStrokes", holeNumber, () -> {
            requireActiveHole(holeNumber);
            if (session.isStrokesSubmitted()) {
                throw new ValidationException(ValidationFailure.STROKES_ALREADY_SUBMITTED,
                    String.format("Strokes for hole %d were already submitted", holeNumber));
            }
            if (strokes == null) {
                throw new ValidationException(ValidationFailure.MISSING_STROKES, "No strokes submitted");
            }

            TeamAssignment assignment = session.getAssignment();
            WagerState wager = session.getWager();
            FormationTransition forced = null;
            if (!session.getFormationState().isResolved()) {
                if (!session.getHole().isSpecialPhase()) {
                    throw new ValidationException(ValidationFailure.TEAMS_NOT_DECLARED,
                        String.format("Teams for hole %d have not been declared", holeNumber));
                }
                forced = components.getFormationStateMachine()
                    .forceDefault(session.getRotation(), session.getFormationState(), ledger.runningTotals());
                assignment = forced.getAssignment();
                wager = openingWager(session.getHole(), assignment, List.of());
            }

            ScoreSet scores = new ScoreSet(holeNumber, strokes);
            Outcome outcome = components.getScoringResolver().resolve(scores, assignment);
            WagerState locked = components.getDoublingNegotiator().lock(wager);

            if (forced != null) {
                session.setFormationState(forced.getState());
                session.setAssignment(assignment);
                components.getMetrics().incrementForcedPartnerships();
                components.getJournal().record(
                    ForcedPartnershipEvent.of(roundId, holeNumber, (Partnership) assignment));
            }
            session.setWager(locked);
            session.setScores(scores);
            session.setOutcome(outcome);

            log.info("Strokes recorded: outcome={}, wager locked at {} units", outcome.getType(), locked.getCurrentUnits());
            return outcome;
        });
    }

    /**
     * Settles the hole into the ledger and opens the next hole.
     *
     * @throws com.flagship.wolf_goat_pig.exception.InternalConsistencyException
     *         if the computed points do not sum to zero; nothing is committed
     */
    public synchronized HoleResult commit(int holeNumber) {
        return run("commit", holeNumber, () -> components.getMetrics().timeCommit(() -> {
            requireActiveHole(holeNumber);
            if (!session.isStrokesSubmitted()) {
                throw new ValidationException(ValidationFailure.STROKES_NOT_SUBMITTED,
                    String.format("Strokes for hole %d have not been submitted", holeNumber));
            }

            Outcome outcome = session.getOutcome();
            TeamAssignment assignment = session.getAssignment();
            WagerState wager = session.getWager();
            CarryOver carryIn = carryOverLedger.current();

            DistributionResult result = components.getDistributionEngine()
                .distribute(outcome, wager, assignment, carryIn, holeNumber);
            ledger.commit(holeNumber, assignment, wager, result.getDelta());
            carryOverLedger.commit(result);

            recordCommitted(holeNumber, outcome, assignment, wager, carryIn, result);

            boolean last = holeNumber == setup.holeCount();
            if (last) {
                complete = true;
                components.getMetrics().incrementRoundsCompleted();
                log.info("Round complete: standings={}", ledger.standings());
            } else {
                session = openHole(components.getRotationManager()
                    .advance(session.getRotation(), setup, ledger.runningTotals()));
            }

            return HoleResult.builder()
                .holeNumber(holeNumber)
                .outcome(outcome)
                .wagerUnits(wager.getCurrentUnits())
                .effectiveUnits(result.getEffectiveUnits())
                .delta(result.getDelta())
                .runningTotals(ledger.runningTotals())
                .zeroSumCheck(ledger.zeroSumCheck())
                .carryOver(result.getCarryOut())
                .forfeitedUnits(result.getForfeitedUnits())
                .roundComplete(last)
                .build();
        }));
    }

    /**
     * Appends a compensating zero-sum entry to the ledger.
     */
    public synchronized LedgerEntry correct(String reason, PointsDelta delta) {
        int hole = complete ? setup.holeCount() : session.getHole().getNumber();
        return run("correct", hole, () -> {
            LedgerEntry entry = ledger.commitCorrection(reason, delta);
            components.getJournal().record(
                LedgerCorrectedEvent.of(roundId, entry.getSequenceNumber(), reason, delta));
            return entry;
        });
    }

    public synchronized Map<PlayerId, Quarters> runningTotals() {
        return ledger.runningTotals();
    }

    public synchronized Quarters runningTotal(PlayerId player) {
        return ledger.runningTotal(player);
    }

    public synchronized List<Standing> standings() {
        return ledger.standings();
    }

    public synchronized List<LedgerEntry> ledgerEntries() {
        return ledger.entries();
    }

    public synchronized boolean zeroSumCheck() {
        return ledger.zeroSumCheck();
    }

    public synchronized CarryOver pendingCarryOver() {
        return carryOverLedger.current();
    }

    /**
     * Units written off by tie streaks that reached the carry-over limit, over
     * the whole round so far.
     */
    public synchronized long totalForfeitedUnits() {
        return carryOverLedger.totalForfeited();
    }

    private HoleSession openHole(RotationState rotation) {
        int number = rotation.getHoleNumber();
        Hole hole = new Hole(number, setup.getPars().get(number - 1), rotation.isSpecialPhase());
        return new HoleSession(hole, rotation);
    }

    private WagerState openingWager(Hole hole, TeamAssignment assignment, List<SpecialInvocation> invocations) {
        WagerState wager = components.getWagerCalculator().computeBaseWager(hole, assignment, invocations);
        RotationState rotation = session.getRotation();
        if (assignment.getCaptain().equals(rotation.getCaptain())
            && components.getRotationManager().isOptionPending(rotation, ledger.runningTotals())) {
            log.info("The Option is pending for captain {}", rotation.getCaptain());
            wager = components.getDoublingNegotiator().offerOption(wager);
        }
        return wager;
    }

    private void recordCommitted(int holeNumber, Outcome outcome, TeamAssignment assignment, WagerState wager,
                                 CarryOver carryIn, DistributionResult result) {
        components.getMetrics().recordHoleCommitted(outcome.getType().name(), assignment.getType().name());
        if (result.isForfeited()) {
            int origin = carryIn.isPending() ? carryIn.getOriginHole() : holeNumber;
            components.getMetrics().recordForfeit(result.getForfeitedUnits());
            components.getJournal().record(CarryOverForfeitedEvent.of(roundId, holeNumber, origin,
                carryIn.getConsecutiveCarries() + 1, result.getForfeitedUnits()));
        } else if (result.getCarryOut().isPending()) {
            components.getMetrics().incrementCarryOvers();
        }
        components.getJournal().record(HoleCommittedEvent.of(roundId, holeNumber, assignment.getType().name(),
            assignment.getCaptain(), outcome.getType().name(), wager.getCurrentUnits(),
            result.getEffectiveUnits(), result.getDelta(), result.getCarryOut().getPendingUnits()));
    }

    private void requireInProgress() {
        if (complete) {
            throw new ValidationException(ValidationFailure.ROUND_COMPLETE,
                String.format("All %d holes have been committed", setup.holeCount()));
        }
    }

    private void requireActiveHole(int holeNumber) {
        if (holeNumber >= 1 && holeNumber <= ledger.lastCommittedHole()) {
            throw new ValidationException(ValidationFailure.HOLE_ALREADY_COMMITTED,
                String.format("Hole %d is already committed", holeNumber),
                Map.of("hole", String.valueOf(holeNumber)));
        }
        requireInProgress();
        int active = session.getHole().getNumber();
        if (holeNumber != active) {
            throw new ValidationException(ValidationFailure.HOLE_NOT_ACTIVE,
                String.format("Hole %d is not in play; current hole is %d", holeNumber, active),
                Map.of("hole", String.valueOf(holeNumber), "activeHole", String.valueOf(active)));
        }
    }

    private <T> T run(String operation, int holeNumber, Supplier<T> action) {
        try (RoundContext.Scope ignored = RoundContext.open(roundId, holeNumber)) {
            try {
                return action.get();
            } catch (EngineException e) {
                components.getMetrics().recordRejection(operation, e.getErrorClass(), e.getCode());
                if (e.getErrorClass().isRecoverable()) {
                    log.warn("{} rejected: code={}, message={}", operation, e.getCode(), e.getMessage());
                } else {
                    log.error("{} failed: code={}, details={}", operation, e.getCode(), e.getDetails());
                }
                throw e;
            } catch (RuntimeException e) {
                components.getMetrics().recordRejection(operation, null, e.getClass().getSimpleName());
                log.error("{} failed: {}", operation, e.getMessage());
                throw e;
            }
        }
    }
}
