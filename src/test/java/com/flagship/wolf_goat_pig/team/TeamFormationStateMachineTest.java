package com.flagship.wolf_goat_pig.team;

import com.flagship.wolf_goat_pig.exception.RejectionReason;
import com.flagship.wolf_goat_pig.exception.RuleRejectedException;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.rotation.RotationManager;
import com.flagship.wolf_goat_pig.rotation.RotationState;
import com.flagship.wolf_goat_pig.round.Hole;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.round.RoundSetup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.flagship.wolf_goat_pig.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Team formation transitions.
 *
 * These tests verify that:
 * - Valid declarations produce the expected assignment
 * - Rejected declarations leave rotation and formation state untouched
 * - Float, Duncan and Big Dick follow their restrictions
 */
class TeamFormationStateMachineTest {

    private static final int HOLES = 18;

    private RotationManager rotationManager;
    private TeamFormationStateMachine stateMachine;
    private RoundSetup setup;
    private RotationState rotation;
    private Hole hole1;

    @BeforeEach
    void setUp() {
        rotationManager = new RotationManager(properties());
        stateMachine = new TeamFormationStateMachine(rotationManager);
        setup = setup(HOLES);
        rotation = rotationManager.start(setup);
        hole1 = new Hole(1, 4, false);
    }

    private RuleRejectedException rejected(FormationState state, Declaration declaration) {
        return assertThrows(RuleRejectedException.class,
            () -> stateMachine.declare(hole1, HOLES, rotation, state, declaration));
    }

    @Test
    @DisplayName("Partner declaration forms captain and partner against the other two")
    void testPartnership() {
        FormationTransition transition = stateMachine.declare(hole1, HOLES, rotation,
            FormationState.AWAITING_DECLARATION, Declaration.partner(CAROL));

        assertEquals(FormationState.PARTNERSHIP, transition.getState());
        Partnership partnership = (Partnership) transition.getAssignment();
        assertEquals(ALICE, partnership.getCaptain());
        assertEquals(CAROL, partnership.getPartner());
        assertEquals(List.of(BOB, DAVE), partnership.getOpponents());
        assertFalse(partnership.isForced());
        assertSame(rotation, transition.getRotation());
    }

    @Test
    @DisplayName("Partner request waits for the requested player's answer")
    void testPartnerRequestPending() {
        FormationTransition transition = stateMachine.declare(hole1, HOLES, rotation,
            FormationState.AWAITING_DECLARATION, Declaration.requestPartner(CAROL));

        assertEquals(FormationState.PARTNER_PENDING, transition.getState());
        assertFalse(transition.getState().isResolved());
        assertEquals(new PartnerRequest(ALICE, CAROL), transition.getAssignment());
        assertFalse(transition.getAssignment().isScorable());
        assertEquals(RejectionReason.PARTNER_REQUEST_PENDING,
            rejected(FormationState.PARTNER_PENDING, Declaration.solo()).getReason());
        assertEquals(RejectionReason.INVALID_PARTNER,
            rejected(FormationState.AWAITING_DECLARATION, Declaration.requestPartner(ALICE)).getReason());
    }

    @Test
    @DisplayName("Accepted request forms the partnership, declined request leaves the captain solo")
    void testPartnerRequestAnswered() {
        PartnerRequest request = new PartnerRequest(ALICE, CAROL);

        FormationTransition accepted = stateMachine.respondToPartnerRequest(rotation,
            FormationState.PARTNER_PENDING, request, CAROL, true);
        assertEquals(FormationState.PARTNERSHIP, accepted.getState());
        assertEquals(new Partnership(ALICE, CAROL, List.of(BOB, DAVE), false), accepted.getAssignment());

        FormationTransition declined = stateMachine.respondToPartnerRequest(rotation,
            FormationState.PARTNER_PENDING, request, CAROL, false);
        assertEquals(FormationState.SOLO, declined.getState());
        assertEquals(new Solo(ALICE, List.of(BOB, CAROL, DAVE), false, false), declined.getAssignment());
        assertSame(rotation, declined.getRotation());
    }

    @Test
    @DisplayName("Answering without an open request or as another player is NO_PENDING_PARTNER_REQUEST")
    void testPartnerRequestWrongResponder() {
        PartnerRequest request = new PartnerRequest(ALICE, CAROL);

        RuleRejectedException wrongPlayer = assertThrows(RuleRejectedException.class,
            () -> stateMachine.respondToPartnerRequest(rotation, FormationState.PARTNER_PENDING, request, BOB, true));
        assertEquals(RejectionReason.NO_PENDING_PARTNER_REQUEST, wrongPlayer.getReason());

        RuleRejectedException noRequest = assertThrows(RuleRejectedException.class,
            () -> stateMachine.respondToPartnerRequest(rotation, FormationState.AWAITING_DECLARATION, null,
                CAROL, true));
        assertEquals(RejectionReason.NO_PENDING_PARTNER_REQUEST, noRequest.getReason());
    }

    @Test
    @DisplayName("A null special invocation is INVALID_DECLARATION")
    void testNullInvocation() {
        Declaration declaration = Declaration.builder()
            .choice(CaptainChoice.SOLO)
            .invocations(Arrays.asList(SpecialInvocation.duncan(), null))
            .build();

        assertEquals(RejectionReason.INVALID_DECLARATION,
            rejected(FormationState.AWAITING_DECLARATION, declaration).getReason());
    }

    @Test
    @DisplayName("Captain as own partner or an outsider is INVALID_PARTNER")
    void testInvalidPartner() {
        assertEquals(RejectionReason.INVALID_PARTNER,
            rejected(FormationState.AWAITING_DECLARATION, Declaration.partner(ALICE)).getReason());
        assertEquals(RejectionReason.INVALID_PARTNER,
            rejected(FormationState.AWAITING_DECLARATION, Declaration.partner(PlayerId.of("eve"))).getReason());
        assertEquals(RejectionReason.INVALID_PARTNER,
            rejected(FormationState.AWAITING_DECLARATION, Declaration.builder().choice(CaptainChoice.PARTNER).build())
                .getReason());
    }

    @Test
    @DisplayName("Solo with Duncan is flagged as declared before results")
    void testSoloWithDuncan() {
        Declaration declaration = Declaration.builder()
            .choice(CaptainChoice.SOLO)
            .invocation(SpecialInvocation.duncan())
            .build();

        FormationTransition transition = stateMachine.declare(hole1, HOLES, rotation,
            FormationState.AWAITING_DECLARATION, declaration);

        Solo solo = (Solo) transition.getAssignment();
        assertEquals(FormationState.SOLO, transition.getState());
        assertEquals(ALICE, solo.getCaptain());
        assertEquals(List.of(BOB, CAROL, DAVE), solo.getOpponents());
        assertTrue(solo.isDeclaredBeforeResults());
        assertFalse(solo.isBigDick());
    }

    @Test
    @DisplayName("Float defers the decision, spends the token and can then be resolved")
    void testFloatThenDeclare() {
        FormationTransition deferred = stateMachine.declare(hole1, HOLES, rotation,
            FormationState.AWAITING_DECLARATION, Declaration.floatDecision());

        assertEquals(FormationState.DEFERRED, deferred.getState());
        assertEquals(AssignmentType.DEFERRED, deferred.getAssignment().getType());
        assertFalse(deferred.getAssignment().isScorable());
        assertEquals(1, deferred.getRotation().floatTokensSpentBy(ALICE));
        assertEquals(0, rotation.floatTokensSpentBy(ALICE));

        FormationTransition resolved = stateMachine.declare(hole1, HOLES, deferred.getRotation(),
            FormationState.DEFERRED, Declaration.solo());
        assertEquals(FormationState.SOLO, resolved.getState());
    }

    @Test
    @DisplayName("Float while deferred or with a special rule is INVALID_DECLARATION")
    void testInvalidFloat() {
        assertEquals(RejectionReason.INVALID_DECLARATION,
            rejected(FormationState.DEFERRED, Declaration.floatDecision()).getReason());

        Declaration withDuncan = Declaration.builder()
            .choice(CaptainChoice.FLOAT)
            .invocation(SpecialInvocation.duncan())
            .build();
        assertEquals(RejectionReason.INVALID_DECLARATION,
            rejected(FormationState.AWAITING_DECLARATION, withDuncan).getReason());
    }

    @Test
    @DisplayName("Second Float in a round is RULE_ALREADY_USED and changes nothing")
    void testSecondFloatRejected() {
        RotationState spent = stateMachine.declare(hole1, HOLES, rotation,
            FormationState.AWAITING_DECLARATION, Declaration.floatDecision()).getRotation();

        RuleRejectedException e = assertThrows(RuleRejectedException.class,
            () -> stateMachine.declare(hole1, HOLES, spent, FormationState.AWAITING_DECLARATION,
                Declaration.floatDecision()));

        assertEquals(RejectionReason.RULE_ALREADY_USED, e.getReason());
        assertEquals(1, spent.floatTokensSpentBy(ALICE));
    }

    @Test
    @DisplayName("Declaring again after teams are resolved is ALREADY_DECLARED")
    void testAlreadyDeclared() {
        assertEquals(RejectionReason.ALREADY_DECLARED,
            rejected(FormationState.SOLO, Declaration.partner(BOB)).getReason());
        assertEquals(RejectionReason.ALREADY_DECLARED,
            rejected(FormationState.PARTNERSHIP, Declaration.solo()).getReason());
    }

    @Test
    @DisplayName("Big Dick is only allowed on the final hole and makes the invoker the captain")
    void testBigDick() {
        Declaration bigDick = Declaration.builder()
            .choice(CaptainChoice.SOLO)
            .invocation(SpecialInvocation.bigDick(DAVE))
            .build();

        RuleRejectedException early = assertThrows(RuleRejectedException.class,
            () -> stateMachine.declare(new Hole(17, 4, true), HOLES, rotation,
                FormationState.AWAITING_DECLARATION, bigDick));
        assertEquals(RejectionReason.BIG_DICK_OUTSIDE_FINAL_HOLE, early.getReason());

        FormationTransition transition = stateMachine.declare(new Hole(18, 4, true), HOLES, rotation,
            FormationState.AWAITING_DECLARATION, bigDick);
        Solo solo = (Solo) transition.getAssignment();
        assertEquals(DAVE, solo.getCaptain());
        assertEquals(List.of(ALICE, BOB, CAROL), solo.getOpponents());
        assertTrue(solo.isBigDick());
    }

    @Test
    @DisplayName("Duncan or Big Dick on a partnership is INVALID_DECLARATION")
    void testSoloOnlyRulesOnPartnership() {
        Declaration declaration = Declaration.builder()
            .choice(CaptainChoice.PARTNER)
            .partner(BOB)
            .invocation(SpecialInvocation.duncan())
            .build();

        assertEquals(RejectionReason.INVALID_DECLARATION,
            rejected(FormationState.AWAITING_DECLARATION, declaration).getReason());
    }

    @Test
    @DisplayName("Forced default partners the captain with the second-worst total")
    void testForcedDefault() {
        Map<PlayerId, Quarters> totals = totals(0, -4, -2, 6);
        RotationState state = rotationManager.start(setup);
        while (state.getHoleNumber() < 17) {
            state = rotationManager.advance(state, setup, totals);
        }

        FormationTransition transition = stateMachine.forceDefault(state, FormationState.AWAITING_DECLARATION, totals);

        Partnership forced = (Partnership) transition.getAssignment();
        assertEquals(BOB, forced.getCaptain());
        assertEquals(CAROL, forced.getPartner());
        assertEquals(List.of(ALICE, DAVE), forced.getOpponents());
        assertTrue(forced.isForced());
    }

    @Test
    @DisplayName("Forced default outside the special phase is a precondition error")
    void testForcedDefaultNormalPhase() {
        assertThrows(IllegalStateException.class,
            () -> stateMachine.forceDefault(rotation, FormationState.AWAITING_DECLARATION, totals(0, 0, 0, 0)));
    }
}
