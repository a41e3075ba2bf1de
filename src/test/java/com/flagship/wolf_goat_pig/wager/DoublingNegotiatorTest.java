package com.flagship.wolf_goat_pig.wager;

import com.flagship.wolf_goat_pig.exception.RejectionReason;
import com.flagship.wolf_goat_pig.exception.RuleRejectedException;
import com.flagship.wolf_goat_pig.team.Deferred;
import com.flagship.wolf_goat_pig.team.Partnership;
import com.flagship.wolf_goat_pig.team.Side;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.flagship.wolf_goat_pig.TestFixtures.*;
import static com.flagship.wolf_goat_pig.wager.EscalationRequest.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Doubling negotiation.
 *
 * These tests verify that:
 * - Double and redouble alternate between the sides
 * - An invalid move rejects the whole batch
 * - The Option folds in at lock unless declined
 * - Nothing can change a locked wager
 */
class DoublingNegotiatorTest {

    private DoublingNegotiator negotiator;
    private TeamAssignment teams;
    private WagerState wager;

    @BeforeEach
    void setUp() {
        negotiator = new DoublingNegotiator();
        teams = new Partnership(ALICE, BOB, List.of(CAROL, DAVE), false);
        wager = WagerState.initial(1);
    }

    private RejectionReason rejection(WagerState state, TeamAssignment assignment, EscalationRequest... requests) {
        return assertThrows(RuleRejectedException.class,
            () -> negotiator.negotiate(state, assignment, List.of(requests))).getReason();
    }

    @Test
    @DisplayName("Double, redouble and decline hand the counter back and forth")
    void testDoubleRedoubleDecline() {
        WagerState doubled = negotiator.negotiate(wager, teams, List.of(doubleBy(Side.OPPONENTS)));
        assertEquals(2, doubled.getCurrentUnits());
        assertEquals(Side.CAPTAIN, doubled.getPendingCounter());

        WagerState redoubled = negotiator.negotiate(doubled, teams, List.of(redoubleBy(Side.CAPTAIN)));
        assertEquals(4, redoubled.getCurrentUnits());
        assertEquals(Side.OPPONENTS, redoubled.getPendingCounter());

        WagerState closed = negotiator.negotiate(redoubled, teams, List.of(declineBy(Side.OPPONENTS)));
        assertEquals(4, closed.getCurrentUnits());
        assertNull(closed.getPendingCounter());

        WagerState again = negotiator.negotiate(closed, teams, List.of(doubleBy(Side.CAPTAIN)));
        assertEquals(8, again.getCurrentUnits());
    }

    @Test
    @DisplayName("Redouble chain has no depth cap")
    void testNoDepthCap() {
        WagerState result = negotiator.negotiate(wager, teams, List.of(
            doubleBy(Side.CAPTAIN),
            redoubleBy(Side.OPPONENTS),
            redoubleBy(Side.CAPTAIN),
            redoubleBy(Side.OPPONENTS),
            redoubleBy(Side.CAPTAIN)));

        assertEquals(32, result.getCurrentUnits());
        assertEquals(6, result.getEvents().size());
    }

    @Test
    @DisplayName("Out-of-turn moves are INVALID_ESCALATION and the batch is all-or-nothing")
    void testInvalidEscalation() {
        assertEquals(RejectionReason.INVALID_ESCALATION, rejection(wager, teams, redoubleBy(Side.CAPTAIN)));
        assertEquals(RejectionReason.INVALID_ESCALATION, rejection(wager, teams, declineBy(Side.OPPONENTS)));
        assertEquals(RejectionReason.INVALID_ESCALATION,
            rejection(wager, teams, doubleBy(Side.CAPTAIN), doubleBy(Side.OPPONENTS)));
        assertEquals(RejectionReason.INVALID_ESCALATION,
            rejection(wager, teams, doubleBy(Side.CAPTAIN), redoubleBy(Side.CAPTAIN)));

        assertEquals(1, wager.getCurrentUnits());
        assertNull(wager.getPendingCounter());
    }

    @Test
    @DisplayName("Escalating before teams are resolved is NOT_DECLARED")
    void testNotDeclared() {
        assertEquals(RejectionReason.NOT_DECLARED, rejection(wager, null, doubleBy(Side.CAPTAIN)));
        assertEquals(RejectionReason.NOT_DECLARED, rejection(wager, new Deferred(ALICE), doubleBy(Side.CAPTAIN)));
    }

    @Test
    @DisplayName("Any request after lock is LATE_ESCALATION")
    void testLateEscalation() {
        WagerState locked = negotiator.lock(wager);

        assertTrue(locked.isLocked());
        assertEquals(RejectionReason.LATE_ESCALATION, rejection(locked, teams, doubleBy(Side.OPPONENTS)));
        assertEquals(RejectionReason.LATE_ESCALATION, rejection(locked, teams, declineOption()));
    }

    @Test
    @DisplayName("A missing request list or a null request is INVALID_ESCALATION")
    void testNullRequests() {
        RuleRejectedException missing = assertThrows(RuleRejectedException.class,
            () -> negotiator.negotiate(wager, teams, null));
        assertEquals(RejectionReason.INVALID_ESCALATION, missing.getReason());

        RuleRejectedException nullEntry = assertThrows(RuleRejectedException.class,
            () -> negotiator.negotiate(wager, teams, Arrays.asList(doubleBy(Side.OPPONENTS), null)));
        assertEquals(RejectionReason.INVALID_ESCALATION, nullEntry.getReason());
        assertEquals(1, wager.getCurrentUnits());
    }

    @Test
    @DisplayName("A pending Option is applied at lock as a doubling step")
    void testOptionAppliedAtLock() {
        WagerState offered = negotiator.offerOption(wager);
        assertEquals(2, offered.projectedUnits());
        assertEquals(1, offered.getCurrentUnits());

        WagerState locked = negotiator.lock(offered);

        assertEquals(2, locked.getCurrentUnits());
        assertFalse(locked.isOptionPending());
        WagerEvent last = locked.getEvents().get(locked.getEvents().size() - 1);
        assertEquals(WagerRule.THE_OPTION, last.getRule());
        assertEquals(Side.CAPTAIN, last.getSide());
    }

    @Test
    @DisplayName("Captain can decline the Option before strokes")
    void testDeclineOption() {
        WagerState offered = negotiator.offerOption(wager);

        WagerState declined = negotiator.negotiate(offered, teams, List.of(declineOption()));

        assertFalse(declined.isOptionPending());
        assertEquals(1, negotiator.lock(declined).getCurrentUnits());
        assertEquals(RejectionReason.INVALID_ESCALATION, rejection(wager, teams, declineOption()));
    }

    @Test
    @DisplayName("Manual doubles and the Option compose")
    void testOptionWithDouble() {
        WagerState doubled = negotiator.negotiate(negotiator.offerOption(wager), teams,
            List.of(doubleBy(Side.OPPONENTS), declineBy(Side.CAPTAIN)));

        assertEquals(4, negotiator.lock(doubled).getCurrentUnits());
    }
}
