package com.flagship.wolf_goat_pig.rotation;

import com.flagship.wolf_goat_pig.exception.RejectionReason;
import com.flagship.wolf_goat_pig.exception.RuleRejectedException;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.round.RoundSetup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.flagship.wolf_goat_pig.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Captain rotation, special-phase captaincy and once-per-round Float tokens.
 */
class RotationManagerTest {

    private RotationManager rotationManager;
    private RoundSetup setup;

    @BeforeEach
    void setUp() {
        rotationManager = new RotationManager(properties());
        setup = setup(18);
    }

    private RotationState advanceTo(int hole, Map<PlayerId, Quarters> totals) {
        RotationState state = rotationManager.start(setup);
        while (state.getHoleNumber() < hole) {
            state = rotationManager.advance(state, setup, totals);
        }
        return state;
    }

    @Test
    @DisplayName("Hole 1 captain is the first player in tee order")
    void testStart() {
        RotationState state = rotationManager.start(setup);

        assertEquals(1, state.getHoleNumber());
        assertEquals(ALICE, state.getCaptain());
        assertEquals(List.of(ALICE, BOB, CAROL, DAVE), state.getTeeOrder());
        assertFalse(state.isSpecialPhase());
    }

    @Test
    @DisplayName("Normal phase moves captaincy one seat per hole and wraps around")
    void testNormalRotation() {
        RotationState hole2 = advanceTo(2, Map.of());
        RotationState hole5 = advanceTo(5, Map.of());

        assertEquals(BOB, hole2.getCaptain());
        assertEquals(List.of(BOB, CAROL, DAVE, ALICE), hole2.getTeeOrder());
        assertEquals(ALICE, hole5.getCaptain());
        assertEquals(0, hole5.getRotationPointer());
    }

    @Test
    @DisplayName("Special phase puts the worst running total in the captain slot")
    void testSpecialPhaseCaptain() {
        RotationState hole17 = advanceTo(17, totals(0, 4, -5, 1));

        assertTrue(hole17.isSpecialPhase());
        assertEquals(CAROL, hole17.getCaptain());
        assertEquals(List.of(CAROL, ALICE, BOB, DAVE), hole17.getTeeOrder());
        assertEquals(0, hole17.getRotationPointer());
        assertEquals(2, hole17.getCaptainIndex());
    }

    @Test
    @DisplayName("Special phase ties on worst total go to the lower tee-order index")
    void testSpecialPhaseTieBreak() {
        RotationState hole18 = advanceTo(18, totals(-3, 2, 4, -3));

        assertEquals(ALICE, hole18.getCaptain());
        assertEquals(1, hole18.getRotationPointer());
    }

    @Test
    @DisplayName("Advancing past the final hole is a precondition error")
    void testAdvancePastFinalHole() {
        RotationState hole18 = advanceTo(18, Map.of());

        assertThrows(IllegalStateException.class, () -> rotationManager.advance(hole18, setup, Map.of()));
    }

    @Test
    @DisplayName("A second Float by the same player is rejected and the token survives advancing")
    void testFloatOncePerRound() {
        RotationState start = rotationManager.start(setup);
        RotationState spent = rotationManager.spendFloat(start, ALICE);

        assertEquals(0, start.floatTokensSpentBy(ALICE));
        assertEquals(1, spent.floatTokensSpentBy(ALICE));

        RotationState later = rotationManager.advance(spent, setup, Map.of());
        RuleRejectedException e = assertThrows(RuleRejectedException.class,
            () -> rotationManager.spendFloat(later, ALICE));
        assertEquals(RejectionReason.RULE_ALREADY_USED, e.getReason());

        assertDoesNotThrow(() -> rotationManager.spendFloat(later, BOB));
    }

    @Test
    @DisplayName("The Option is pending only for a captain tied for lowest and below zero")
    void testOptionPending() {
        RotationState hole1 = rotationManager.start(setup);

        assertTrue(rotationManager.isOptionPending(hole1, totals(-2, -2, 1, 3)));
        assertFalse(rotationManager.isOptionPending(hole1, totals(0, 0, 0, 0)));
        assertFalse(rotationManager.isOptionPending(hole1, totals(-1, -3, 2, 2)));
    }
}
