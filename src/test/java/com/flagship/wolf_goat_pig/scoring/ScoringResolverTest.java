package com.flagship.wolf_goat_pig.scoring;

import com.flagship.wolf_goat_pig.exception.ValidationException;
import com.flagship.wolf_goat_pig.exception.ValidationFailure;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.team.Deferred;
import com.flagship.wolf_goat_pig.team.Partnership;
import com.flagship.wolf_goat_pig.team.Side;
import com.flagship.wolf_goat_pig.team.Solo;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.flagship.wolf_goat_pig.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ScoringResolverTest {

    private ScoringResolver resolver;
    private TeamAssignment partnership;
    private TeamAssignment solo;

    @BeforeEach
    void setUp() {
        resolver = new ScoringResolver(properties());
        partnership = new Partnership(ALICE, BOB, List.of(CAROL, DAVE), false);
        solo = new Solo(ALICE, List.of(BOB, CAROL, DAVE), false, false);
    }

    private Outcome resolve(TeamAssignment assignment, int a, int b, int c, int d) {
        return resolver.resolve(new ScoreSet(1, strokes(a, b, c, d)), assignment);
    }

    private ValidationFailure failure(TeamAssignment assignment, Map<PlayerId, Integer> strokes) {
        return assertThrows(ValidationException.class,
            () -> resolver.resolve(new ScoreSet(1, strokes), assignment)).getFailure();
    }

    @Test
    @DisplayName("Lower best ball wins for either side")
    void testBestBallWins() {
        Outcome captain = resolve(partnership, 4, 5, 5, 6);
        assertEquals(OutcomeType.CAPTAIN_WINS, captain.getType());
        assertEquals(Side.CAPTAIN, captain.getWinningSide());
        assertEquals(4, captain.getCaptainBestBall());
        assertEquals(5, captain.getOpponentsBestBall());

        Outcome opponents = resolve(solo, 5, 6, 4, 7);
        assertEquals(OutcomeType.OPPONENTS_WIN, opponents.getType());
        assertEquals(Side.OPPONENTS, opponents.getWinningSide());
    }

    @Test
    @DisplayName("Equal best balls tie regardless of the other balls")
    void testTie() {
        Outcome outcome = resolve(partnership, 4, 8, 4, 5);

        assertTrue(outcome.isTie());
        assertNull(outcome.getWinningSide());
        assertThrows(IllegalStateException.class, outcome::losingSide);
    }

    @Test
    @DisplayName("A losing player far behind everyone else marks an uneven payoff")
    void testOutlierOnLosingSide() {
        Outcome outcome = resolve(partnership, 4, 5, 5, 9);

        assertEquals(OutcomeType.UNEVEN_PAYOFF, outcome.getType());
        assertEquals(Side.CAPTAIN, outcome.getWinningSide());
        assertEquals(DAVE, outcome.getOutlier());
    }

    @Test
    @DisplayName("Outlier is ignored on the winning side, without a teammate or under the threshold")
    void testOutlierIgnored() {
        assertEquals(OutcomeType.CAPTAIN_WINS, resolve(partnership, 4, 9, 5, 6).getType());
        assertEquals(OutcomeType.OPPONENTS_WIN, resolve(solo, 9, 4, 4, 5).getType());
        assertEquals(OutcomeType.CAPTAIN_WINS, resolve(partnership, 4, 5, 5, 7).getType());
        assertTrue(resolve(partnership, 4, 5, 5, 7).findOutlier().isEmpty());
    }

    @Test
    @DisplayName("Resolution is pure: the same inputs give the same outcome")
    void testIdempotent() {
        ScoreSet scores = new ScoreSet(3, strokes(4, 5, 5, 9));

        assertEquals(resolver.resolve(scores, partnership), resolver.resolve(scores, partnership));
    }

    @Test
    @DisplayName("Missing, extra or non-positive strokes are validation failures")
    void testValidation() {
        Map<PlayerId, Integer> missing = strokes(4, 4, 4, 4);
        missing.remove(DAVE);
        assertEquals(ValidationFailure.MISSING_STROKES, failure(partnership, missing));

        Map<PlayerId, Integer> extra = strokes(4, 4, 4, 4);
        extra.put(PlayerId.of("eve"), 5);
        assertEquals(ValidationFailure.UNKNOWN_PLAYER, failure(partnership, extra));

        assertEquals(ValidationFailure.INVALID_STROKES, failure(partnership, strokes(4, 0, 4, 4)));

        Map<PlayerId, Integer> nullStrokes = strokes(4, 4, 4, 4);
        nullStrokes.put(CAROL, null);
        assertEquals(ValidationFailure.INVALID_STROKES, failure(partnership, nullStrokes));
    }

    @Test
    @DisplayName("A deferred assignment cannot be scored")
    void testDeferredNotScorable() {
        assertEquals(ValidationFailure.ASSIGNMENT_NOT_SCORABLE, failure(new Deferred(ALICE), strokes(4, 4, 4, 4)));
    }
}
