package com.flagship.wolf_goat_pig.ledger;

import com.flagship.wolf_goat_pig.distribution.PointsDelta;
import com.flagship.wolf_goat_pig.exception.InternalConsistencyException;
import com.flagship.wolf_goat_pig.exception.ValidationException;
import com.flagship.wolf_goat_pig.exception.ValidationFailure;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import com.flagship.wolf_goat_pig.wager.WagerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of a round's points.
 *
 * Enforces the core invariants:
 * 1. Every entry sums to zero, so running totals always sum to zero
 * 2. Holes are committed once each, in order
 * 3. Entries are never edited; corrections are new entries
 *
 * Running totals are derived from the entries and cached.
 */
@Slf4j
public class RoundLedger {

    private final List<PlayerId> players;
    private final List<LedgerEntry> entries = new ArrayList<>();
    private final Map<PlayerId, Quarters> runningTotals = new LinkedHashMap<>();
    private int lastCommittedHole;

    public RoundLedger(List<PlayerId> players) {
        this.players = List.copyOf(players);
        this.players.forEach(p -> runningTotals.put(p, Quarters.ZERO));
    }

    /**
     * Records the points of a played hole.
     *
     * @throws ValidationException {@code HOLE_ALREADY_COMMITTED} or
     *         {@code HOLE_OUT_OF_SEQUENCE}
     * @throws InternalConsistencyException if the delta does not sum to zero
     */
    public LedgerEntry commit(int holeNumber, TeamAssignment assignment, WagerState wager, PointsDelta delta) {
        if (holeNumber <= lastCommittedHole) {
            throw new ValidationException(ValidationFailure.HOLE_ALREADY_COMMITTED,
                String.format("Hole %d is already committed", holeNumber),
                Map.of("hole", String.valueOf(holeNumber)));
        }
        if (holeNumber != lastCommittedHole + 1) {
            throw new ValidationException(ValidationFailure.HOLE_OUT_OF_SEQUENCE,
                String.format("Expected hole %d, got hole %d", lastCommittedHole + 1, holeNumber),
                Map.of("expected", String.valueOf(lastCommittedHole + 1), "hole", String.valueOf(holeNumber)));
        }
        requirePlayers(delta);
        if (!delta.isZeroSum()) {
            throw new InternalConsistencyException(
                String.format("Hole %d delta sums to %s", holeNumber, delta.total()),
                Map.of("hole", String.valueOf(holeNumber), "sum", delta.total().toString()));
        }

        LedgerEntry entry = append(EntryType.HOLE, holeNumber, assignment, wager.getCurrentUnits(), delta, null);
        lastCommittedHole = holeNumber;
        return entry;
    }

    /**
     * Appends a compensating entry.
     *
     * @throws ValidationException {@code UNBALANCED_CORRECTION} if the delta
     *         does not sum to zero
     */
    public LedgerEntry commitCorrection(String reason, PointsDelta delta) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A correction needs a reason");
        }
        requirePlayers(delta);
        if (!delta.isZeroSum()) {
            throw new ValidationException(ValidationFailure.UNBALANCED_CORRECTION,
                String.format("Correction sums to %s instead of zero", delta.total()),
                Map.of("sum", delta.total().toString()));
        }
        LedgerEntry entry = append(EntryType.CORRECTION, null, null, 0, delta, reason);
        log.info("Correction #{} recorded: {}", entry.getSequenceNumber(), reason);
        return entry;
    }

    public Quarters runningTotal(PlayerId player) {
        Quarters total = runningTotals.get(player);
        if (total == null) {
            throw new IllegalArgumentException("Player not in this round: " + player);
        }
        return total;
    }

    public Map<PlayerId, Quarters> runningTotals() {
        return Map.copyOf(runningTotals);
    }

    /**
     * Recomputes totals over every prefix of the entries and confirms each one
     * sums to zero.
     */
    public boolean zeroSumCheck() {
        Quarters cumulative = Quarters.ZERO;
        for (LedgerEntry entry : entries) {
            cumulative = cumulative.add(entry.getDelta().total());
            if (!cumulative.isZero()) {
                log.error("Ledger prefix ending at entry #{} sums to {}", entry.getSequenceNumber(), cumulative);
                return false;
            }
        }
        return true;
    }

    /**
     * Players ordered by running total, best first. Equal totals keep tee
     * order and share a position.
     */
    public List<Standing> standings() {
        List<PlayerId> ordered = new ArrayList<>(players);
        ordered.sort(Comparator.comparing((PlayerId p) -> runningTotal(p)).reversed());

        List<Standing> standings = new ArrayList<>();
        int position = 0;
        Quarters previous = null;
        for (int i = 0; i < ordered.size(); i++) {
            Quarters total = runningTotal(ordered.get(i));
            if (!total.equals(previous)) {
                position = i + 1;
                previous = total;
            }
            standings.add(new Standing(position, ordered.get(i), total));
        }
        return standings;
    }

    public List<LedgerEntry> entries() {
        return List.copyOf(entries);
    }

    public int lastCommittedHole() {
        return lastCommittedHole;
    }

    private LedgerEntry append(EntryType type, Integer holeNumber, TeamAssignment assignment, long wagerUnits,
                               PointsDelta delta, String reason) {
        LedgerEntry entry = new LedgerEntry(entries.size() + 1L, type, holeNumber, assignment, wagerUnits,
            delta, reason, Instant.now());
        entries.add(entry);
        delta.getChanges().forEach((player, change) -> runningTotals.merge(player, change, Quarters::add));
        return entry;
    }

    private void requirePlayers(PointsDelta delta) {
        if (!new HashSet<>(players).containsAll(delta.getChanges().keySet())) {
            throw new ValidationException(ValidationFailure.UNKNOWN_PLAYER,
                "Delta names players outside this round: " + delta.getChanges().keySet());
        }
    }
}
