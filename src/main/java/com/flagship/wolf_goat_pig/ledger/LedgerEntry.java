package com.flagship.wolf_goat_pig.ledger;

import com.flagship.wolf_goat_pig.distribution.PointsDelta;
import com.flagship.wolf_goat_pig.team.TeamAssignment;
import lombok.Value;

import java.time.Instant;

/**
 * One immutable line of the round ledger.
 *
 * Hole entries carry the hole number, assignment and locked wager units.
 * Correction entries carry a reason instead.
 */
@Value
public class LedgerEntry {
    long sequenceNumber;
    EntryType entryType;
    Integer holeNumber;
    TeamAssignment assignment;
    long wagerUnits;
    PointsDelta delta;
    String reason;
    Instant recordedAt;
}
