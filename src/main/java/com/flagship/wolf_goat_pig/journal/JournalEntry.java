package com.flagship.wolf_goat_pig.journal;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A serialized round event as stored in the journal.
 */
@Value
public class JournalEntry {
    UUID id;
    UUID roundId;
    String eventType;      // e.g., "HoleCommitted"
    String payload;        // JSON payload
    Instant createdAt;
    long sequenceNumber;
}
