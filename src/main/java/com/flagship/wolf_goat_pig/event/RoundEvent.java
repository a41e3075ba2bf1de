package com.flagship.wolf_goat_pig.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact recorded in a round's journal.
 */
public interface RoundEvent {

    /**
     * Unique identifier for this event instance.
     */
    UUID getEventId();

    /**
     * The round this event is about.
     */
    UUID getRoundId();

    Instant getOccurredAt();

    /**
     * Event type name for filtering.
     */
    String getEventType();
}
