package com.flagship.wolf_goat_pig.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event recorded when a tie streak reaches the carry-over limit and the
 * pending units are written off.
 */
@Value
public class CarryOverForfeitedEvent implements RoundEvent {
    UUID eventId;
    UUID roundId;
    int holeNumber;
    int originHole;
    int consecutiveCarries;
    long forfeitedUnits;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CarryOverForfeited";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CarryOverForfeitedEvent of(UUID roundId, int holeNumber, int originHole,
                                             int consecutiveCarries, long forfeitedUnits) {
        return new CarryOverForfeitedEvent(UUID.randomUUID(), roundId, holeNumber, originHole,
            consecutiveCarries, forfeitedUnits, Instant.now());
    }
}
