package com.flagship.wolf_goat_pig.event;

import com.flagship.wolf_goat_pig.distribution.PointsDelta;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
public class LedgerCorrectedEvent implements RoundEvent {
    UUID eventId;
    UUID roundId;
    long sequenceNumber;
    String reason;
    Map<String, Quarters> delta;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerCorrected";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerCorrectedEvent of(UUID roundId, long sequenceNumber, String reason, PointsDelta delta) {
        return new LedgerCorrectedEvent(UUID.randomUUID(), roundId, sequenceNumber, reason,
            HoleCommittedEvent.byPlayer(delta), Instant.now());
    }
}
