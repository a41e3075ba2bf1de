package com.flagship.wolf_goat_pig.event;

import com.flagship.wolf_goat_pig.team.Partnership;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event recorded when the special-phase default picked a partner for a
 * captain who never declared.
 */
@Value
public class ForcedPartnershipEvent implements RoundEvent {
    UUID eventId;
    UUID roundId;
    int holeNumber;
    String captain;
    String partner;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ForcedPartnershipApplied";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ForcedPartnershipEvent of(UUID roundId, int holeNumber, Partnership partnership) {
        return new ForcedPartnershipEvent(UUID.randomUUID(), roundId, holeNumber,
            partnership.getCaptain().getValue(), partnership.getPartner().getValue(), Instant.now());
    }
}
