package com.flagship.wolf_goat_pig.event;

import com.flagship.wolf_goat_pig.distribution.PointsDelta;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Event recorded when a hole's points enter the round ledger.
 */
@Value
public class HoleCommittedEvent implements RoundEvent {
    UUID eventId;
    UUID roundId;
    int holeNumber;
    String assignmentType;
    String captain;
    String outcome;
    long wagerUnits;
    long effectiveUnits;
    Map<String, Quarters> delta;
    long carryOverUnits;
    Instant occurredAt;

    public static final String EVENT_TYPE = "HoleCommitted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static HoleCommittedEvent of(UUID roundId, int holeNumber, String assignmentType, PlayerId captain,
                                        String outcome, long wagerUnits, long effectiveUnits,
                                        PointsDelta delta, long carryOverUnits) {
        return new HoleCommittedEvent(
            UUID.randomUUID(),
            roundId,
            holeNumber,
            assignmentType,
            captain.getValue(),
            outcome,
            wagerUnits,
            effectiveUnits,
            byPlayer(delta),
            carryOverUnits,
            Instant.now()
        );
    }

    static Map<String, Quarters> byPlayer(PointsDelta delta) {
        Map<String, Quarters> changes = new LinkedHashMap<>();
        delta.getChanges().forEach((player, change) -> changes.put(player.getValue(), change));
        return changes;
    }
}
