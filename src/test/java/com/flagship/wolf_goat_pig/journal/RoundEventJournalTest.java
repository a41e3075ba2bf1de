package com.flagship.wolf_goat_pig.journal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wolf_goat_pig.config.JacksonConfig;
import com.flagship.wolf_goat_pig.distribution.PointsDelta;
import com.flagship.wolf_goat_pig.event.CarryOverForfeitedEvent;
import com.flagship.wolf_goat_pig.event.HoleCommittedEvent;
import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.round.PlayerId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.flagship.wolf_goat_pig.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RoundEventJournalTest {

    private ObjectMapper objectMapper;
    private RoundEventJournal journal;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfig.configure(new ObjectMapper());
        journal = new RoundEventJournal(objectMapper);
    }

    private static PointsDelta soloWin() {
        Map<PlayerId, Quarters> changes = new LinkedHashMap<>();
        changes.put(ALICE, Quarters.of(9, 2));
        changes.put(BOB, Quarters.of(-3, 2));
        changes.put(CAROL, Quarters.of(-3, 2));
        changes.put(DAVE, Quarters.of(-3, 2));
        return PointsDelta.of(changes);
    }

    @Test
    @DisplayName("Events are stored as JSON with exact fractional amounts")
    void testRecordSerializesPayload() throws Exception {
        UUID roundId = UUID.randomUUID();
        HoleCommittedEvent event = HoleCommittedEvent.of(roundId, 4, "SOLO", ALICE, "CAPTAIN_WINS",
            1, 1, soloWin(), 0);

        JournalEntry entry = journal.record(event);

        assertEquals(event.getEventId(), entry.getId());
        assertEquals(HoleCommittedEvent.EVENT_TYPE, entry.getEventType());
        JsonNode json = objectMapper.readTree(entry.getPayload());
        assertEquals("HoleCommitted", json.get("eventType").asText());
        assertEquals(4, json.get("holeNumber").asInt());
        assertEquals("9/2", json.get("delta").get("alice").asText());
        assertEquals("-3/2", json.get("delta").get("dave").asText());
        assertTrue(json.get("occurredAt").isTextual());
    }

    @Test
    @DisplayName("Events are kept per round in recording order")
    void testEventsForRound() {
        UUID roundId = UUID.randomUUID();
        UUID otherRound = UUID.randomUUID();

        journal.record(HoleCommittedEvent.of(roundId, 1, "PARTNERSHIP", ALICE, "TIE", 1, 1,
            PointsDelta.zero(List.of(ALICE, BOB, CAROL, DAVE)), 1));
        journal.record(CarryOverForfeitedEvent.of(roundId, 3, 1, 3, 3));
        journal.record(CarryOverForfeitedEvent.of(otherRound, 5, 3, 3, 6));

        List<JournalEntry> events = journal.eventsForRound(roundId);

        assertEquals(2, events.size());
        assertTrue(events.get(0).getSequenceNumber() < events.get(1).getSequenceNumber());
        assertEquals(1, journal.eventsOfType(roundId, CarryOverForfeitedEvent.EVENT_TYPE).size());
        assertTrue(journal.eventsForRound(UUID.randomUUID()).isEmpty());
    }
}
