package com.flagship.wolf_goat_pig.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wolf_goat_pig.event.RoundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only journal of round events, kept in memory per round.
 *
 * Engines record an event only after the state change it describes has been
 * applied, so every journal entry is a fact.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoundEventJournal {

    private final ObjectMapper objectMapper;
    private final Map<UUID, List<JournalEntry>> entriesByRound = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Serializes and appends an event.
     *
     * @throws IllegalArgumentException if the event cannot be serialized
     */
    public JournalEntry record(RoundEvent event) {
        String payload = serializePayload(event);
        JournalEntry entry = new JournalEntry(event.getEventId(), event.getRoundId(), event.getEventType(),
            payload, Instant.now(), sequence.incrementAndGet());

        List<JournalEntry> entries = entriesByRound.computeIfAbsent(event.getRoundId(), id -> new ArrayList<>());
        synchronized (entries) {
            entries.add(entry);
        }

        log.debug("Journaled event: type={}, roundId={}, seq={}",
            event.getEventType(), event.getRoundId(), entry.getSequenceNumber());
        return entry;
    }

    /**
     * Events of a round in the order they were recorded.
     */
    public List<JournalEntry> eventsForRound(UUID roundId) {
        List<JournalEntry> entries = entriesByRound.get(roundId);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public List<JournalEntry> eventsOfType(UUID roundId, String eventType) {
        return eventsForRound(roundId).stream()
            .filter(e -> e.getEventType().equals(eventType))
            .toList();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
