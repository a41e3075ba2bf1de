package com.flagship.wolf_goat_pig.engine;

import com.flagship.wolf_goat_pig.observability.EngineMetrics;
import com.flagship.wolf_goat_pig.observability.RoundContext;
import com.flagship.wolf_goat_pig.round.RoundSetup;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts rounds and keeps them in memory until they are removed.
 */
@Service
@Slf4j
public class RoundService {

    private final RoundEngineFactory engineFactory;
    private final EngineMetrics metrics;
    private final Map<UUID, RoundEngine> rounds = new ConcurrentHashMap<>();

    public RoundService(RoundEngineFactory engineFactory, EngineMetrics metrics) {
        this.engineFactory = engineFactory;
        this.metrics = metrics;
        metrics.registerActiveRoundsGauge(rounds::size);
    }

    /**
     * Starts a round on hole 1.
     *
     * @throws IllegalArgumentException if setup is null
     */
    public RoundEngine startRound(RoundSetup setup) {
        if (setup == null) {
            throw new IllegalArgumentException("Round setup is required");
        }
        UUID roundId = UUID.randomUUID();
        MDC.put(RoundContext.ROUND_ID_MDC_KEY, RoundContext.shortId(roundId));
        try {
            RoundEngine engine = engineFactory.create(roundId, setup);
            rounds.put(roundId, engine);
            metrics.incrementRoundsStarted();
            log.info("Round started: players={}, holes={}", setup.playerIds(), setup.holeCount());
            return engine;
        } finally {
            MDC.remove(RoundContext.ROUND_ID_MDC_KEY);
        }
    }

    public Optional<RoundEngine> findRound(UUID roundId) {
        return Optional.ofNullable(rounds.get(roundId));
    }

    /**
     * @throws IllegalArgumentException if no such round exists
     */
    public RoundEngine getRound(UUID roundId) {
        return findRound(roundId)
            .orElseThrow(() -> new IllegalArgumentException("Round not found: " + roundId));
    }

    public Collection<RoundEngine> activeRounds() {
        return List.copyOf(rounds.values());
    }

    public boolean removeRound(UUID roundId) {
        boolean removed = rounds.remove(roundId) != null;
        if (removed) {
            log.info("Round {} removed", roundId);
        }
        return removed;
    }
}
