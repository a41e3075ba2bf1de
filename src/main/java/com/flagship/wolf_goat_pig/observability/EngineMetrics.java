package com.flagship.wolf_goat_pig.observability;

import com.flagship.wolf_goat_pig.exception.ErrorClass;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for the quarters engine.
 *
 * Metrics exposed:
 * - wgp.rounds.started / wgp.rounds.completed: round lifecycle counters
 * - wgp.holes.committed: committed holes, tagged by outcome and assignment
 * - wgp.carryover.created: tied holes whose wager was carried forward
 * - wgp.carryover.forfeited: streaks that hit the limit, plus forfeited units
 * - wgp.forced_partnerships: special-phase defaults applied
 * - wgp.rejections: failed operations, tagged by error class and code
 * - wgp.hole.commit.duration: time to settle and commit a hole
 */
@Component
public class EngineMetrics {

    private final MeterRegistry registry;

    private final Counter roundsStarted;
    private final Counter roundsCompleted;
    private final Counter carryOvers;
    private final Counter forfeits;
    private final Counter forfeitedUnits;
    private final Counter forcedPartnerships;

    private final Timer commitTimer;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.roundsStarted = Counter.builder("wgp.rounds.started")
                .description("Number of rounds started")
                .register(registry);

        this.roundsCompleted = Counter.builder("wgp.rounds.completed")
                .description("Number of rounds with every hole committed")
                .register(registry);

        this.carryOvers = Counter.builder("wgp.carryover.created")
                .description("Number of tied holes carried forward")
                .register(registry);

        this.forfeits = Counter.builder("wgp.carryover.forfeited")
                .description("Number of carry-over streaks forfeited at the limit")
                .register(registry);

        this.forfeitedUnits = Counter.builder("wgp.carryover.forfeited.units")
                .description("Wager units written off by forfeited carry-overs")
                .register(registry);

        this.forcedPartnerships = Counter.builder("wgp.forced_partnerships")
                .description("Number of special-phase default partnerships applied")
                .register(registry);

        this.commitTimer = Timer.builder("wgp.hole.commit.duration")
                .description("Time taken to settle and commit a hole")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void incrementRoundsStarted() {
        roundsStarted.increment();
    }

    public void incrementRoundsCompleted() {
        roundsCompleted.increment();
    }

    public void incrementCarryOvers() {
        carryOvers.increment();
    }

    public void incrementForcedPartnerships() {
        forcedPartnerships.increment();
    }

    public void recordForfeit(long units) {
        forfeits.increment();
        forfeitedUnits.increment(units);
    }

    /**
     * Records a committed hole with outcome and assignment tags.
     */
    public void recordHoleCommitted(String outcome, String assignmentType) {
        registry.counter("wgp.holes.committed",
                "outcome", sanitizeTag(outcome),
                "assignment", sanitizeTag(assignmentType)
        ).increment();
    }

    /**
     * Records a failed engine operation.
     */
    public void recordRejection(String operation, ErrorClass errorClass, String code) {
        registry.counter("wgp.rejections",
                "operation", sanitizeTag(operation),
                "class", errorClass == null ? "unknown" : errorClass.name(),
                "code", sanitizeTag(code)
        ).increment();
    }

    public <T> T timeCommit(Supplier<T> operation) {
        return commitTimer.record(operation);
    }

    /**
     * Registers a gauge for the number of rounds in memory.
     */
    public void registerActiveRoundsGauge(Supplier<Number> supplier) {
        registry.gauge("wgp.rounds.active", Tags.empty(), supplier, s -> s.get().doubleValue());
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
