package com.flagship.wolf_goat_pig.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys for round-scoped logging.
 *
 * Every engine operation puts the round id and hole number for the duration of
 * the call so that all log lines it produces can be filtered per round.
 */
public final class RoundContext {

    public static final String ROUND_ID_MDC_KEY = "roundId";
    public static final String HOLE_MDC_KEY = "hole";

    private RoundContext() {
        // Utility class
    }

    /**
     * Puts both keys and returns a handle that removes them again.
     */
    public static Scope open(UUID roundId, int holeNumber) {
        MDC.put(ROUND_ID_MDC_KEY, shortId(roundId));
        MDC.put(HOLE_MDC_KEY, String.valueOf(holeNumber));
        return new Scope();
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String shortId(UUID roundId) {
        return roundId.toString().substring(0, 8);
    }

    public static final class Scope implements AutoCloseable {

        private Scope() {
        }

        @Override
        public void close() {
            MDC.remove(ROUND_ID_MDC_KEY);
            MDC.remove(HOLE_MDC_KEY);
        }
    }
}
