package com.flagship.wolf_goat_pig.exception;

import java.util.Map;

/**
 * Base class for every failure the engine reports.
 *
 * Engine state is never mutated by an operation that ends in one of these.
 */
public abstract class EngineException extends RuntimeException {

    private final Map<String, String> details;

    protected EngineException(String message, Map<String, String> details) {
        super(message);
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public abstract ErrorClass getErrorClass();

    /**
     * Stable, machine-readable reason code.
     */
    public abstract String getCode();

    public Map<String, String> getDetails() {
        return details;
    }
}
