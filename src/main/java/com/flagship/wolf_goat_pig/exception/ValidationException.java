package com.flagship.wolf_goat_pig.exception;

import java.util.Map;

/**
 * Submitted data was missing, malformed or arrived out of sequence.
 */
public class ValidationException extends EngineException {

    private final ValidationFailure failure;

    public ValidationException(ValidationFailure failure, String message) {
        this(failure, message, Map.of());
    }

    public ValidationException(ValidationFailure failure, String message, Map<String, String> details) {
        super(message, details);
        this.failure = failure;
    }

    public ValidationFailure getFailure() {
        return failure;
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.VALIDATION_FAILURE;
    }

    @Override
    public String getCode() {
        return failure.name();
    }
}
