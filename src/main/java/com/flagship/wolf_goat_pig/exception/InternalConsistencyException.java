package com.flagship.wolf_goat_pig.exception;

import java.util.Map;

/**
 * The computed points for a hole do not sum to zero.
 *
 * This means two rules composed incorrectly. The hole is not committed and the
 * round should be treated as aborted by the caller.
 */
public class InternalConsistencyException extends EngineException {

    public static final String CODE = "ZERO_SUM_VIOLATION";

    public InternalConsistencyException(String message, Map<String, String> details) {
        super(message, details);
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.INTERNAL_CONSISTENCY;
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
