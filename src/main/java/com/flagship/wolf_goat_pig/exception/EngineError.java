package com.flagship.wolf_goat_pig.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Structured error handed to the calling layer so it can decide whether to
 * re-prompt a player or abort the round.
 */
@Value
@Builder
public class EngineError {
    ErrorClass errorClass;
    String code;
    String message;
    boolean recoverable;
    Map<String, String> details;
    Instant timestamp;
}
