package com.flagship.wolf_goat_pig.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Converts any failure raised by the engine into an {@link EngineError}.
 *
 * Caller precondition errors ({@link IllegalArgumentException},
 * {@link IllegalStateException}) are reported as non-recoverable: they signal
 * a bug in the calling layer, not a player mistake.
 */
@Component
@Slf4j
public class EngineErrorTranslator {

    public static final String PRECONDITION_VIOLATED = "PRECONDITION_VIOLATED";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    public EngineError translate(Throwable failure) {
        if (failure instanceof EngineException e) {
            if (e.getErrorClass().isRecoverable()) {
                log.warn("Engine rejected request: code={}, message={}", e.getCode(), e.getMessage());
            } else {
                log.error("Engine consistency failure: code={}, details={}", e.getCode(), e.getDetails());
            }
            return EngineError.builder()
                .errorClass(e.getErrorClass())
                .code(e.getCode())
                .message(e.getMessage())
                .recoverable(e.getErrorClass().isRecoverable())
                .details(e.getDetails())
                .timestamp(Instant.now())
                .build();
        }

        if (failure instanceof IllegalArgumentException || failure instanceof IllegalStateException) {
            log.error("Caller precondition violated: {}", failure.getMessage());
            return EngineError.builder()
                .errorClass(ErrorClass.INTERNAL_CONSISTENCY)
                .code(PRECONDITION_VIOLATED)
                .message(failure.getMessage())
                .recoverable(false)
                .details(Map.of())
                .timestamp(Instant.now())
                .build();
        }

        log.error("Unexpected engine error", failure);
        return EngineError.builder()
            .errorClass(ErrorClass.INTERNAL_CONSISTENCY)
            .code(UNEXPECTED_ERROR)
            .message("An unexpected error occurred")
            .recoverable(false)
            .details(Map.of())
            .timestamp(Instant.now())
            .build();
    }
}
