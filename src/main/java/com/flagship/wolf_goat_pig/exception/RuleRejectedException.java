package com.flagship.wolf_goat_pig.exception;

import java.util.Map;

/**
 * A game rule refused the requested action: invalid partner, a second Float,
 * a late escalation and so on. The caller should re-prompt.
 */
public class RuleRejectedException extends EngineException {

    private final RejectionReason reason;

    public RuleRejectedException(RejectionReason reason, String message) {
        this(reason, message, Map.of());
    }

    public RuleRejectedException(RejectionReason reason, String message, Map<String, String> details) {
        super(message, details);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.RULE_REJECTION;
    }

    @Override
    public String getCode() {
        return reason.name();
    }
}
