package com.flagship.wolf_goat_pig.exception;

/**
 * The three failure classes the engine reports to its callers.
 */
public enum ErrorClass {
    /**
     * A rule forbids the requested action. Recoverable: re-prompt the player.
     */
    RULE_REJECTION(true),

    /**
     * The submitted data is incomplete or out of sequence. Recoverable.
     */
    VALIDATION_FAILURE(true),

    /**
     * The zero-sum invariant could not be satisfied. Fatal for the hole's commit.
     */
    INTERNAL_CONSISTENCY(false);

    private final boolean recoverable;

    ErrorClass(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
