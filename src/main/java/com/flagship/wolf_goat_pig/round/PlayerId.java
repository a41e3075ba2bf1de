package com.flagship.wolf_goat_pig.round;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Objects;

/**
 * Identity of a player within a round.
 */
@Value
public class PlayerId {
    String value;

    private PlayerId(String value) {
        this.value = Objects.requireNonNull(value);
        if (value.isBlank()) {
            throw new IllegalArgumentException("Player id must not be blank");
        }
    }

    public static PlayerId of(String value) {
        return new PlayerId(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
