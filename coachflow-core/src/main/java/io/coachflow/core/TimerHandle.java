package io.coachflow.core;

import java.util.Objects;

/**
 * Opaque reference to an armed timer. Only the backing that issued it knows how to read it.
 */
public record TimerHandle(String value) {

    public TimerHandle {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    public static TimerHandle of(String value) {
        return (value == null || value.isBlank()) ? null : new TimerHandle(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
