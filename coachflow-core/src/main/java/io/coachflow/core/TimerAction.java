package io.coachflow.core;

import java.util.Map;
import java.util.Objects;

/**
 * Serializable description of the work a timer performs when it fires.
 *
 * <p>{@code kind} selects the registered {@link io.coachflow.JobHandler}; {@code payload} must hold
 * everything the handler needs to re-derive its context. When {@code dedupeKey} is set, arming a
 * new timer with the same key replaces the earlier one.
 */
public record TimerAction(String kind, Map<String, Object> payload, String dedupeKey) {

    public TimerAction {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        dedupeKey = (dedupeKey == null || dedupeKey.isBlank()) ? null : dedupeKey;
    }

    public static TimerAction of(String kind, Map<String, Object> payload) {
        return new TimerAction(kind, payload, null);
    }

    public TimerAction withDedupeKey(String key) {
        return new TimerAction(kind, payload, key);
    }
}
