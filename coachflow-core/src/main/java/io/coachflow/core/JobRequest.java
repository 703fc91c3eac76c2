package io.coachflow.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Input to {@code enqueue}. A non-null {@code schedule} marks one occurrence of a recurring series;
 * the dispatcher enqueues the next occurrence under the same dedupe key after it runs.
 */
public record JobRequest(
        String kind,
        Instant runAt,
        Map<String, Object> payload,
        String dedupeKey,
        ScheduleSpec schedule
) {
    public JobRequest {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(runAt, "runAt must not be null");
        if (kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        dedupeKey = (dedupeKey == null || dedupeKey.isBlank()) ? null : dedupeKey;
    }

    public static JobRequest oneOff(String kind, Instant runAt, Map<String, Object> payload, String dedupeKey) {
        return new JobRequest(kind, runAt, payload, dedupeKey, null);
    }

    public boolean isRecurring() {
        return schedule != null;
    }
}
