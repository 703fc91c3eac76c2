package io.coachflow.core;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted job row as seen by the dispatcher.
 */
public record Job(

        // identity
        String id,
        String kind,
        String dedupeKey,

        // scheduling
        Instant runAt,
        ScheduleSpec schedule,
        JobStatus status,

        // claim
        String lockedBy,
        Instant lockUntil,
        int attempts,

        // bookkeeping
        Instant createdAt,
        Instant finishedAt,
        String lastError,

        Map<String, Object> payload
) {
    public boolean isRecurring() {
        return schedule != null;
    }
}
