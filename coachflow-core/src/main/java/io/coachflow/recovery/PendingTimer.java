package io.coachflow.recovery;

import java.time.Instant;
import java.util.Map;

/**
 * Marker for one outstanding timer, stored as JSON in the owning flow's state data.
 * Holds everything needed to re-arm the timer after a restart.
 *
 * @param dueAt ISO-8601 instant
 */
public record PendingTimer(
        String kind,
        String dueAt,
        Map<String, Object> payload,
        String dedupeKey,
        String handle
) {
    public Instant dueInstant() {
        return Instant.parse(dueAt);
    }
}
