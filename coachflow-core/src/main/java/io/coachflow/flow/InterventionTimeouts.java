package io.coachflow.flow;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-deployment wait durations for the states that expect a reply.
 *
 * @param commitment commitment prompt
 * @param feeling    feeling prompt
 * @param completion intervention sent, waiting for "done"
 * @param followUp   every other question
 */
public record InterventionTimeouts(
        Duration commitment,
        Duration feeling,
        Duration completion,
        Duration followUp
) {
    public InterventionTimeouts {
        Objects.requireNonNull(commitment, "commitment must not be null");
        Objects.requireNonNull(feeling, "feeling must not be null");
        Objects.requireNonNull(completion, "completion must not be null");
        Objects.requireNonNull(followUp, "followUp must not be null");
    }

    public static InterventionTimeouts defaults() {
        return new InterventionTimeouts(
                Duration.ofHours(12),
                Duration.ofMinutes(15),
                Duration.ofMinutes(30),
                Duration.ofMinutes(15)
        );
    }

    public Duration forState(InterventionState state) {
        return switch (state) {
            case COMMITMENT_PROMPT -> commitment;
            case FEELING_PROMPT -> feeling;
            case SEND_INTERVENTION_IMMEDIATE, SEND_INTERVENTION_REFLECTIVE -> completion;
            default -> followUp;
        };
    }
}
