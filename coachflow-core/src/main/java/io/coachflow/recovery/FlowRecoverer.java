package io.coachflow.recovery;

import io.coachflow.routing.ResponseRoute;
import io.coachflow.store.ParticipantFlowState;

import java.util.Optional;

/**
 * Flow-specific recovery knowledge. One-off timers are recovered generically from their markers;
 * a recoverer adds what only the flow knows.
 */
public interface FlowRecoverer {

    String flowType();

    /**
     * Terminal records are skipped entirely.
     */
    default boolean isTerminal(ParticipantFlowState state) {
        return false;
    }

    /**
     * Re-arm recurring schedules owned by this flow. Must be safe to repeat.
     */
    default void rearmRecurring(ParticipantFlowState state) {
    }

    default Optional<ResponseRoute> responseRoute(ParticipantFlowState state) {
        return Optional.empty();
    }

    /**
     * Cancel recurring work owned by this flow before the participant's state is deleted.
     */
    default void release(ParticipantFlowState state) {
    }
}
