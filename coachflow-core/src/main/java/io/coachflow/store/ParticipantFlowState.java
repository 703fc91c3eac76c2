package io.coachflow.store;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One (participant, flow) record: the FSM state tag plus an open string bag.
 *
 * <p>Values in {@code stateData} are opaque to the store. Instances are immutable; the
 * {@code with*} methods return modified copies for read-modify-write updates; the
 * {@link io.coachflow.state.StateManager} stamps {@code updatedAt} when it writes them back.
 */
public record ParticipantFlowState(
        String participantId,
        String flowType,
        String currentState,
        Map<String, String> stateData,
        Instant createdAt,
        Instant updatedAt
) {
    public ParticipantFlowState {
        Objects.requireNonNull(participantId, "participantId must not be null");
        Objects.requireNonNull(flowType, "flowType must not be null");
        stateData = stateData == null ? Map.of() : Map.copyOf(stateData);
    }

    public static ParticipantFlowState create(String participantId, String flowType, Instant now) {
        return new ParticipantFlowState(participantId, flowType, null, Map.of(), now, now);
    }

    public String get(String key) {
        return stateData.get(key);
    }

    public ParticipantFlowState withState(String state) {
        return new ParticipantFlowState(participantId, flowType, state, stateData, createdAt, updatedAt);
    }

    public ParticipantFlowState withData(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(stateData);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new ParticipantFlowState(participantId, flowType, currentState, copy, createdAt, updatedAt);
    }

    public ParticipantFlowState withoutData(String key) {
        return withData(key, null);
    }

    public ParticipantFlowState touchedAt(Instant now) {
        return new ParticipantFlowState(participantId, flowType, currentState, stateData, createdAt, now);
    }
}
