package io.coachflow.internal;

import io.coachflow.store.FlowStateStore;
import io.coachflow.store.ParticipantFlowState;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryFlowStateStore implements FlowStateStore {

    private final ConcurrentMap<String, ParticipantFlowState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<ParticipantFlowState> find(String participantId, String flowType) {
        return Optional.ofNullable(states.get(key(participantId, flowType)));
    }

    @Override
    public List<ParticipantFlowState> findByParticipant(String participantId) {
        return states.values().stream()
                .filter(s -> s.participantId().equals(participantId))
                .toList();
    }

    @Override
    public void save(ParticipantFlowState state) {
        Objects.requireNonNull(state, "state must not be null");
        states.put(key(state.participantId(), state.flowType()), state);
    }

    @Override
    public void delete(String participantId, String flowType) {
        states.remove(key(participantId, flowType));
    }

    @Override
    public long deleteByParticipant(String participantId) {
        long before = states.size();
        states.values().removeIf(s -> s.participantId().equals(participantId));
        return before - states.size();
    }

    @Override
    public List<String> listParticipantIds() {
        return states.values().stream()
                .map(ParticipantFlowState::participantId)
                .distinct()
                .sorted()
                .toList();
    }

    private static String key(String participantId, String flowType) {
        return participantId + ":" + flowType;
    }
}
