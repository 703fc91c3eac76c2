package io.coachflow.state;

import io.coachflow.store.FlowStateStore;
import io.coachflow.store.ParticipantFlowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Read-modify-write access to participant flow records.
 *
 * <p>Every mutation reads the current record, applies the change and writes the full record back.
 * There is no cross-writer locking: concurrent writers to the same record must go through the owning
 * flow, and handlers re-check the values they depend on before acting.
 */
public class StateManager {
    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    private final FlowStateStore store;
    private final Clock clock;

    public StateManager(FlowStateStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Optional<ParticipantFlowState> find(String participantId, String flowType) {
        return store.find(participantId, flowType);
    }

    public List<ParticipantFlowState> findAll(String participantId) {
        return store.findByParticipant(participantId);
    }

    public List<String> listParticipantIds() {
        return store.listParticipantIds();
    }

    public Optional<String> getCurrentState(String participantId, String flowType) {
        return find(participantId, flowType).map(ParticipantFlowState::currentState);
    }

    public void setCurrentState(String participantId, String flowType, String state) {
        update(participantId, flowType, s -> s.withState(state));
    }

    public Optional<String> getStateData(String participantId, String flowType, String key) {
        return find(participantId, flowType).map(s -> s.get(key));
    }

    /**
     * A null value removes the key.
     */
    public void setStateData(String participantId, String flowType, String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        update(participantId, flowType, s -> s.withData(key, value));
    }

    public void removeStateData(String participantId, String flowType, String key) {
        setStateData(participantId, flowType, key, null);
    }

    /**
     * Apply {@code change} to the current record, creating it on first write.
     */
    public ParticipantFlowState update(String participantId, String flowType, UnaryOperator<ParticipantFlowState> change) {
        requireId(participantId, "participantId");
        requireId(flowType, "flowType");
        ParticipantFlowState current = store.find(participantId, flowType)
                .orElseGet(() -> ParticipantFlowState.create(participantId, flowType, clock.instant()));
        ParticipantFlowState next = change.apply(current).touchedAt(clock.instant());
        store.save(next);
        return next;
    }

    /**
     * Delete every flow record of a participant.
     */
    public long reset(String participantId) {
        requireId(participantId, "participantId");
        long deleted = store.deleteByParticipant(participantId);
        log.info("participant state reset participantId={} deleted={}", participantId, deleted);
        return deleted;
    }

    public void reset(String participantId, String flowType) {
        store.delete(participantId, flowType);
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
