package io.coachflow.store;

import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for per-participant flow records. Writes replace the whole record; there is no
 * partial-field update.
 */
public interface FlowStateStore {

    Optional<ParticipantFlowState> find(String participantId, String flowType);

    List<ParticipantFlowState> findByParticipant(String participantId);

    void save(ParticipantFlowState state);

    void delete(String participantId, String flowType);

    long deleteByParticipant(String participantId);

    /**
     * Ids of every participant with at least one flow record.
     */
    List<String> listParticipantIds();
}
