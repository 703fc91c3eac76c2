package io.coachflow.internal.mongo;

import io.coachflow.exception.TransientDependencyException;
import io.coachflow.store.FlowStateStore;
import io.coachflow.store.ParticipantFlowState;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence for participant flow records. {@link #save} replaces the whole document.
 */
public class MongoFlowStateStore implements FlowStateStore {

    private final MongoTemplate mongoTemplate;

    public MongoFlowStateStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<ParticipantFlowState> find(String participantId, String flowType) {
        String id = FlowStateDocument.idOf(participantId, flowType);
        return execute("find", () -> Optional.ofNullable(mongoTemplate.findById(id, FlowStateDocument.class))
                .map(MongoFlowStateStore::toState));
    }

    @Override
    public List<ParticipantFlowState> findByParticipant(String participantId) {
        Query q = new Query(Criteria.where("participantId").is(participantId)).with(Sort.by("flowType"));
        return execute("findByParticipant", () -> mongoTemplate.find(q, FlowStateDocument.class).stream()
                .map(MongoFlowStateStore::toState)
                .toList());
    }

    @Override
    public void save(ParticipantFlowState state) {
        Objects.requireNonNull(state, "state must not be null");
        execute("save", () -> mongoTemplate.save(toDocument(state)));
    }

    @Override
    public void delete(String participantId, String flowType) {
        Query q = new Query(Criteria.where("_id").is(FlowStateDocument.idOf(participantId, flowType)));
        execute("delete", () -> mongoTemplate.remove(q, FlowStateDocument.class));
    }

    @Override
    public long deleteByParticipant(String participantId) {
        Query q = new Query(Criteria.where("participantId").is(participantId));
        return execute("deleteByParticipant", () -> mongoTemplate.remove(q, FlowStateDocument.class).getDeletedCount());
    }

    @Override
    public List<String> listParticipantIds() {
        return execute("listParticipantIds", () -> mongoTemplate
                .findDistinct(new Query(), "participantId", FlowStateDocument.class, String.class)
                .stream()
                .sorted()
                .toList());
    }

    private static FlowStateDocument toDocument(ParticipantFlowState state) {
        FlowStateDocument doc = new FlowStateDocument();
        doc.setId(FlowStateDocument.idOf(state.participantId(), state.flowType()));
        doc.setParticipantId(state.participantId());
        doc.setFlowType(state.flowType());
        doc.setCurrentState(state.currentState());
        doc.setStateData(new HashMap<>(state.stateData()));
        doc.setCreatedAt(state.createdAt());
        doc.setUpdatedAt(state.updatedAt());
        return doc;
    }

    private static ParticipantFlowState toState(FlowStateDocument doc) {
        return new ParticipantFlowState(
                doc.getParticipantId(),
                doc.getFlowType(),
                doc.getCurrentState(),
                doc.getStateData(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new TransientDependencyException("flow state store " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
