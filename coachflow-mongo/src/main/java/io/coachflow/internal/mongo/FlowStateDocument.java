package io.coachflow.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for one (participant, flow) record. The id is {@code <participantId>:<flowType>}.
 */
@Document(collection = FlowStateDocument.COLLECTION)
public class FlowStateDocument {

    public static final String COLLECTION = "coachflow_flow_states";

    @Id
    private String id;

    private String participantId;
    private String flowType;
    private String currentState;
    private Map<String, String> stateData;
    private Instant createdAt;
    private Instant updatedAt;

    public FlowStateDocument() {
    }

    static String idOf(String participantId, String flowType) {
        return participantId + ":" + flowType;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getParticipantId() {
        return participantId;
    }

    public void setParticipantId(String participantId) {
        this.participantId = participantId;
    }

    public String getFlowType() {
        return flowType;
    }

    public void setFlowType(String flowType) {
        this.flowType = flowType;
    }

    public String getCurrentState() {
        return currentState;
    }

    public void setCurrentState(String currentState) {
        this.currentState = currentState;
    }

    public Map<String, String> getStateData() {
        return stateData;
    }

    public void setStateData(Map<String, String> stateData) {
        this.stateData = stateData;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
