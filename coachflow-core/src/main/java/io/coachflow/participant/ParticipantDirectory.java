package io.coachflow.participant;

import io.coachflow.core.FlowTypes;
import io.coachflow.state.StateManager;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of the enrollment record.
 */
public class ParticipantDirectory {

    public static final String STATE_ENROLLED = "ENROLLED";
    static final String KEY_ADDRESS = "address";
    static final String KEY_REPLY_FLOW = "replyFlow";

    private final StateManager stateManager;

    public ParticipantDirectory(StateManager stateManager) {
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager must not be null");
    }

    public Optional<String> addressOf(String participantId) {
        return stateManager.getStateData(participantId, FlowTypes.PARTICIPANT, KEY_ADDRESS);
    }

    public boolean isEnrolled(String participantId) {
        return stateManager.getCurrentState(participantId, FlowTypes.PARTICIPANT)
                .map(STATE_ENROLLED::equals)
                .orElse(false);
    }

    void record(String participantId, String canonicalAddress, String replyFlow) {
        stateManager.update(participantId, FlowTypes.PARTICIPANT, s -> s
                .withData(KEY_ADDRESS, canonicalAddress)
                .withData(KEY_REPLY_FLOW, replyFlow)
                .withState(STATE_ENROLLED));
    }
}
