package io.coachflow.participant;

import io.coachflow.core.FlowTypes;
import io.coachflow.recovery.FlowRecoverer;
import io.coachflow.routing.ResponseRoute;
import io.coachflow.store.ParticipantFlowState;

import java.util.Optional;

/**
 * Restores reply routing from the enrollment record.
 */
public class ParticipantFlowRecoverer implements FlowRecoverer {

    @Override
    public String flowType() {
        return FlowTypes.PARTICIPANT;
    }

    @Override
    public boolean isTerminal(ParticipantFlowState state) {
        return !ParticipantDirectory.STATE_ENROLLED.equals(state.currentState());
    }

    @Override
    public Optional<ResponseRoute> responseRoute(ParticipantFlowState state) {
        String address = state.get(ParticipantDirectory.KEY_ADDRESS);
        String replyFlow = state.get(ParticipantDirectory.KEY_REPLY_FLOW);
        if (address == null || replyFlow == null) {
            return Optional.empty();
        }
        return Optional.of(new ResponseRoute(address, state.participantId(), replyFlow));
    }
}
