package io.coachflow.participant;

import io.coachflow.core.FlowTypes;
import io.coachflow.exception.ValidationException;
import io.coachflow.recovery.FlowRecoverer;
import io.coachflow.recovery.PendingTimers;
import io.coachflow.routing.ResponseRoute;
import io.coachflow.routing.ResponseRouter;
import io.coachflow.spi.MessageSender;
import io.coachflow.state.StateManager;
import io.coachflow.store.ParticipantFlowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Enrollment and withdrawal. Withdrawal is the explicit reset that deletes a participant's flow
 * records, after cancelling every timer and schedule they still reference.
 */
public class ParticipantService {
    private static final Logger log = LoggerFactory.getLogger(ParticipantService.class);

    private final MessageSender messageSender;
    private final StateManager stateManager;
    private final ParticipantDirectory directory;
    private final ResponseRouter responseRouter;
    private final PendingTimers pendingTimers;
    private final Map<String, FlowRecoverer> recoverers;

    public ParticipantService(MessageSender messageSender,
                              StateManager stateManager,
                              ParticipantDirectory directory,
                              ResponseRouter responseRouter,
                              PendingTimers pendingTimers,
                              List<FlowRecoverer> recoverers) {
        this.messageSender = Objects.requireNonNull(messageSender, "messageSender must not be null");
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.responseRouter = Objects.requireNonNull(responseRouter, "responseRouter must not be null");
        this.pendingTimers = Objects.requireNonNull(pendingTimers, "pendingTimers must not be null");
        this.recoverers = recoverers.stream()
                .collect(Collectors.toUnmodifiableMap(FlowRecoverer::flowType, Function.identity(), (a, b) -> a));
    }

    /**
     * Validate the address, store it and route replies from it to {@code replyFlow}.
     *
     * @return canonical address
     */
    public String enroll(String participantId, String address, String replyFlow) {
        if (participantId == null || participantId.isBlank()) {
            throw new ValidationException("participantId must not be blank");
        }
        if (replyFlow == null || replyFlow.isBlank()) {
            throw new ValidationException("replyFlow must not be blank");
        }
        String canonical = messageSender.validateRecipient(address);

        directory.addressOf(participantId)
                .filter(previous -> !previous.equals(canonical))
                .ifPresent(responseRouter::unregister);

        directory.record(participantId, canonical, replyFlow);
        responseRouter.register(new ResponseRoute(canonical, participantId, replyFlow));
        log.info("participant enrolled participantId={} replyFlow={}", participantId, replyFlow);
        return canonical;
    }

    public String enroll(String participantId, String address) {
        return enroll(participantId, address, FlowTypes.CONVERSATION);
    }

    /**
     * @return false if the participant had no state
     */
    public boolean withdraw(String participantId) {
        List<ParticipantFlowState> states = stateManager.findAll(participantId);
        if (states.isEmpty()) {
            return false;
        }

        for (ParticipantFlowState state : states) {
            pendingTimers.disarmAll(state);
            FlowRecoverer recoverer = recoverers.get(state.flowType());
            if (recoverer != null) {
                recoverer.release(state);
            }
        }
        directory.addressOf(participantId).ifPresent(responseRouter::unregister);
        stateManager.reset(participantId);
        log.info("participant withdrawn participantId={} flows={}", participantId, states.size());
        return true;
    }
}
