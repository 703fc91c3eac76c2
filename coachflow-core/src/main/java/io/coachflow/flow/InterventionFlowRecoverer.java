package io.coachflow.flow;

import io.coachflow.TimerService;
import io.coachflow.core.TimerHandle;
import io.coachflow.recovery.FlowRecoverer;
import io.coachflow.store.ParticipantFlowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * State timeouts come back through their markers; this re-arms the daily start.
 */
public class InterventionFlowRecoverer implements FlowRecoverer {
    private static final Logger log = LoggerFactory.getLogger(InterventionFlowRecoverer.class);

    private final InterventionFlow flow;
    private final TimerService timerService;

    public InterventionFlowRecoverer(InterventionFlow flow, TimerService timerService) {
        this.flow = Objects.requireNonNull(flow, "flow must not be null");
        this.timerService = Objects.requireNonNull(timerService, "timerService must not be null");
    }

    @Override
    public String flowType() {
        return InterventionFlow.FLOW_TYPE;
    }

    @Override
    public void rearmRecurring(ParticipantFlowState state) {
        flow.dailyStart(state).ifPresent(spec -> {
            TimerHandle handle = flow.armDailyStart(state.participantId(), spec);
            log.info("intervention daily start re-armed participantId={} handle={}", state.participantId(), handle);
        });
    }

    @Override
    public void release(ParticipantFlowState state) {
        timerService.cancel(TimerHandle.of(state.get(InterventionFlow.KEY_DAILY_START_HANDLE)));
    }
}
