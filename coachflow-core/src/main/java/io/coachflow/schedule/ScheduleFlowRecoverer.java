package io.coachflow.schedule;

import io.coachflow.TimerService;
import io.coachflow.core.FlowTypes;
import io.coachflow.core.ScheduleSpec;
import io.coachflow.core.TimerHandle;
import io.coachflow.recovery.FlowRecoverer;
import io.coachflow.store.ParticipantFlowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Re-arms every registered daily schedule after a restart and cancels them on withdrawal.
 * Series keys are derived from participant and schedule id, so re-arming a durable series replaces
 * its pending occurrence.
 */
public class ScheduleFlowRecoverer implements FlowRecoverer {
    private static final Logger log = LoggerFactory.getLogger(ScheduleFlowRecoverer.class);

    private final ScheduleRegistry registry;
    private final TimerService timerService;

    public ScheduleFlowRecoverer(ScheduleRegistry registry, TimerService timerService) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.timerService = Objects.requireNonNull(timerService, "timerService must not be null");
    }

    @Override
    public String flowType() {
        return FlowTypes.CONVERSATION;
    }

    @Override
    public void rearmRecurring(ParticipantFlowState state) {
        String participantId = state.participantId();
        for (ScheduleDescriptor d : registry.list(state)) {
            ScheduleSpec spec = ScheduleSpec.daily(d.prepLocalTime().getHour(), d.prepLocalTime().getMinute(), d.timezone());
            TimerHandle handle = timerService.recurring(
                    spec,
                    ScheduleService.promptAction(participantId, d.id(), false),
                    d.recurringNotBeforeInstant()
            );
            log.info("schedule re-armed participantId={} scheduleId={} prepTime={} handle={}",
                    participantId, d.id(), d.prepTime(), handle);

            if (!handle.value().equals(d.recurringHandle())) {
                try {
                    registry.put(participantId, d.withRecurringHandle(handle.value()));
                } catch (RuntimeException e) {
                    log.warn("schedule re-armed but handle not recorded participantId={} scheduleId={} msg={}",
                            participantId, d.id(), e.getMessage());
                }
            }
        }
    }

    @Override
    public void release(ParticipantFlowState state) {
        for (ScheduleDescriptor d : registry.list(state)) {
            timerService.cancel(TimerHandle.of(d.recurringHandle()));
        }
    }
}
