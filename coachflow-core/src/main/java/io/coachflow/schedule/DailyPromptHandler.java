package io.coachflow.schedule;

import io.coachflow.JobHandler;
import io.coachflow.core.FlowTypes;
import io.coachflow.core.TimerAction;
import io.coachflow.recovery.PendingTimers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Fires at a schedule's prep time. Fixed schedules send the prompt right away; window schedules arm a
 * one-off delivery at a uniformly random minute inside the window.
 */
public class DailyPromptHandler implements JobHandler<DailyPromptHandler.Payload> {
    private static final Logger log = LoggerFactory.getLogger(DailyPromptHandler.class);

    public static final String KIND = "daily_prompt";

    /**
     * @param sameDay true for the one-off that covers the day the schedule was created
     */
    public record Payload(String participantId, String scheduleId, boolean sameDay) {
    }

    private final ScheduleRegistry registry;
    private final DailyPromptSender sender;
    private final PendingTimers pendingTimers;
    private final Random random;

    public DailyPromptHandler(ScheduleRegistry registry, DailyPromptSender sender, PendingTimers pendingTimers, Random random) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.pendingTimers = Objects.requireNonNull(pendingTimers, "pendingTimers must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Class<Payload> payloadClass() {
        return Payload.class;
    }

    @Override
    public void execute(Payload payload) {
        String participantId = payload.participantId();
        if (payload.sameDay()) {
            pendingTimers.clear(participantId, FlowTypes.CONVERSATION, ScheduleService.sameDayTimerName(payload.scheduleId()));
        }

        Optional<ScheduleDescriptor> schedule = registry.find(participantId, payload.scheduleId());
        if (schedule.isEmpty()) {
            log.info("daily prompt skipped; schedule no longer exists participantId={} scheduleId={}",
                    participantId, payload.scheduleId());
            return;
        }

        ScheduleDescriptor d = schedule.get();
        if (sender.sentToday(participantId, d)) {
            log.info("daily prompt skipped; already sent today participantId={} scheduleId={}", participantId, d.id());
            return;
        }
        switch (d.type()) {
            case FIXED -> sender.deliver(participantId, d);
            case RANDOM_WINDOW -> {
                long window = Math.max(1, d.windowMinutes());
                Duration delay = Duration.ofMinutes((long) random.nextInt((int) window));
                pendingTimers.armAfter(
                        participantId,
                        FlowTypes.CONVERSATION,
                        ScheduleService.deliveryTimerName(d.id()),
                        new TimerAction(
                                DailyPromptDeliveryHandler.KIND,
                                Map.of("participantId", participantId, "scheduleId", d.id()),
                                "delivery:" + participantId + ":" + d.id()
                        ),
                        delay
                );
                log.info("daily prompt delivery drawn participantId={} scheduleId={} delay={}", participantId, d.id(), delay);
            }
        }
    }
}
