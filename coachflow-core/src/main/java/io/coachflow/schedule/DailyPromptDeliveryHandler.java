package io.coachflow.schedule;

import io.coachflow.JobHandler;
import io.coachflow.core.FlowTypes;
import io.coachflow.recovery.PendingTimers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Sends the prompt of a window schedule at the minute drawn by {@link DailyPromptHandler}.
 */
public class DailyPromptDeliveryHandler implements JobHandler<DailyPromptDeliveryHandler.Payload> {
    private static final Logger log = LoggerFactory.getLogger(DailyPromptDeliveryHandler.class);

    public static final String KIND = "daily_prompt_delivery";

    public record Payload(String participantId, String scheduleId) {
    }

    private final ScheduleRegistry registry;
    private final DailyPromptSender sender;
    private final PendingTimers pendingTimers;

    public DailyPromptDeliveryHandler(ScheduleRegistry registry, DailyPromptSender sender, PendingTimers pendingTimers) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.pendingTimers = Objects.requireNonNull(pendingTimers, "pendingTimers must not be null");
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
        pendingTimers.clear(payload.participantId(), FlowTypes.CONVERSATION, ScheduleService.deliveryTimerName(payload.scheduleId()));
        registry.find(payload.participantId(), payload.scheduleId())
                .ifPresentOrElse(
                        d -> sender.deliver(payload.participantId(), d),
                        () -> log.info("daily prompt delivery skipped; schedule no longer exists participantId={} scheduleId={}",
                                payload.participantId(), payload.scheduleId())
                );
    }
}
