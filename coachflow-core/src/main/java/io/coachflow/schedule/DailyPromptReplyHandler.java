package io.coachflow.schedule;

import io.coachflow.core.FlowTypes;
import io.coachflow.routing.ReplyHandler;

import java.util.Objects;

public class DailyPromptReplyHandler implements ReplyHandler {

    private final ScheduleService scheduleService;

    public DailyPromptReplyHandler(ScheduleService scheduleService) {
        this.scheduleService = Objects.requireNonNull(scheduleService, "scheduleService must not be null");
    }

    @Override
    public String flowType() {
        return FlowTypes.CONVERSATION;
    }

    @Override
    public void onReply(String participantId, String text) {
        scheduleService.recordReply(participantId, text);
    }
}
