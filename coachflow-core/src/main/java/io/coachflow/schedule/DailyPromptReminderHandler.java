package io.coachflow.schedule;

import io.coachflow.JobHandler;

import java.util.Objects;

public class DailyPromptReminderHandler implements JobHandler<DailyPromptReminderHandler.Payload> {

    public static final String KIND = "daily_prompt_reminder";

    /**
     * @param sentAt ISO instant of the prompt this reminder belongs to
     */
    public record Payload(String participantId, String sentAt) {
    }

    private final DailyPromptSender sender;

    public DailyPromptReminderHandler(DailyPromptSender sender) {
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
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
        sender.remind(payload.participantId(), payload.sentAt());
    }
}
