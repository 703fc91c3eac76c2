package io.coachflow.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.coachflow.core.FlowTypes;
import io.coachflow.core.ScheduleSpec;
import io.coachflow.core.TimerAction;
import io.coachflow.participant.ParticipantDirectory;
import io.coachflow.recovery.PendingTimer;
import io.coachflow.recovery.PendingTimers;
import io.coachflow.spi.ContentGenerator;
import io.coachflow.spi.MessageSender;
import io.coachflow.state.StateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sends daily prompts, tracks the prompt awaiting a reply and sends at most one reminder for it.
 */
public class DailyPromptSender {
    private static final Logger log = LoggerFactory.getLogger(DailyPromptSender.class);

    static final String KEY_PENDING = "dailyPromptPending";
    static final String KEY_LAST_REPLY_AT = "lastReplyAt";
    static final String REMINDER_TIMER = "dailyPromptReminder";
    static final String KEY_LAST_PROMPT_PREFIX = "lastPromptDate:";

    static final String REMINDER_TEXT =
            "Just checking in: we haven't heard back from you about today's plan. Reply whenever you're ready.";

    private final StateManager stateManager;
    private final ParticipantDirectory directory;
    private final PendingTimers pendingTimers;
    private final MessageSender messageSender;
    private final ContentGenerator contentGenerator;
    private final ObjectMapper objectMapper;
    private final DailyPromptOptions options;
    private final Clock clock;

    public DailyPromptSender(StateManager stateManager,
                             ParticipantDirectory directory,
                             PendingTimers pendingTimers,
                             MessageSender messageSender,
                             ContentGenerator contentGenerator,
                             ObjectMapper objectMapper,
                             DailyPromptOptions options,
                             Clock clock) {
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.pendingTimers = Objects.requireNonNull(pendingTimers, "pendingTimers must not be null");
        this.messageSender = Objects.requireNonNull(messageSender, "messageSender must not be null");
        this.contentGenerator = Objects.requireNonNull(contentGenerator, "contentGenerator must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Generate and send today's prompt for {@code schedule}, then arm its reminder. The local date is
     * recorded before sending, so a second firing for the same day is a no-op.
     *
     * @return false if the prompt was not sent
     */
    public boolean deliver(String participantId, ScheduleDescriptor schedule) {
        LocalDate today = today(schedule);
        if (sentOn(participantId, schedule.id(), today)) {
            log.info("daily prompt skipped; already sent today participantId={} scheduleId={} date={}",
                    participantId, schedule.id(), today);
            return false;
        }
        Optional<String> to = directory.addressOf(participantId);
        if (to.isEmpty()) {
            log.warn("daily prompt not sent; participant has no address participantId={} scheduleId={}",
                    participantId, schedule.id());
            return false;
        }

        Map<String, String> context = new HashMap<>();
        context.put("kind", "daily_prompt");
        context.put("scheduleId", schedule.id());
        context.put("prepTime", schedule.prepTime());
        if (schedule.habit() != null) {
            context.put("habit", schedule.habit());
        }
        String text = contentGenerator.generate(participantId, context);

        String lastPromptKey = lastPromptKey(schedule.id());
        stateManager.setStateData(participantId, FlowTypes.CONVERSATION, lastPromptKey, today.toString());
        try {
            messageSender.send(to.get(), text);
        } catch (RuntimeException e) {
            stateManager.removeStateData(participantId, FlowTypes.CONVERSATION, lastPromptKey);
            throw e;
        }

        Instant sentAt = clock.instant();
        Instant reminderDueAt = options.remindersEnabled() ? sentAt.plus(options.reminderDelay()) : null;
        DailyPromptPending pending = new DailyPromptPending(
                sentAt.toString(),
                to.get(),
                reminderDueAt == null ? null : reminderDueAt.toString(),
                schedule.id()
        );
        log.info("daily prompt sent participantId={} scheduleId={} reminderDueAt={}", participantId, schedule.id(), reminderDueAt);

        try {
            writePending(participantId, pending);
        } catch (RuntimeException e) {
            log.warn("daily prompt sent but pending marker not recorded; no reminder will follow participantId={} msg={}",
                    participantId, e.getMessage());
            return true;
        }

        if (reminderDueAt == null) {
            pendingTimers.disarm(participantId, FlowTypes.CONVERSATION, REMINDER_TIMER);
            return true;
        }
        pendingTimers.arm(
                participantId,
                FlowTypes.CONVERSATION,
                REMINDER_TIMER,
                new TimerAction(
                        DailyPromptReminderHandler.KIND,
                        Map.of("participantId", participantId, "sentAt", pending.sentAt()),
                        "reminder:" + participantId
                ),
                reminderDueAt
        );
        return true;
    }

    /**
     * Whether the prompt of {@code schedule} already went out on the current local date.
     */
    public boolean sentToday(String participantId, ScheduleDescriptor schedule) {
        return sentOn(participantId, schedule.id(), today(schedule));
    }

    /**
     * Drop the per-schedule delivery record; called when the schedule is deleted.
     */
    public void forget(String participantId, String scheduleId) {
        stateManager.removeStateData(participantId, FlowTypes.CONVERSATION, lastPromptKey(scheduleId));
    }

    /**
     * Send the reminder for the prompt sent at {@code sentAt}, unless the participant replied, a newer
     * prompt replaced it, or the reminder already went out.
     *
     * @return true if a reminder was sent
     */
    public boolean remind(String participantId, String sentAt) {
        Optional<DailyPromptPending> pending = readPending(participantId);
        boolean current = pending.isPresent()
                && pending.get().sentAt().equals(sentAt)
                && pending.get().reminderDueAt() != null;
        if (!current) {
            log.info("daily prompt reminder skipped; no longer pending participantId={} sentAt={}", participantId, sentAt);
            clearReminderMarker(participantId, sentAt);
            return false;
        }

        messageSender.send(pending.get().to(), REMINDER_TEXT);
        log.info("daily prompt reminder sent participantId={} sentAt={}", participantId, sentAt);
        writePending(participantId, pending.get().reminderSent());
        clearReminderMarker(participantId, sentAt);
        return true;
    }

    /**
     * Record a reply: clears the pending prompt and cancels its reminder.
     *
     * @return true if a prompt was pending
     */
    public boolean recordReply(String participantId, String text) {
        Optional<DailyPromptPending> pending = readPending(participantId);
        stateManager.update(participantId, FlowTypes.CONVERSATION, s -> s
                .withoutData(KEY_PENDING)
                .withData(KEY_LAST_REPLY_AT, clock.instant().toString()));
        if (pending.isEmpty()) {
            return false;
        }
        pendingTimers.disarm(participantId, FlowTypes.CONVERSATION, REMINDER_TIMER);
        log.info("daily prompt answered participantId={} scheduleId={}", participantId, pending.get().scheduleId());
        return true;
    }

    public Optional<DailyPromptPending> readPending(String participantId) {
        return stateManager.getStateData(participantId, FlowTypes.CONVERSATION, KEY_PENDING)
                .flatMap(json -> {
                    try {
                        return Optional.of(objectMapper.readValue(json, DailyPromptPending.class));
                    } catch (JsonProcessingException e) {
                        log.warn("pending daily prompt unreadable participantId={} msg={}", participantId, e.getMessage());
                        return Optional.empty();
                    }
                });
    }

    private boolean sentOn(String participantId, String scheduleId, LocalDate date) {
        return stateManager.getStateData(participantId, FlowTypes.CONVERSATION, lastPromptKey(scheduleId))
                .map(date.toString()::equals)
                .orElse(false);
    }

    private LocalDate today(ScheduleDescriptor schedule) {
        String zone = schedule.timezone() == null ? ScheduleSpec.DEFAULT_TIMEZONE : schedule.timezone();
        return LocalDate.ofInstant(clock.instant(), ZoneId.of(zone));
    }

    static String lastPromptKey(String scheduleId) {
        return KEY_LAST_PROMPT_PREFIX + scheduleId;
    }

    private void writePending(String participantId, DailyPromptPending pending) {
        try {
            stateManager.setStateData(participantId, FlowTypes.CONVERSATION, KEY_PENDING, objectMapper.writeValueAsString(pending));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("pending daily prompt is not serializable", e);
        }
    }

    // Only drop the marker if it still belongs to this prompt; a newer prompt re-uses the name.
    private void clearReminderMarker(String participantId, String sentAt) {
        Optional<PendingTimer> marker = pendingTimers.find(participantId, FlowTypes.CONVERSATION, REMINDER_TIMER);
        if (marker.isPresent() && sentAt.equals(String.valueOf(marker.get().payload().get("sentAt")))) {
            pendingTimers.clear(participantId, FlowTypes.CONVERSATION, REMINDER_TIMER);
        }
    }
}
