package io.coachflow.schedule;

import io.coachflow.TimerService;
import io.coachflow.core.FlowTypes;
import io.coachflow.core.ScheduleSpec;
import io.coachflow.core.TimerAction;
import io.coachflow.core.TimerHandle;
import io.coachflow.exception.NotFoundException;
import io.coachflow.exception.ValidationException;
import io.coachflow.recovery.PendingTimers;
import io.coachflow.utils.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Daily prompt schedules: create, list and delete.
 *
 * <p>A schedule fires every day at its prep time (target time, or window start, minus the prep
 * offset). When it is created before today's prep time, a one-off covers today and the recurring series
 * starts tomorrow; otherwise only the recurring series is armed.
 */
public class ScheduleService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");
    private static final Pattern TIME_LIKE = Pattern.compile(
            "^\\d{1,2}(:\\d{2})?\\s*([ap]\\.?m\\.?)?$", Pattern.CASE_INSENSITIVE);
    private static final Duration MAX_PREP_OFFSET = Duration.ofHours(12);

    private final TimerService timerService;
    private final PendingTimers pendingTimers;
    private final ScheduleRegistry registry;
    private final DailyPromptSender sender;
    private final DailyPromptOptions options;
    private final Clock clock;

    public ScheduleService(TimerService timerService,
                           PendingTimers pendingTimers,
                           ScheduleRegistry registry,
                           DailyPromptSender sender,
                           DailyPromptOptions options,
                           Clock clock) {
        this.timerService = Objects.requireNonNull(timerService, "timerService must not be null");
        this.pendingTimers = Objects.requireNonNull(pendingTimers, "pendingTimers must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param prepOffset how long before the target the prompt goes out; null uses the configured default
     * @return new schedule id
     * @throws ValidationException for blank ids, unknown timezones or out-of-range offsets
     */
    public String createSchedule(String participantId, ScheduleTarget target, String timezone, Duration prepOffset) {
        requireParticipant(participantId);
        if (target == null) {
            throw new ValidationException("schedule target must not be null");
        }
        ZoneId zone = ScheduleEvaluator.zoneOf(timezone);
        Duration offset = prepOffset == null ? options.defaultPrepOffset() : prepOffset;
        if (offset.isNegative() || offset.compareTo(MAX_PREP_OFFSET) > 0) {
            throw new ValidationException("prep offset must be between 0 and " + MAX_PREP_OFFSET.toHours() + " hours: " + offset);
        }

        LocalTime prep = target.anchor().minus(offset).truncatedTo(ChronoUnit.MINUTES);
        String scheduleId = "sch-" + UUID.randomUUID().toString().substring(0, 8);
        Instant now = clock.instant();
        Instant todayPrep = ZonedDateTime.of(now.atZone(zone).toLocalDate(), prep, zone).toInstant();
        boolean sameDay = now.isBefore(todayPrep);

        if (sameDay) {
            pendingTimers.arm(participantId, FlowTypes.CONVERSATION, sameDayTimerName(scheduleId),
                    promptAction(participantId, scheduleId, true), todayPrep);
        }

        Instant notBefore = sameDay ? todayPrep : null;
        TimerHandle recurring = timerService.recurring(
                ScheduleSpec.daily(prep.getHour(), prep.getMinute(), zone.getId()),
                promptAction(participantId, scheduleId, false),
                notBefore
        );

        ScheduleDescriptor descriptor = new ScheduleDescriptor(
                scheduleId,
                target.type(),
                target.time() == null ? null : target.time().format(HH_MM),
                target.windowStart() == null ? null : target.windowStart().format(HH_MM),
                target.windowEnd() == null ? null : target.windowEnd().format(HH_MM),
                zone.getId(),
                prep.format(HH_MM),
                offset.toMinutes(),
                target.habit(),
                now.toString(),
                recurring.value(),
                notBefore == null ? null : notBefore.toString()
        );

        try {
            registry.put(participantId, descriptor);
        } catch (RuntimeException e) {
            log.warn("schedule armed but not recorded participantId={} scheduleId={} handle={} msg={}",
                    participantId, scheduleId, recurring, e.getMessage());
        }

        log.info("schedule created participantId={} scheduleId={} type={} prepTime={} tz={} sameDay={}",
                participantId, scheduleId, target.type(), descriptor.prepTime(), zone.getId(), sameDay);
        return scheduleId;
    }

    public List<ScheduleDescriptor> listSchedules(String participantId) {
        requireParticipant(participantId);
        return registry.list(participantId);
    }

    /**
     * @throws NotFoundException   if the participant has no schedule with this id
     * @throws ValidationException if the id looks like a time of day; the hint lists the real ids
     */
    public void deleteSchedule(String participantId, String scheduleId) {
        requireParticipant(participantId);
        if (scheduleId == null || scheduleId.isBlank()) {
            throw new ValidationException("scheduleId must not be blank", listHint(participantId));
        }

        Optional<ScheduleDescriptor> schedule = registry.find(participantId, scheduleId);
        if (schedule.isEmpty()) {
            if (TIME_LIKE.matcher(scheduleId.trim()).matches()) {
                throw new ValidationException("'" + scheduleId + "' is a time of day, not a schedule id", listHint(participantId));
            }
            throw new NotFoundException("schedule", scheduleId);
        }

        ScheduleDescriptor d = schedule.get();
        timerService.cancel(TimerHandle.of(d.recurringHandle()));
        pendingTimers.disarm(participantId, FlowTypes.CONVERSATION, sameDayTimerName(d.id()));
        pendingTimers.disarm(participantId, FlowTypes.CONVERSATION, deliveryTimerName(d.id()));
        registry.remove(participantId, d.id());
        sender.forget(participantId, d.id());
        log.info("schedule deleted participantId={} scheduleId={}", participantId, d.id());
    }

    /**
     * Record a free-text reply to the daily prompt.
     *
     * @return true if a prompt was awaiting the reply
     */
    public boolean recordReply(String participantId, String text) {
        requireParticipant(participantId);
        return sender.recordReply(participantId, text);
    }

    static TimerAction promptAction(String participantId, String scheduleId, boolean sameDay) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("participantId", participantId);
        payload.put("scheduleId", scheduleId);
        if (sameDay) {
            payload.put("sameDay", true);
            return new TimerAction(DailyPromptHandler.KIND, payload, "prep:" + participantId + ":" + scheduleId);
        }
        return new TimerAction(DailyPromptHandler.KIND, payload, seriesKey(participantId, scheduleId));
    }

    static String seriesKey(String participantId, String scheduleId) {
        return "schedule:" + participantId + ":" + scheduleId;
    }

    static String sameDayTimerName(String scheduleId) {
        return "prep:" + scheduleId;
    }

    static String deliveryTimerName(String scheduleId) {
        return "delivery:" + scheduleId;
    }

    private String listHint(String participantId) {
        List<ScheduleDescriptor> schedules = registry.list(participantId);
        if (schedules.isEmpty()) {
            return "You have no schedules yet.";
        }
        return "Use a schedule id from your list: " + schedules.stream()
                .map(d -> d.id() + " (prompt at " + d.prepTime() + ")")
                .collect(Collectors.joining(", "));
    }

    private static void requireParticipant(String participantId) {
        if (participantId == null || participantId.isBlank()) {
            throw new ValidationException("participantId must not be blank");
        }
    }
}
