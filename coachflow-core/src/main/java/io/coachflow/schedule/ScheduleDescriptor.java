package io.coachflow.schedule;

import java.time.Instant;
import java.time.LocalTime;

/**
 * A registered daily schedule, as stored in the conversation flow's state data and returned by
 * {@code listSchedules}. Times are {@code HH:mm} in {@code timezone}; instants are ISO-8601.
 *
 * @param prepTime           when the daily prompt fires: target (or window start) minus the prep offset
 * @param recurringNotBefore the recurring series starts strictly after this instant; set when a
 *                           same-day one-off covers today
 */
public record ScheduleDescriptor(
        String id,
        ScheduleType type,
        String time,
        String windowStart,
        String windowEnd,
        String timezone,
        String prepTime,
        long prepOffsetMinutes,
        String habit,
        String createdAt,
        String recurringHandle,
        String recurringNotBefore
) {
    public LocalTime prepLocalTime() {
        return LocalTime.parse(prepTime);
    }

    public long windowMinutes() {
        if (type != ScheduleType.RANDOM_WINDOW) {
            return 0;
        }
        return java.time.Duration.between(LocalTime.parse(windowStart), LocalTime.parse(windowEnd)).toMinutes();
    }

    public Instant recurringNotBeforeInstant() {
        return recurringNotBefore == null ? null : Instant.parse(recurringNotBefore);
    }

    public ScheduleDescriptor withRecurringHandle(String handle) {
        return new ScheduleDescriptor(id, type, time, windowStart, windowEnd, timezone, prepTime,
                prepOffsetMinutes, habit, createdAt, handle, recurringNotBefore);
    }
}
