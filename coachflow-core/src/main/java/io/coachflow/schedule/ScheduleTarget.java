package io.coachflow.schedule;

import io.coachflow.exception.ValidationException;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * When a participant wants to be prompted: a fixed time of day, or a window {@code [start, end)}.
 */
public record ScheduleTarget(
        ScheduleType type,
        LocalTime time,
        LocalTime windowStart,
        LocalTime windowEnd,
        String habit
) {
    public ScheduleTarget {
        if (type == null) {
            throw new ValidationException("schedule type must not be null");
        }
        if (type == ScheduleType.FIXED && time == null) {
            throw new ValidationException("fixed schedule needs a time of day");
        }
        if (type == ScheduleType.RANDOM_WINDOW) {
            if (windowStart == null || windowEnd == null) {
                throw new ValidationException("random window schedule needs a start and an end time");
            }
            if (!windowEnd.isAfter(windowStart)) {
                throw new ValidationException(
                        "window end " + windowEnd + " must be after window start " + windowStart,
                        "Give the window as two times on the same day, e.g. 08:00-10:00"
                );
            }
        }
    }

    public static ScheduleTarget fixed(String time) {
        return fixed(parseTime(time));
    }

    public static ScheduleTarget fixed(LocalTime time) {
        return new ScheduleTarget(ScheduleType.FIXED, truncate(time), null, null, null);
    }

    public static ScheduleTarget window(String start, String end) {
        return window(parseTime(start), parseTime(end));
    }

    public static ScheduleTarget window(LocalTime start, LocalTime end) {
        return new ScheduleTarget(ScheduleType.RANDOM_WINDOW, null, truncate(start), truncate(end), null);
    }

    public ScheduleTarget withHabit(String habit) {
        return new ScheduleTarget(type, time, windowStart, windowEnd, habit);
    }

    /**
     * Time the prep offset is measured from: the fixed time, or the window start.
     */
    public LocalTime anchor() {
        return type == ScheduleType.FIXED ? time : windowStart;
    }

    public Duration windowLength() {
        return type == ScheduleType.FIXED ? Duration.ZERO : Duration.between(windowStart, windowEnd);
    }

    /**
     * Parse {@code HH:mm} (or {@code H:mm}).
     */
    public static LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("time must not be blank", "Use 24-hour HH:mm, e.g. 09:30");
        }
        String s = value.trim();
        if (s.matches("^\\d:\\d{2}$")) {
            s = "0" + s;
        }
        try {
            return LocalTime.parse(s);
        } catch (DateTimeParseException e) {
            throw new ValidationException("not a time of day: " + value, "Use 24-hour HH:mm, e.g. 09:30");
        }
    }

    private static LocalTime truncate(LocalTime t) {
        return t == null ? null : t.truncatedTo(ChronoUnit.MINUTES);
    }
}
