package io.coachflow.core;

/**
 * Calendar pattern for recurring triggers. A null field is a wildcard; a set field must match
 * exactly. {@code weekday} uses 0 = Sunday .. 6 = Saturday. A null timezone means UTC.
 *
 * <p>When both {@code dayOfMonth} and {@code weekday} are set, an instant must satisfy both.
 */
public record ScheduleSpec(
        Integer minute,
        Integer hour,
        Integer dayOfMonth,
        Integer month,
        Integer weekday,
        String timezone
) {
    public static final String DEFAULT_TIMEZONE = "UTC";

    public static ScheduleSpec daily(int hour, int minute, String timezone) {
        return new ScheduleSpec(minute, hour, null, null, null, timezone);
    }

    public static ScheduleSpec weekly(int weekday, int hour, int minute, String timezone) {
        return new ScheduleSpec(minute, hour, null, null, weekday, timezone);
    }

    public String timezoneOrDefault() {
        return (timezone == null || timezone.isBlank()) ? DEFAULT_TIMEZONE : timezone;
    }

    public boolean constrainsNothing() {
        return minute == null && hour == null && dayOfMonth == null && month == null && weekday == null;
    }
}
