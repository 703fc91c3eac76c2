package io.coachflow.utils;

import io.coachflow.core.ScheduleSpec;
import io.coachflow.exception.ValidationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Computes the next trigger instant of a {@link ScheduleSpec}.
 * <p>
 * The schedule is translated into a Quartz {@link CronExpression} with second 0, so results have minute
 * granularity and are always strictly after the reference instant. Quartz cannot constrain
 * day-of-month and day-of-week in one expression; when a schedule sets both, the day-of-month expression
 * is evaluated and candidates on other weekdays are skipped a whole day at a time.
 */
public final class ScheduleEvaluator {

    // Every calendar date falls on every weekday within one 400-year Gregorian cycle.
    private static final int MAX_WEEKDAY_SKIPS = 400 * 12;

    private ScheduleEvaluator() {
    }

    /**
     * @param spec      schedule pattern
     * @param reference instant the result must be strictly after
     * @return earliest matching instant after {@code reference}
     * @throws ValidationException if the schedule is empty, out of range, or can never match
     */
    public static Instant nextOccurrence(ScheduleSpec spec, Instant reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        validate(spec);

        ZoneId zone = zoneOf(spec.timezoneOrDefault());
        CronExpression exp = compile(toQuartzCron(spec), zone);

        Date next = exp.getNextValidTimeAfter(Date.from(reference));
        if (spec.dayOfMonth() != null && spec.weekday() != null) {
            DayOfWeek wanted = toDayOfWeek(spec.weekday());
            int skips = 0;
            while (next != null) {
                ZonedDateTime candidate = ZonedDateTime.ofInstant(next.toInstant(), zone);
                if (candidate.getDayOfWeek() == wanted) {
                    break;
                }
                if (++skips > MAX_WEEKDAY_SKIPS) {
                    next = null;
                    break;
                }
                // Jump past the rest of this day: any later candidate today has the same weekday.
                ZonedDateTime endOfDay = candidate.toLocalDate().plusDays(1).atStartOfDay(zone).minusSeconds(1);
                next = exp.getNextValidTimeAfter(Date.from(endOfDay.toInstant()));
            }
        }

        if (next == null) {
            throw new ValidationException("schedule never matches: " + describe(spec));
        }
        return next.toInstant();
    }

    /**
     * Reject specs that are empty, out of range, or name a day that never exists in the given month.
     */
    public static void validate(ScheduleSpec spec) {
        if (spec == null) {
            throw new ValidationException("schedule spec must not be null");
        }
        if (spec.constrainsNothing()) {
            throw new ValidationException("schedule spec must constrain at least one field");
        }
        checkRange("minute", spec.minute(), 0, 59);
        checkRange("hour", spec.hour(), 0, 23);
        checkRange("dayOfMonth", spec.dayOfMonth(), 1, 31);
        checkRange("month", spec.month(), 1, 12);
        checkRange("weekday", spec.weekday(), 0, 6);
        zoneOf(spec.timezoneOrDefault());

        Integer dom = spec.dayOfMonth();
        Integer month = spec.month();
        if (dom != null && month != null) {
            int maxDay = switch (month) {
                case 2 -> 29;
                case 4, 6, 9, 11 -> 30;
                default -> 31;
            };
            if (dom > maxDay) {
                throw new ValidationException("schedule never matches: day " + dom + " does not exist in month " + month);
            }
        }
    }

    public static ZoneId zoneOf(String timezone) {
        try {
            return ZoneId.of(timezone == null || timezone.isBlank() ? ScheduleSpec.DEFAULT_TIMEZONE : timezone);
        } catch (DateTimeException e) {
            throw new ValidationException(
                    "unknown timezone: " + timezone,
                    "Use an IANA timezone name such as America/Toronto or Europe/London"
            );
        }
    }

    static String toQuartzCron(ScheduleSpec spec) {
        String minute = field(spec.minute());
        String hour = field(spec.hour());
        String month = field(spec.month());

        String dom;
        String dow;
        if (spec.weekday() != null && spec.dayOfMonth() == null) {
            dom = "?";
            dow = String.valueOf(spec.weekday() + 1); // Quartz: 1 = SUN
        } else {
            dom = field(spec.dayOfMonth());
            dow = "?";
        }

        return String.join(" ", "0", minute, hour, dom, month, dow);
    }

    private static CronExpression compile(String cron, ZoneId zone) {
        try {
            CronExpression exp = new CronExpression(cron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException e) {
            throw new ValidationException("invalid schedule expression: " + cron);
        }
    }

    private static String field(Integer value) {
        return value == null ? "*" : String.valueOf(value);
    }

    private static void checkRange(String name, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            throw new ValidationException(name + " must be between " + min + " and " + max + ": " + value);
        }
    }

    private static DayOfWeek toDayOfWeek(int weekday) {
        return weekday == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(weekday);
    }

    private static String describe(ScheduleSpec spec) {
        return "minute=" + spec.minute() + " hour=" + spec.hour() + " dayOfMonth=" + spec.dayOfMonth()
                + " month=" + spec.month() + " weekday=" + spec.weekday() + " tz=" + spec.timezoneOrDefault();
    }
}
