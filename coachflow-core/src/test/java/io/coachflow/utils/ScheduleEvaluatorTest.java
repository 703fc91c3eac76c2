package io.coachflow.utils;

import io.coachflow.core.ScheduleSpec;
import io.coachflow.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleEvaluatorTest {

    @Test
    void dailyShouldFireLaterTheSameDay() {
        Instant next = ScheduleEvaluator.nextOccurrence(
                ScheduleSpec.daily(9, 0, "UTC"), Instant.parse("2026-01-01T08:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T09:00:00Z"), next);
    }

    @Test
    void resultShouldBeStrictlyAfterReference() {
        Instant next = ScheduleEvaluator.nextOccurrence(
                ScheduleSpec.daily(9, 0, "UTC"), Instant.parse("2026-01-01T09:00:00Z"));
        assertEquals(Instant.parse("2026-01-02T09:00:00Z"), next);
    }

    @Test
    void weeklyShouldUseLocalWallClock() {
        // Monday 09:00 in Toronto (EST, UTC-5)
        Instant next = ScheduleEvaluator.nextOccurrence(
                ScheduleSpec.weekly(1, 9, 0, "America/Toronto"), Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-05T14:00:00Z"), next);
    }

    @Test
    void dailyShouldFollowDaylightSavingChange() {
        // 2026-03-07 10:00 EST; DST starts on 2026-03-08
        Instant next = ScheduleEvaluator.nextOccurrence(
                ScheduleSpec.daily(9, 0, "America/Toronto"), Instant.parse("2026-03-07T15:00:00Z"));
        assertEquals(Instant.parse("2026-03-08T13:00:00Z"), next);
    }

    @Test
    void dayOfMonthAndWeekdayShouldBothMatch() {
        // Friday the 13th
        ScheduleSpec spec = new ScheduleSpec(0, 0, 13, null, 5, "UTC");
        Instant next = ScheduleEvaluator.nextOccurrence(spec, Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-02-13T00:00:00Z"), next);

        Instant after = ScheduleEvaluator.nextOccurrence(spec, next);
        assertEquals(Instant.parse("2026-03-13T00:00:00Z"), after);
    }

    @Test
    void leapDayShouldBeFoundInALaterYear() {
        ScheduleSpec spec = new ScheduleSpec(0, 12, 29, 2, null, "UTC");
        Instant next = ScheduleEvaluator.nextOccurrence(spec, Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2028-02-29T12:00:00Z"), next);
    }

    @Test
    void impossibleDateShouldBeRejected() {
        ScheduleSpec spec = new ScheduleSpec(0, 12, 30, 2, null, "UTC");
        assertThrows(ValidationException.class,
                () -> ScheduleEvaluator.nextOccurrence(spec, Instant.parse("2026-01-01T00:00:00Z")));
    }

    @Test
    void outOfRangeFieldsShouldBeRejected() {
        assertThrows(ValidationException.class, () -> ScheduleEvaluator.validate(new ScheduleSpec(60, 9, null, null, null, "UTC")));
        assertThrows(ValidationException.class, () -> ScheduleEvaluator.validate(new ScheduleSpec(0, 24, null, null, null, "UTC")));
        assertThrows(ValidationException.class, () -> ScheduleEvaluator.validate(new ScheduleSpec(0, 9, null, null, 7, "UTC")));
        assertThrows(ValidationException.class, () -> ScheduleEvaluator.validate(new ScheduleSpec(0, 9, 0, null, null, "UTC")));
    }

    @Test
    void specWithoutConstraintsShouldBeRejected() {
        assertThrows(ValidationException.class,
                () -> ScheduleEvaluator.validate(new ScheduleSpec(null, null, null, null, null, "UTC")));
    }

    @Test
    void unknownTimezoneShouldCarryHint() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> ScheduleEvaluator.validate(ScheduleSpec.daily(9, 0, "Mars/Olympus")));
        assertTrue(ex.hasHint());
    }

    @Test
    void missingTimezoneShouldDefaultToUtc() {
        Instant next = ScheduleEvaluator.nextOccurrence(
                ScheduleSpec.daily(9, 30, null), Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T09:30:00Z"), next);
    }

    @Test
    void toQuartzCronShouldMapWeekdayToQuartzNumbering() {
        assertEquals("0 0 9 ? * 1", ScheduleEvaluator.toQuartzCron(ScheduleSpec.weekly(0, 9, 0, "UTC")));
        assertEquals("0 30 8 * * ?", ScheduleEvaluator.toQuartzCron(ScheduleSpec.daily(8, 30, "UTC")));
    }
}
