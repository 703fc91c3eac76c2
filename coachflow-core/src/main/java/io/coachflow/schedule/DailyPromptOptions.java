package io.coachflow.schedule;

import java.time.Duration;
import java.util.Objects;

/**
 * @param reminderDelay     wait after a daily prompt before the reminder; zero disables reminders
 * @param defaultPrepOffset prep offset used when {@code createSchedule} gets none
 */
public record DailyPromptOptions(Duration reminderDelay, Duration defaultPrepOffset) {

    public DailyPromptOptions {
        Objects.requireNonNull(reminderDelay, "reminderDelay must not be null");
        Objects.requireNonNull(defaultPrepOffset, "defaultPrepOffset must not be null");
        if (reminderDelay.isNegative()) {
            throw new IllegalArgumentException("reminderDelay must not be negative");
        }
    }

    public static DailyPromptOptions defaults() {
        return new DailyPromptOptions(Duration.ofHours(4), Duration.ofMinutes(10));
    }

    public boolean remindersEnabled() {
        return !reminderDelay.isZero();
    }
}
