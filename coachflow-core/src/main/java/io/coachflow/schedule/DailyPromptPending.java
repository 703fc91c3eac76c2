package io.coachflow.schedule;

/**
 * The last daily prompt still waiting for a reply. Reminder handlers compare {@code sentAt} with the
 * value they were armed for and do nothing on mismatch.
 *
 * @param reminderDueAt null once the reminder was sent, or when reminders are disabled
 */
public record DailyPromptPending(String sentAt, String to, String reminderDueAt, String scheduleId) {

    public DailyPromptPending reminderSent() {
        return new DailyPromptPending(sentAt, to, null, scheduleId);
    }
}
