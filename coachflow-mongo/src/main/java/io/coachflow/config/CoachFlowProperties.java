package io.coachflow.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the coachflow scheduler and flows.
 */
@ConfigurationProperties(prefix = "coachflow")
public class CoachFlowProperties {

    public enum TimerMode {
        /**
         * Timers are jobs in the job table and survive restarts.
         */
        DURABLE,
        /**
         * Timers live in process memory; recovery re-arms them from participant state.
         */
        IN_MEMORY
    }

    private boolean enabled = true;
    private Duration processEvery = Duration.ofSeconds(5);
    private int batchSize = 10;
    private int maxConcurrency = 8; // global
    private Duration lockLifetime = Duration.ofMinutes(5);
    private String workerId;
    private boolean ensureIndexesOnStartup = false;
    private TimerMode timerMode = TimerMode.DURABLE;
    private boolean recoverOnStartup = true;
    private Duration recoveryGrace = Duration.ofSeconds(5);
    private Duration dailyPromptReminderDelay = Duration.ofHours(4); // zero disables reminders
    private Duration defaultPrepOffset = Duration.ofMinutes(10);
    private final Timeouts timeouts = new Timeouts();

    /**
     * Wait durations of the micro-intervention states.
     */
    public static class Timeouts {
        private Duration commitment = Duration.ofHours(12);
        private Duration feeling = Duration.ofMinutes(15);
        private Duration completion = Duration.ofMinutes(30);
        private Duration followUp = Duration.ofMinutes(15);

        public Duration getCommitment() {
            return commitment;
        }

        public void setCommitment(Duration commitment) {
            this.commitment = commitment;
        }

        public Duration getFeeling() {
            return feeling;
        }

        public void setFeeling(Duration feeling) {
            this.feeling = feeling;
        }

        public Duration getCompletion() {
            return completion;
        }

        public void setCompletion(Duration completion) {
            this.completion = completion;
        }

        public Duration getFollowUp() {
            return followUp;
        }

        public void setFollowUp(Duration followUp) {
            this.followUp = followUp;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getLockLifetime() {
        return lockLifetime;
    }

    public void setLockLifetime(Duration lockLifetime) {
        this.lockLifetime = lockLifetime;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public TimerMode getTimerMode() {
        return timerMode;
    }

    public void setTimerMode(TimerMode timerMode) {
        this.timerMode = timerMode;
    }

    public boolean isRecoverOnStartup() {
        return recoverOnStartup;
    }

    public void setRecoverOnStartup(boolean recoverOnStartup) {
        this.recoverOnStartup = recoverOnStartup;
    }

    public Duration getRecoveryGrace() {
        return recoveryGrace;
    }

    public void setRecoveryGrace(Duration recoveryGrace) {
        this.recoveryGrace = recoveryGrace;
    }

    public Duration getDailyPromptReminderDelay() {
        return dailyPromptReminderDelay;
    }

    public void setDailyPromptReminderDelay(Duration dailyPromptReminderDelay) {
        this.dailyPromptReminderDelay = dailyPromptReminderDelay;
    }

    public Duration getDefaultPrepOffset() {
        return defaultPrepOffset;
    }

    public void setDefaultPrepOffset(Duration defaultPrepOffset) {
        this.defaultPrepOffset = defaultPrepOffset;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }
}
