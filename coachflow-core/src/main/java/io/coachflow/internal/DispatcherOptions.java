package io.coachflow.internal;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link JobDispatcher}.
 *
 * @param processEvery  poll interval
 * @param batchSize     max jobs claimed per store round-trip
 * @param maxConcurrency max handlers running at once
 * @param lockLifetime  how long a claim is honored before another worker may reclaim the job
 * @param workerId      claim owner; generated from host and pid when blank
 */
public record DispatcherOptions(
        Duration processEvery,
        int batchSize,
        int maxConcurrency,
        Duration lockLifetime,
        String workerId
) {
    public DispatcherOptions {
        Objects.requireNonNull(processEvery, "processEvery must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (processEvery.isZero() || processEvery.isNegative()) {
            throw new IllegalArgumentException("processEvery must be a positive duration");
        }
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
    }

    public static DispatcherOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration processEvery = Duration.ofSeconds(5);
        private int batchSize = 10;
        private int maxConcurrency = 8;
        private Duration lockLifetime = Duration.ofMinutes(5);
        private String workerId;

        public Builder processEvery(Duration processEvery) {
            this.processEvery = processEvery;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder lockLifetime(Duration lockLifetime) {
            this.lockLifetime = lockLifetime;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public DispatcherOptions build() {
            return new DispatcherOptions(processEvery, batchSize, maxConcurrency, lockLifetime, workerId);
        }
    }
}
