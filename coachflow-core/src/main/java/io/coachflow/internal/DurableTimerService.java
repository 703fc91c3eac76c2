package io.coachflow.internal;

import io.coachflow.TimerService;
import io.coachflow.core.Job;
import io.coachflow.core.JobRequest;
import io.coachflow.core.ScheduleSpec;
import io.coachflow.core.TimerAction;
import io.coachflow.core.TimerHandle;
import io.coachflow.store.JobStore;
import io.coachflow.utils.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link io.coachflow.TimerService} backed by the job table; armed timers survive restarts.
 *
 * <p>Handles are {@code job:<id>} for one-off timers and {@code series:<dedupeKey>} for recurring ones.
 * A series handle stays valid across re-arms because every occurrence carries the series key.
 */
public class DurableTimerService implements TimerService {
    private static final Logger log = LoggerFactory.getLogger(DurableTimerService.class);

    static final String JOB_PREFIX = "job:";
    static final String SERIES_PREFIX = "series:";

    private final JobStore jobStore;
    private final Clock clock;

    public DurableTimerService(JobStore jobStore, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public TimerHandle after(Duration delay, TimerAction action) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return at(clock.instant().plus(delay), action);
    }

    @Override
    public TimerHandle at(Instant time, TimerAction action) {
        Objects.requireNonNull(time, "time must not be null");
        Objects.requireNonNull(action, "action must not be null");

        Job job = jobStore.enqueue(
                JobRequest.oneOff(action.kind(), time, action.payload(), action.dedupeKey()),
                clock.instant()
        );
        log.debug("timer armed kind={} runAt={} jobId={} dedupeKey={}", action.kind(), time, job.id(), job.dedupeKey());
        return new TimerHandle(JOB_PREFIX + job.id());
    }

    @Override
    public TimerHandle recurring(ScheduleSpec spec, TimerAction action) {
        return recurring(spec, action, null);
    }

    @Override
    public TimerHandle recurring(ScheduleSpec spec, TimerAction action, Instant notBefore) {
        Objects.requireNonNull(action, "action must not be null");
        Instant now = clock.instant();
        Instant from = (notBefore != null && notBefore.isAfter(now)) ? notBefore : now;
        Instant first = ScheduleEvaluator.nextOccurrence(spec, from);

        String seriesKey = action.dedupeKey() != null ? action.dedupeKey() : "series-" + UUID.randomUUID();
        Job job = jobStore.enqueue(new JobRequest(action.kind(), first, action.payload(), seriesKey, spec), now);
        log.debug("recurring timer armed kind={} firstRunAt={} jobId={} series={}", action.kind(), first, job.id(), seriesKey);
        return new TimerHandle(SERIES_PREFIX + seriesKey);
    }

    @Override
    public void cancel(TimerHandle handle) {
        if (handle == null) {
            return;
        }
        String value = handle.value();
        Instant now = clock.instant();
        if (value.startsWith(JOB_PREFIX)) {
            boolean cancelled = jobStore.cancel(value.substring(JOB_PREFIX.length()), now);
            log.debug("timer cancel handle={} cancelled={}", value, cancelled);
        } else if (value.startsWith(SERIES_PREFIX)) {
            long cancelled = jobStore.cancelByDedupeKey(value.substring(SERIES_PREFIX.length()), now);
            log.debug("recurring timer cancel handle={} cancelled={}", value, cancelled);
        } else {
            log.debug("timer cancel ignored; handle not issued by durable backing handle={}", value);
        }
    }
}
