package io.coachflow.internal;

import io.coachflow.JobHandler;
import io.coachflow.TimerService;
import io.coachflow.core.JobHandlerRegistry;
import io.coachflow.core.ScheduleSpec;
import io.coachflow.core.TimerAction;
import io.coachflow.core.TimerHandle;
import io.coachflow.utils.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimerService} holding timers in process memory. Everything armed here is lost on restart;
 * the recovery coordinator re-arms what the participant state still records.
 *
 * <p>Dedupe keys are honored: arming with a key cancels the earlier timer that holds it.
 */
public class InMemoryTimerService implements TimerService {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTimerService.class);

    private static final String PREFIX = "mem:";

    private final JobHandlerRegistry registry;
    private final HandlerInvoker invoker;
    private final Clock clock;
    private final ScheduledExecutorService executor;

    private final ConcurrentMap<String, ScheduledFuture<?>> active = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> handleByDedupeKey = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    public InMemoryTimerService(JobHandlerRegistry registry, HandlerInvoker invoker, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("coachflow.timer");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public TimerHandle after(Duration delay, TimerAction action) {
        Objects.requireNonNull(delay, "delay must not be null");
        Objects.requireNonNull(action, "action must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }

        String handle = newHandle(action);
        schedule(handle, delay, () -> {
            try {
                fire(action);
            } finally {
                release(handle, action);
            }
        });
        log.debug("in-memory timer armed kind={} delay={} handle={}", action.kind(), delay, handle);
        return new TimerHandle(handle);
    }

    @Override
    public TimerHandle at(Instant time, TimerAction action) {
        Objects.requireNonNull(time, "time must not be null");
        Duration delay = Duration.between(clock.instant(), time);
        return after(delay.isNegative() ? Duration.ZERO : delay, action);
    }

    @Override
    public TimerHandle recurring(ScheduleSpec spec, TimerAction action) {
        return recurring(spec, action, null);
    }

    @Override
    public TimerHandle recurring(ScheduleSpec spec, TimerAction action, Instant notBefore) {
        Objects.requireNonNull(action, "action must not be null");
        ScheduleEvaluator.validate(spec);

        String handle = newHandle(action);
        Instant now = clock.instant();
        Instant from = (notBefore != null && notBefore.isAfter(now)) ? notBefore : now;
        armOccurrence(handle, spec, action, ScheduleEvaluator.nextOccurrence(spec, from));
        log.debug("in-memory recurring timer armed kind={} handle={}", action.kind(), handle);
        return new TimerHandle(handle);
    }

    @Override
    public void cancel(TimerHandle handle) {
        if (handle == null) {
            return;
        }
        synchronized (lock) {
            ScheduledFuture<?> future = active.remove(handle.value());
            if (future != null) {
                future.cancel(false);
                log.debug("in-memory timer cancelled handle={}", handle);
            }
            handleByDedupeKey.values().remove(handle.value());
        }
    }

    public int activeCount() {
        return active.size();
    }

    /**
     * Drop every armed timer. Called on container shutdown.
     */
    public void shutdown() {
        executor.shutdownNow();
        active.clear();
        handleByDedupeKey.clear();
    }

    private void armOccurrence(String handle, ScheduleSpec spec, TimerAction action, Instant runAt) {
        Duration delay = Duration.between(clock.instant(), runAt);
        schedule(handle, delay.isNegative() ? Duration.ZERO : delay, () -> {
            fire(action);
            synchronized (lock) {
                // Re-arm only if nobody cancelled the series while it ran.
                if (!active.containsKey(handle)) {
                    return;
                }
                try {
                    Instant next = ScheduleEvaluator.nextOccurrence(spec, laterOf(runAt, clock.instant()));
                    armOccurrence(handle, spec, action, next);
                } catch (RuntimeException e) {
                    log.error("in-memory recurring timer could not be re-armed handle={} msg={}", handle, e.getMessage(), e);
                    release(handle, action);
                }
            }
        });
    }

    private void schedule(String handle, Duration delay, Runnable task) {
        synchronized (lock) {
            ScheduledFuture<?> future = executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
            active.put(handle, future);
        }
    }

    private String newHandle(TimerAction action) {
        String handle = PREFIX + UUID.randomUUID();
        if (action.dedupeKey() == null) {
            return handle;
        }
        synchronized (lock) {
            String previous = handleByDedupeKey.put(action.dedupeKey(), handle);
            if (previous != null) {
                ScheduledFuture<?> superseded = active.remove(previous);
                if (superseded != null) {
                    superseded.cancel(false);
                    log.debug("in-memory timer superseded dedupeKey={} handle={}", action.dedupeKey(), previous);
                }
            }
        }
        return handle;
    }

    private void release(String handle, TimerAction action) {
        synchronized (lock) {
            active.remove(handle);
            if (action.dedupeKey() != null) {
                handleByDedupeKey.remove(action.dedupeKey(), handle);
            }
        }
    }

    private void fire(TimerAction action) {
        Optional<JobHandler<?>> handler = registry.find(action.kind());
        if (handler.isEmpty()) {
            log.error("in-memory timer has no registered handler kind={}", action.kind());
            return;
        }
        try {
            invoker.invoke(handler.get(), action.payload());
        } catch (Exception e) {
            log.error("in-memory timer handler failed kind={} msg={}", action.kind(), e.getMessage(), e);
        }
    }

    private static Instant laterOf(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
