package io.coachflow.internal;

import io.coachflow.JobHandler;
import io.coachflow.core.Job;
import io.coachflow.core.JobHandlerRegistry;
import io.coachflow.core.JobRequest;
import io.coachflow.store.JobStore;
import io.coachflow.utils.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the {@link JobStore}, claims due jobs and runs the handler registered for each job kind.
 *
 * <p>Outcome handling:
 * <ul>
 *   <li>handler returns: job marked {@code DONE}</li>
 *   <li>handler throws, or no handler is registered: job marked {@code FAILED} and logged; never retried</li>
 *   <li>recurring job: next occurrence enqueued under the same dedupe key, unless the job was cancelled
 *       while it ran</li>
 * </ul>
 *
 * <p>{@link #pollOnce()} can be driven directly (handlers then run on the calling thread), which is how
 * tests step the dispatcher with a controlled clock. {@link #start()} runs the same pass on a poller
 * thread and hands jobs to a worker pool.
 */
public class JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStore jobStore;
    private final JobHandlerRegistry registry;
    private final HandlerInvoker invoker;
    private final DispatcherOptions options;
    private final Clock clock;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore globalSem;
    private final Semaphore refillSignal = new Semaphore(0);

    private volatile ExecutorService workerPool;
    private Thread pollerThread;
    private int systemErrorCount = 0;

    public JobDispatcher(JobStore jobStore, JobHandlerRegistry registry, HandlerInvoker invoker,
                         DispatcherOptions options, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.globalSem = new Semaphore(options.maxConcurrency());
        this.workerId = resolveWorkerId(options.workerId());
    }

    /**
     * Start polling. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Dispatcher starting with processEvery={}, lockLifetime={}, workerId={}, maxConcurrency={}, batchSize={}",
                options.processEvery(),
                options.lockLifetime(),
                workerId,
                options.maxConcurrency(),
                options.batchSize());

        workerPool = Executors.newFixedThreadPool(options.maxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("coachflow.worker");
            t.setDaemon(true);
            return t;
        });

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("coachflow.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();
        log.info("Dispatcher started.");
    }

    /**
     * Stop polling and wait up to one lock lifetime for running handlers. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Dispatcher stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        ExecutorService pool = workerPool;
        workerPool = null;
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(options.lockLifetime().toSeconds(), TimeUnit.SECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            }
        }

        refillSignal.drainPermits();
        log.info("Dispatcher stopped.");
    }

    public boolean isRunning() {
        return started.get();
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Claim the jobs due now and run them.
     *
     * @return number of jobs claimed in this pass
     */
    public int pollOnce() {
        ExecutorService pool = workerPool;
        int capacity = pool == null
                ? options.batchSize()
                : Math.min(options.batchSize(), globalSem.availablePermits());
        if (capacity <= 0) {
            return 0;
        }

        Instant now = clock.instant();
        List<Job> jobs = jobStore.claimDue(now, capacity, options.lockLifetime(), workerId);
        log.debug("Dispatcher polled jobs count={} now={}", jobs.size(), now);

        for (Job job : jobs) {
            if (pool == null) {
                runJob(job);
            } else {
                submitToWorker(pool, job);
            }
        }
        return jobs.size();
    }

    private void submitToWorker(ExecutorService pool, Job job) {
        globalSem.acquireUninterruptibly();
        try {
            pool.submit(() -> {
                try {
                    runJob(job);
                } finally {
                    globalSem.release();
                    refillSignal.release();
                }
            });
        } catch (RejectedExecutionException e) {
            // Pool is shutting down; the claim expires and another pass picks the job up.
            globalSem.release();
            log.warn("Dispatcher rejected job id={} kind={} during shutdown", job.id(), job.kind());
        }
    }

    void runJob(Job job) {
        Optional<JobHandler<?>> handler = registry.find(job.kind());
        boolean released;
        if (handler.isEmpty()) {
            log.error("job has no registered handler kind={} id={}", job.kind(), job.id());
            released = markFailed(job, "no handler registered for kind " + job.kind());
        } else {
            released = execute(job, handler.get());
        }

        if (!released) {
            log.info("job finished after losing its claim kind={} id={}; not re-arming", job.kind(), job.id());
            return;
        }
        rearmIfRecurring(job);
    }

    private boolean execute(Job job, JobHandler<?> handler) {
        log.debug("job started kind={} id={} runAt={}", job.kind(), job.id(), job.runAt());
        try {
            invoker.invoke(handler, job.payload());
        } catch (Exception e) {
            log.error("job failed kind={} id={} msg={}", job.kind(), job.id(), e.getMessage(), e);
            return markFailed(job, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        try {
            boolean marked = jobStore.markDone(job.id(), workerId, clock.instant());
            log.debug("job succeeded kind={} id={}", job.kind(), job.id());
            return marked;
        } catch (RuntimeException storeEx) {
            log.error("job markDone failed kind={} id={} msg={}", job.kind(), job.id(), storeEx.getMessage(), storeEx);
            return false;
        }
    }

    private boolean markFailed(Job job, String error) {
        try {
            return jobStore.markFailed(job.id(), workerId, clock.instant(), error);
        } catch (RuntimeException storeEx) {
            log.error("job markFailed failed kind={} id={} msg={}", job.kind(), job.id(), storeEx.getMessage(), storeEx);
            return false;
        }
    }

    private void rearmIfRecurring(Job job) {
        if (!job.isRecurring()) {
            return;
        }
        try {
            Instant now = clock.instant();
            Instant next = ScheduleEvaluator.nextOccurrence(job.schedule(), laterOf(job.runAt(), now));
            Job nextJob = jobStore.enqueue(
                    new JobRequest(job.kind(), next, job.payload(), job.dedupeKey(), job.schedule()),
                    now
            );
            log.debug("recurring job re-armed kind={} dedupeKey={} nextId={} runAt={}",
                    job.kind(), job.dedupeKey(), nextJob.id(), next);
        } catch (RuntimeException e) {
            log.error("recurring job could not be re-armed kind={} id={} dedupeKey={} msg={}",
                    job.kind(), job.id(), job.dedupeKey(), e.getMessage(), e);
        }
    }

    private void pollerLoop() {
        while (started.get()) {
            int claimed;
            try {
                claimed = pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("dispatcher pollOnce failed msg={}", e.getMessage(), e);
                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);

                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (claimed >= options.batchSize()) {
                    // Backlog: poll again as soon as a worker frees up.
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } else {
                    Thread.sleep(options.processEvery().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    private static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "coachflow";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("could not resolve local host name msg={}", e.getMessage());
        }

        String pid = String.valueOf(ProcessHandle.current().pid());
        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
