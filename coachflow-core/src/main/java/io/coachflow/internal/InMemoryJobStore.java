package io.coachflow.internal;

import io.coachflow.core.Job;
import io.coachflow.core.JobRequest;
import io.coachflow.core.JobStatus;
import io.coachflow.store.JobStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link JobStore} kept in process memory. Every operation holds the store monitor, which gives the
 * same atomicity the Mongo store gets from single-document updates.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new LinkedHashMap<>();

    @Override
    public synchronized Job enqueue(JobRequest request, Instant now) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (request.dedupeKey() != null) {
            for (Job existing : List.copyOf(jobs.values())) {
                if (request.dedupeKey().equals(existing.dedupeKey()) && isSupersedable(existing, now)) {
                    jobs.put(existing.id(), finish(existing, JobStatus.CANCELLED, now, "superseded"));
                }
            }
        }

        Job job = new Job(
                UUID.randomUUID().toString(),
                request.kind(),
                request.dedupeKey(),
                request.runAt(),
                request.schedule(),
                JobStatus.PENDING,
                null,
                null,
                0,
                now,
                null,
                null,
                request.payload()
        );
        jobs.put(job.id(), job);
        return job;
    }

    @Override
    public synchronized List<Job> claimDue(Instant now, int limit, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (limit <= 0) {
            return List.of();
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        List<Job> due = jobs.values().stream()
                .filter(j -> !j.runAt().isAfter(now))
                .filter(j -> j.status() == JobStatus.PENDING || isStaleClaim(j, now))
                .sorted(Comparator.comparing(Job::runAt))
                .limit(limit)
                .toList();

        List<Job> claimed = new ArrayList<>(due.size());
        for (Job j : due) {
            Job locked = new Job(j.id(), j.kind(), j.dedupeKey(), j.runAt(), j.schedule(), JobStatus.RUNNING,
                    workerId, now.plus(lockLifetime), j.attempts() + 1, j.createdAt(), null, j.lastError(), j.payload());
            jobs.put(j.id(), locked);
            claimed.add(locked);
        }
        return claimed;
    }

    @Override
    public synchronized boolean markDone(String jobId, String workerId, Instant finishedAt) {
        return release(jobId, workerId, JobStatus.DONE, finishedAt, null);
    }

    @Override
    public synchronized boolean markFailed(String jobId, String workerId, Instant failedAt, String error) {
        return release(jobId, workerId, JobStatus.FAILED, failedAt, error);
    }

    @Override
    public synchronized boolean cancel(String jobId, Instant now) {
        Job job = jobs.get(jobId);
        if (job == null || job.status().isFinal()) {
            return false;
        }
        jobs.put(jobId, finish(job, JobStatus.CANCELLED, now, null));
        return true;
    }

    @Override
    public synchronized long cancelByDedupeKey(String dedupeKey, Instant now) {
        if (dedupeKey == null || dedupeKey.isBlank()) {
            return 0;
        }
        long cancelled = 0;
        for (Job job : List.copyOf(jobs.values())) {
            if (dedupeKey.equals(job.dedupeKey()) && !job.status().isFinal()) {
                jobs.put(job.id(), finish(job, JobStatus.CANCELLED, now, null));
                cancelled++;
            }
        }
        return cancelled;
    }

    @Override
    public synchronized Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized Optional<Job> findPendingByDedupeKey(String dedupeKey) {
        return jobs.values().stream()
                .filter(j -> j.status() == JobStatus.PENDING && Objects.equals(dedupeKey, j.dedupeKey()))
                .findFirst();
    }

    public synchronized List<Job> findAll() {
        return List.copyOf(jobs.values());
    }

    private boolean release(String jobId, String workerId, JobStatus status, Instant at, String error) {
        Job job = jobs.get(jobId);
        // Prevent stale write-back if the job was cancelled or re-claimed meanwhile.
        if (job == null || job.status() != JobStatus.RUNNING || !Objects.equals(workerId, job.lockedBy())) {
            return false;
        }
        jobs.put(jobId, finish(job, status, at, error));
        return true;
    }

    private static boolean isSupersedable(Job job, Instant now) {
        return job.status() == JobStatus.PENDING || isStaleClaim(job, now);
    }

    private static boolean isStaleClaim(Job job, Instant now) {
        return job.status() == JobStatus.RUNNING && job.lockUntil() != null && !job.lockUntil().isAfter(now);
    }

    private static Job finish(Job j, JobStatus status, Instant at, String error) {
        return new Job(j.id(), j.kind(), j.dedupeKey(), j.runAt(), j.schedule(), status,
                null, null, j.attempts(), j.createdAt(), at, error != null ? error : j.lastError(), j.payload());
    }
}
