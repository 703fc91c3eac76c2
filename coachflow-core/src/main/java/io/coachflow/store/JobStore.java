package io.coachflow.store;

import io.coachflow.core.Job;
import io.coachflow.core.JobRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for the job table.
 *
 * <p>Implementations must guarantee:
 * <ul>
 *   <li>at most one {@code PENDING} job per non-null dedupe key; {@link #enqueue} cancels the previous
 *       holder of the key (and any running holder whose lock expired) as part of the same operation</li>
 *   <li>{@link #claimDue} hands each job to at most one worker until its lock expires</li>
 *   <li>{@link #markDone}/{@link #markFailed} only apply while the caller still holds the claim</li>
 * </ul>
 */
public interface JobStore {

    Job enqueue(JobRequest request, Instant now);

    /**
     * Atomically claim up to {@code limit} jobs that are due at {@code now}: pending jobs with
     * {@code runAt <= now} and running jobs whose lock expired.
     */
    List<Job> claimDue(Instant now, int limit, Duration lockLifetime, String workerId);

    /**
     * @return false if the claim was lost (job cancelled or re-claimed by another worker)
     */
    boolean markDone(String jobId, String workerId, Instant finishedAt);

    boolean markFailed(String jobId, String workerId, Instant failedAt, String error);

    /**
     * Cancel a pending or running job.
     *
     * @return false if the job does not exist or has already finished
     */
    boolean cancel(String jobId, Instant now);

    /**
     * Cancel every pending or running job carrying this dedupe key.
     *
     * @return number of jobs cancelled
     */
    long cancelByDedupeKey(String dedupeKey, Instant now);

    Optional<Job> findById(String jobId);

    Optional<Job> findPendingByDedupeKey(String dedupeKey);
}
