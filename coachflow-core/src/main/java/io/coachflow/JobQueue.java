package io.coachflow;

import io.coachflow.core.JobRequest;

import java.time.Instant;

/**
 * Persisted work items keyed by kind, run-at time and optional dedupe key.
 */
public interface JobQueue {

    /**
     * Persist a job. If {@code request.dedupeKey()} matches a pending job, that job is cancelled and
     * replaced by this one in a single store operation.
     *
     * @return id of the new job
     */
    String enqueue(JobRequest request);

    /**
     * Convenience overload for a one-off job. {@code payload} is converted to a map with Jackson.
     */
    String enqueue(String kind, Instant runAt, Object payload, String dedupeKey);

    /**
     * Cancel a job that has not finished yet.
     *
     * @return true if the job was pending or running and is now cancelled, false if it had already
     * finished
     * @throws io.coachflow.exception.NotFoundException if no job has this id
     */
    boolean cancel(String jobId);

    void registerHandler(JobHandler<?> handler);
}
