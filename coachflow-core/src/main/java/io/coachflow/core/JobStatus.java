package io.coachflow.core;

/**
 * Job lifecycle.
 *
 * <p>{@code RUNNING} is the claimed phase: a dispatcher holds the lock until {@code lockUntil}.
 * A running job whose lock expired (the worker died mid-handler) can be claimed again.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isFinal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
