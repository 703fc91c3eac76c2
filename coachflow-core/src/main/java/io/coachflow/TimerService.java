package io.coachflow;

import io.coachflow.core.ScheduleSpec;
import io.coachflow.core.TimerAction;
import io.coachflow.core.TimerHandle;

import java.time.Duration;
import java.time.Instant;

/**
 * Uniform scheduling API shared by the in-memory and the durable backing.
 *
 * <p>Actions are plain data (kind + payload); the backing looks up the {@link JobHandler}
 * registered for the kind at fire time. Callers that must cancel later store the returned handle
 * in the participant's state.
 */
public interface TimerService {

    TimerHandle after(Duration delay, TimerAction action);

    TimerHandle at(Instant time, TimerAction action);

    TimerHandle recurring(ScheduleSpec spec, TimerAction action);

    /**
     * Arm a recurring action whose first occurrence is strictly after {@code notBefore}
     * (or after now, whichever is later).
     */
    TimerHandle recurring(ScheduleSpec spec, TimerAction action, Instant notBefore);

    /**
     * Idempotent. Never fails for handles that already fired, were cancelled or are unknown.
     */
    void cancel(TimerHandle handle);
}
