package io.coachflow.schedule;

public enum ScheduleType {
    /** Prompt at a fixed time of day. */
    FIXED,
    /** Prompt at a random minute inside a daily window. */
    RANDOM_WINDOW
}
