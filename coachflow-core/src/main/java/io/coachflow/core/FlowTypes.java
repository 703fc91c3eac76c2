package io.coachflow.core;

/**
 * Flow type tags used as the second half of a participant state key.
 */
public final class FlowTypes {

    /** Enrollment record: canonical address and reply routing. */
    public static final String PARTICIPANT = "participant";

    /** Daily prompt schedules, pending prompt markers and reminders. */
    public static final String CONVERSATION = "conversation";

    public static final String MICRO_HEALTH_INTERVENTION = "micro_health_intervention";

    private FlowTypes() {
    }
}
