package io.coachflow.flow;

import java.util.List;
import java.util.Optional;

/**
 * States of the daily micro-intervention. Every state that waits for a reply has exactly one timeout
 * with a default target, so a silent participant always reaches {@link #END_OF_DAY}.
 */
public enum InterventionState {
    ORIENTATION,
    COMMITMENT_PROMPT,
    FEELING_PROMPT,
    RANDOM_ASSIGNMENT,
    SEND_INTERVENTION_IMMEDIATE,
    SEND_INTERVENTION_REFLECTIVE,
    REINFORCEMENT_FOLLOWUP,
    DID_YOU_GET_A_CHANCE,
    CONTEXT_QUESTION,
    MOOD_QUESTION,
    BARRIER_CHECK_AFTER_CONTEXT_MOOD,
    BARRIER_REASON_NO_CHANCE,
    IGNORED_PATH,
    END_OF_DAY;

    public boolean awaitsReply() {
        return timeoutTarget() != null;
    }

    /**
     * Where the paired timeout leads; null for states that do not wait.
     */
    public InterventionState timeoutTarget() {
        return switch (this) {
            case COMMITMENT_PROMPT -> END_OF_DAY;
            case FEELING_PROMPT -> RANDOM_ASSIGNMENT;
            case SEND_INTERVENTION_IMMEDIATE, SEND_INTERVENTION_REFLECTIVE -> DID_YOU_GET_A_CHANCE;
            case DID_YOU_GET_A_CHANCE -> IGNORED_PATH;
            case CONTEXT_QUESTION, MOOD_QUESTION, BARRIER_CHECK_AFTER_CONTEXT_MOOD, BARRIER_REASON_NO_CHANCE -> END_OF_DAY;
            default -> null;
        };
    }

    public boolean sendsPrompt() {
        return this != RANDOM_ASSIGNMENT;
    }

    /**
     * Answer options offered on channels with interactive messages.
     */
    public List<String> replyOptions() {
        return switch (this) {
            case COMMITMENT_PROMPT -> List.of("Let's do it", "Not yet");
            case FEELING_PROMPT -> List.of("1", "2", "3", "4", "5");
            case SEND_INTERVENTION_IMMEDIATE, SEND_INTERVENTION_REFLECTIVE -> List.of("Done", "No");
            case DID_YOU_GET_A_CHANCE -> List.of("Yes", "No");
            case CONTEXT_QUESTION -> List.of("1", "2", "3", "4");
            case MOOD_QUESTION -> List.of("1", "2", "3");
            default -> List.of();
        };
    }

    public static Optional<InterventionState> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
