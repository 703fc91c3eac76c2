package io.coachflow.exception;

/**
 * Base type for every failure raised by the scheduling core.
 */
public class CoachFlowException extends RuntimeException {

    public CoachFlowException(String message) {
        super(message);
    }

    public CoachFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
