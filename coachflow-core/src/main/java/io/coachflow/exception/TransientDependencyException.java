package io.coachflow.exception;

/**
 * A store or message-delivery dependency failed; retrying later may succeed.
 */
public class TransientDependencyException extends CoachFlowException {

    public TransientDependencyException(String message) {
        super(message);
    }

    public TransientDependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
