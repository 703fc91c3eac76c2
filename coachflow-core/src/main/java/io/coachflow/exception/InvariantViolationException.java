package io.coachflow.exception;

/**
 * Internal bookkeeping reached a state it must never be in (e.g. two pending jobs
 * sharing one dedupe key).
 */
public class InvariantViolationException extends CoachFlowException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
