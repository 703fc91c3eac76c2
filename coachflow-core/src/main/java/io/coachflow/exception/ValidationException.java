package io.coachflow.exception;

/**
 * Malformed schedule, time or identifier input supplied by a caller.
 *
 * <p>{@link #hint()} carries an optional corrective suggestion that can be shown to the
 * participant as-is, e.g. when a time of day was supplied where a schedule id was expected.
 */
public class ValidationException extends CoachFlowException {

    private final String hint;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, String hint) {
        super(message);
        this.hint = hint;
    }

    public String hint() {
        return hint;
    }

    public boolean hasHint() {
        return hint != null && !hint.isBlank();
    }
}
