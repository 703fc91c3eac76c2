package io.coachflow;

/**
 * Handles every job (or timer firing) of one kind.
 *
 * <p>The stored payload map is converted into {@link #payloadClass()} before {@link #execute(Object)}
 * is called. Handlers must re-read whatever state they act on and no-op when it no longer matches
 * what the payload expects: the same job may be delivered more than once.
 */
public interface JobHandler<T> {
    String kind();

    Class<T> payloadClass();

    void execute(T payload) throws Exception;
}
