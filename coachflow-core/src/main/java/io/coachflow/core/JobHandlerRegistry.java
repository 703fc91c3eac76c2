package io.coachflow.core;

import io.coachflow.JobHandler;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Kind-to-handler lookup shared by the dispatcher and both timer backings.
 *
 * <p>Handlers may be added after construction so that components which both arm timers and
 * handle them can register themselves once they are wired.
 */
public class JobHandlerRegistry {

    private final ConcurrentMap<String, JobHandler<?>> handlersByKind = new ConcurrentHashMap<>();

    public JobHandlerRegistry() {
    }

    public JobHandlerRegistry(List<JobHandler<?>> handlers) {
        Objects.requireNonNull(handlers, "handlers must not be null");
        handlers.forEach(this::register);
    }

    public void register(JobHandler<?> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        String kind = Objects.requireNonNull(handler.kind(), "handler kind must not be null");
        JobHandler<?> existing = handlersByKind.putIfAbsent(kind, handler);
        if (existing != null && existing != handler) {
            throw new IllegalStateException("Duplicate JobHandler kind: " + kind);
        }
    }

    public Optional<JobHandler<?>> find(String kind) {
        return Optional.ofNullable(handlersByKind.get(kind));
    }

    public JobHandler<?> getRequired(String kind) {
        JobHandler<?> handler = handlersByKind.get(kind);
        if (handler == null) {
            throw new IllegalStateException("No JobHandler registered for kind: " + kind);
        }
        return handler;
    }

    public Set<String> kinds() {
        return Set.copyOf(handlersByKind.keySet());
    }
}
