package io.coachflow.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.coachflow.JobHandler;

import java.util.Map;
import java.util.Objects;

/**
 * Converts a stored payload map to the handler's payload type and runs it.
 */
public final class HandlerInvoker {

    private final ObjectMapper objectMapper;

    public HandlerInvoker(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @SuppressWarnings("unchecked")
    public <T> void invoke(JobHandler<?> handler, Map<String, Object> payload) throws Exception {
        var h = (JobHandler<T>) handler;
        T data = (payload == null) ? null : objectMapper.convertValue(payload, h.payloadClass());
        h.execute(data);
    }
}
