package io.coachflow.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.coachflow.JobHandler;
import io.coachflow.JobQueue;
import io.coachflow.core.Job;
import io.coachflow.core.JobHandlerRegistry;
import io.coachflow.core.JobRequest;
import io.coachflow.exception.NotFoundException;
import io.coachflow.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public class DefaultJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobQueue.class);

    private final JobStore jobStore;
    private final JobHandlerRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DefaultJobQueue(JobStore jobStore, JobHandlerRegistry registry, ObjectMapper objectMapper, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String enqueue(JobRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Job job = jobStore.enqueue(request, clock.instant());
        log.debug("job enqueued id={} kind={} runAt={} dedupeKey={}", job.id(), job.kind(), job.runAt(), job.dedupeKey());
        return job.id();
    }

    @Override
    public String enqueue(String kind, Instant runAt, Object payload, String dedupeKey) {
        Map<String, Object> payloadMap = payload == null ? null :
                objectMapper.convertValue(payload, new TypeReference<>() {
                });
        return enqueue(JobRequest.oneOff(kind, runAt, payloadMap, dedupeKey));
    }

    @Override
    public boolean cancel(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        if (jobStore.findById(jobId).isEmpty()) {
            throw new NotFoundException("job", jobId);
        }
        boolean cancelled = jobStore.cancel(jobId, clock.instant());
        log.debug("job cancel id={} cancelled={}", jobId, cancelled);
        return cancelled;
    }

    @Override
    public void registerHandler(JobHandler<?> handler) {
        registry.register(handler);
    }
}
