package io.coachflow.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.coachflow.JobHandler;
import io.coachflow.core.Job;
import io.coachflow.core.JobHandlerRegistry;
import io.coachflow.core.JobStatus;
import io.coachflow.exception.NotFoundException;
import io.coachflow.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultJobQueueTest {

    private static final Instant T0 = Instant.parse("2026-01-01T09:00:00Z");

    record Nudge(String participantId, int step) {
    }

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final JobHandlerRegistry registry = new JobHandlerRegistry();
    private final DefaultJobQueue queue = new DefaultJobQueue(store, registry, new ObjectMapper(), clock);

    @Test
    void enqueueShouldConvertPayloadToMap() {
        String id = queue.enqueue("nudge", T0.plusSeconds(60), new Nudge("p1", 2), "nudge:p1");

        Job job = store.findById(id).orElseThrow();
        assertEquals("p1", job.payload().get("participantId"));
        assertEquals(2, job.payload().get("step"));
        assertEquals(T0, job.createdAt());
        assertEquals(JobStatus.PENDING, job.status());
    }

    @Test
    void enqueueWithSameDedupeKeyShouldLeaveOnlyTheLatestPending() {
        String first = queue.enqueue("nudge", T0.plusSeconds(60), new Nudge("p1", 1), "nudge:p1");
        String second = queue.enqueue("nudge", T0.plusSeconds(90), new Nudge("p1", 2), "nudge:p1");

        assertEquals(JobStatus.CANCELLED, store.findById(first).orElseThrow().status());
        assertEquals(second, store.findPendingByDedupeKey("nudge:p1").orElseThrow().id());
    }

    @Test
    void cancelShouldReportWhetherTheJobWasStillOpen() {
        String id = queue.enqueue("nudge", T0.plusSeconds(60), null, null);

        assertTrue(queue.cancel(id));
        assertFalse(queue.cancel(id));
        assertThrows(NotFoundException.class, () -> queue.cancel("missing"));
    }

    @Test
    void registerHandlerShouldAddToRegistry() {
        queue.registerHandler(new JobHandler<Nudge>() {
            @Override
            public String kind() {
                return "nudge";
            }

            @Override
            public Class<Nudge> payloadClass() {
                return Nudge.class;
            }

            @Override
            public void execute(Nudge payload) {
            }
        });

        assertTrue(registry.find("nudge").isPresent());
    }
}
