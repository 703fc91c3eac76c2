package io.coachflow.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.coachflow.JobHandler;
import io.coachflow.core.Job;
import io.coachflow.core.JobHandlerRegistry;
import io.coachflow.core.JobRequest;
import io.coachflow.core.JobStatus;
import io.coachflow.core.ScheduleSpec;
import io.coachflow.internal.DispatcherOptions;
import io.coachflow.internal.HandlerInvoker;
import io.coachflow.internal.JobDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2026-01-01T09:00:00Z");
    private static final Duration LOCK = Duration.ofMinutes(5);

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "coachflow_test");
        mongoTemplate.dropCollection(JobDocument.class);
        jobStore = new MongoJobStore(mongoTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
    }

    @Test
    void claimDueShouldLockAndPreventDoubleClaim() {
        jobStore.enqueue(JobRequest.oneOff("email", T0.minusSeconds(5), Map.of("k", "v"), null), T0);

        List<Job> claimed = jobStore.claimDue(T0, 1, LOCK, "worker-A");

        assertEquals(1, claimed.size());
        Job locked = claimed.get(0);
        assertEquals(JobStatus.RUNNING, locked.status());
        assertEquals("worker-A", locked.lockedBy());
        assertEquals(T0.plus(LOCK), locked.lockUntil());
        assertEquals(1, locked.attempts());
        assertEquals("v", locked.payload().get("k"));

        assertTrue(jobStore.claimDue(T0, 1, LOCK, "worker-B").isEmpty());
    }

    @Test
    void expiredClaimShouldBeReclaimableAndGuardWriteBack() {
        Job job = jobStore.enqueue(JobRequest.oneOff("email", T0, null, null), T0);
        jobStore.claimDue(T0, 1, LOCK, "worker-A");

        List<Job> reclaimed = jobStore.claimDue(T0.plus(LOCK), 1, LOCK, "worker-B");
        assertEquals(1, reclaimed.size());
        assertEquals(2, reclaimed.get(0).attempts());

        assertFalse(jobStore.markDone(job.id(), "worker-A", T0.plus(LOCK)));
        assertTrue(jobStore.markFailed(job.id(), "worker-B", T0.plus(LOCK), "boom"));

        Job failed = jobStore.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals("boom", failed.lastError());
        assertEquals(T0.plus(LOCK), failed.finishedAt());
    }

    @Test
    void enqueueShouldSupersedePendingJobWithSameDedupeKey() {
        Job first = jobStore.enqueue(JobRequest.oneOff("reminder", T0.plusSeconds(60), null, "reminder:p1"), T0);
        Job second = jobStore.enqueue(JobRequest.oneOff("reminder", T0.plusSeconds(120), null, "reminder:p1"), T0);

        assertEquals(JobStatus.CANCELLED, jobStore.findById(first.id()).orElseThrow().status());
        assertEquals(second.id(), jobStore.findPendingByDedupeKey("reminder:p1").orElseThrow().id());
        long pending = mongoTemplate.count(
                new Query(Criteria.where("dedupeKey").is("reminder:p1").and("status").is(JobStatus.PENDING)),
                JobDocument.class);
        assertEquals(1, pending);
    }

    @Test
    void cancelledRunningJobShouldRejectMarkDone() {
        Job job = jobStore.enqueue(JobRequest.oneOff("email", T0, null, "k"), T0);
        jobStore.claimDue(T0, 1, LOCK, "worker-A");

        assertEquals(1, jobStore.cancelByDedupeKey("k", T0));
        assertFalse(jobStore.markDone(job.id(), "worker-A", T0));
        assertFalse(jobStore.cancel(job.id(), T0));
        assertEquals(JobStatus.CANCELLED, jobStore.findById(job.id()).orElseThrow().status());
    }

    @Test
    void scheduleShouldSurviveRoundTrip() {
        ScheduleSpec spec = new ScheduleSpec(50, 8, null, null, 1, "America/Toronto");
        Job job = jobStore.enqueue(new JobRequest("daily_prompt", T0, Map.of("participantId", "p1"), "schedule:p1:s1", spec), T0);

        Job loaded = jobStore.findById(job.id()).orElseThrow();

        assertEquals(spec, loaded.schedule());
        assertTrue(loaded.isRecurring());
    }

    @Test
    void dispatcherShouldRunDueJobAndMarkItDone() throws Exception {
        JobHandler<Map<String, Object>> handler = new JobHandler<>() {
            @Override
            public String kind() {
                return "email";
            }

            @Override
            @SuppressWarnings("unchecked")
            public Class<Map<String, Object>> payloadClass() {
                return (Class<Map<String, Object>>) (Class<?>) Map.class;
            }

            @Override
            public void execute(Map<String, Object> payload) {
                if ("fail".equals(payload.get("mode"))) {
                    throw new IllegalStateException("simulated failure");
                }
            }
        };
        JobDispatcher dispatcher = new JobDispatcher(
                jobStore,
                new JobHandlerRegistry(List.of(handler)),
                new HandlerInvoker(new ObjectMapper()),
                DispatcherOptions.builder().processEvery(Duration.ofMillis(200)).lockLifetime(Duration.ofSeconds(2)).workerId("test-worker").build(),
                Clock.systemUTC()
        );

        Instant now = Instant.now();
        Job ok = jobStore.enqueue(JobRequest.oneOff("email", now, Map.of("mode", "ok"), null), now);
        Job bad = jobStore.enqueue(JobRequest.oneOff("email", now, Map.of("mode", "fail"), null), now);
        dispatcher.start();

        boolean reached = waitUntil(8, TimeUnit.SECONDS, () ->
                jobStore.findById(ok.id()).orElseThrow().status().isFinal()
                        && jobStore.findById(bad.id()).orElseThrow().status().isFinal());

        dispatcher.stop();

        assertTrue(reached);
        assertEquals(JobStatus.DONE, jobStore.findById(ok.id()).orElseThrow().status());
        Job failed = jobStore.findById(bad.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertNotNull(failed.lastError());
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
