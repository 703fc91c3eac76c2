package io.coachflow.internal;

import io.coachflow.core.Job;
import io.coachflow.core.JobStatus;
import io.coachflow.core.ScheduleSpec;
import io.coachflow.core.TimerAction;
import io.coachflow.core.TimerHandle;
import io.coachflow.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DurableTimerServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T08:30:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final DurableTimerService timers = new DurableTimerService(store, clock);

    @Test
    void afterShouldEnqueueOneOffJob() {
        TimerHandle handle = timers.after(Duration.ofMinutes(20), TimerAction.of("ping", Map.of("participantId", "p1")));

        assertTrue(handle.value().startsWith("job:"));
        Job job = store.findAll().get(0);
        assertEquals(T0.plus(Duration.ofMinutes(20)), job.runAt());
        assertEquals(JobStatus.PENDING, job.status());

        timers.cancel(handle);
        assertEquals(JobStatus.CANCELLED, store.findById(job.id()).orElseThrow().status());
    }

    @Test
    void reArmingWithSameDedupeKeyShouldLeaveOnePendingJob() {
        TimerAction action = new TimerAction("ping", Map.of("participantId", "p1"), "reminder:p1");
        timers.at(T0.plusSeconds(60), action);
        timers.at(T0.plusSeconds(120), action);

        long pending = store.findAll().stream().filter(j -> j.status() == JobStatus.PENDING).count();
        assertEquals(1, pending);
        assertEquals(T0.plusSeconds(120), store.findPendingByDedupeKey("reminder:p1").orElseThrow().runAt());
    }

    @Test
    void recurringShouldStartAfterNotBeforeAndCancelBySeries() {
        Instant notBefore = Instant.parse("2026-01-01T08:50:00Z");
        TimerHandle handle = timers.recurring(
                ScheduleSpec.daily(8, 50, "UTC"),
                new TimerAction("ping", Map.of(), "schedule:p1:s1"),
                notBefore
        );

        assertEquals("series:schedule:p1:s1", handle.value());
        Job first = store.findPendingByDedupeKey("schedule:p1:s1").orElseThrow();
        assertEquals(Instant.parse("2026-01-02T08:50:00Z"), first.runAt());

        timers.cancel(handle);
        assertTrue(store.findPendingByDedupeKey("schedule:p1:s1").isEmpty());
    }

    @Test
    void cancelShouldTolerateUnknownHandles() {
        assertDoesNotThrow(() -> timers.cancel(null));
        assertDoesNotThrow(() -> timers.cancel(new TimerHandle("job:missing")));
        assertDoesNotThrow(() -> timers.cancel(new TimerHandle("mem:elsewhere")));
    }
}
