package io.coachflow.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.coachflow.JobHandler;
import io.coachflow.core.JobHandlerRegistry;
import io.coachflow.core.ScheduleSpec;
import io.coachflow.core.TimerAction;
import io.coachflow.core.TimerHandle;
import io.coachflow.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryTimerServiceTest {

    record Tick(String tag) {
    }

    private final List<String> fired = new CopyOnWriteArrayList<>();
    private final CountDownLatch firstFire = new CountDownLatch(1);

    private final JobHandler<Tick> handler = new JobHandler<>() {
        @Override
        public String kind() {
            return "tick";
        }

        @Override
        public Class<Tick> payloadClass() {
            return Tick.class;
        }

        @Override
        public void execute(Tick payload) {
            fired.add(payload.tag());
            firstFire.countDown();
        }
    };

    private final InMemoryTimerService timers = new InMemoryTimerService(
            new JobHandlerRegistry(List.of(handler)), new HandlerInvoker(new ObjectMapper()), Clock.systemUTC());

    // 50ms before the next minute boundary
    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T09:00:59.950Z"));
    // matches every minute of October
    private final ScheduleSpec everyMinute = new ScheduleSpec(null, null, null, 10, null, "UTC");

    private final AtomicInteger minuteFirings = new AtomicInteger();
    private final CountDownLatch twoMinutes = new CountDownLatch(2);
    private final AtomicReference<TimerHandle> cancelFromHandler = new AtomicReference<>();
    private InMemoryTimerService minuteTimers;

    private final JobHandler<Tick> minuteHandler = new JobHandler<>() {
        @Override
        public String kind() {
            return "minute";
        }

        @Override
        public Class<Tick> payloadClass() {
            return Tick.class;
        }

        @Override
        public void execute(Tick payload) {
            minuteFirings.incrementAndGet();
            TimerHandle self = cancelFromHandler.get();
            if (self != null) {
                minuteTimers.cancel(self);
            }
            // keep the next occurrence 50ms away in real time
            clock.advance(Duration.ofMinutes(1));
            twoMinutes.countDown();
        }
    };

    @AfterEach
    void tearDown() {
        timers.shutdown();
        if (minuteTimers != null) {
            minuteTimers.shutdown();
        }
    }

    private InMemoryTimerService minuteTimers() {
        minuteTimers = new InMemoryTimerService(
                new JobHandlerRegistry(List.of(minuteHandler)), new HandlerInvoker(new ObjectMapper()), clock);
        return minuteTimers;
    }

    @Test
    void recurringTimerShouldReArmAfterEachFiring() throws Exception {
        InMemoryTimerService service = minuteTimers();

        TimerHandle handle = service.recurring(everyMinute, TimerAction.of("minute", Map.of("tag", "m")));

        assertTrue(twoMinutes.await(2, TimeUnit.SECONDS));
        assertTrue(minuteFirings.get() >= 2);
        assertEquals(1, service.activeCount());

        service.cancel(handle);
        assertEquals(0, service.activeCount());
    }

    @Test
    void recurringTimerCancelledWhileFiringShouldNotReArm() throws Exception {
        InMemoryTimerService service = minuteTimers();

        TimerHandle handle = service.recurring(everyMinute, TimerAction.of("minute", Map.of("tag", "m")));
        cancelFromHandler.set(handle);

        assertFalse(twoMinutes.await(500, TimeUnit.MILLISECONDS));
        assertEquals(1, minuteFirings.get());
        assertEquals(0, service.activeCount());
    }

    @Test
    void timerShouldFireOnceAndBeReleased() throws Exception {
        TimerHandle handle = timers.after(Duration.ofMillis(20), TimerAction.of("tick", Map.of("tag", "a")));

        assertTrue(handle.value().startsWith("mem:"));
        assertTrue(firstFire.await(2, TimeUnit.SECONDS));
        Thread.sleep(50);
        assertEquals(List.of("a"), fired);
        assertEquals(0, timers.activeCount());
    }

    @Test
    void cancelledTimerShouldNotFire() throws Exception {
        TimerHandle handle = timers.after(Duration.ofMillis(100), TimerAction.of("tick", Map.of("tag", "a")));
        timers.cancel(handle);

        Thread.sleep(250);
        assertTrue(fired.isEmpty());
        assertEquals(0, timers.activeCount());
    }

    @Test
    void sameDedupeKeyShouldReplaceEarlierTimer() throws Exception {
        timers.after(Duration.ofMillis(100), new TimerAction("tick", Map.of("tag", "first"), "k"));
        timers.after(Duration.ofMillis(150), new TimerAction("tick", Map.of("tag", "second"), "k"));

        assertTrue(firstFire.await(2, TimeUnit.SECONDS));
        Thread.sleep(200);
        assertEquals(List.of("second"), fired);
    }
}
