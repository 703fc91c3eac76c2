package io.coachflow.recovery;

import io.coachflow.core.FlowTypes;
import io.coachflow.core.Job;
import io.coachflow.core.JobStatus;
import io.coachflow.participant.ParticipantFlowRecoverer;
import io.coachflow.schedule.DailyPromptHandler;
import io.coachflow.schedule.DailyPromptReminderHandler;
import io.coachflow.schedule.ScheduleTarget;
import io.coachflow.store.ParticipantFlowState;
import io.coachflow.support.MutableClock;
import io.coachflow.support.TestRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecoveryCoordinatorTest {

    private static final String ADDRESS = "+15550001";
    private static final String REMINDER_TEXT_PART = "haven't heard back";

    // 2026-10-19 08:30 in Toronto
    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T12:30:00Z"));
    private TestRuntime rt;
    private String scheduleId;

    @BeforeEach
    void setUp() {
        rt = new TestRuntime(clock);
        rt.participantService.enroll("p1", ADDRESS);
        scheduleId = rt.scheduleService.createSchedule("p1", ScheduleTarget.fixed("09:00"), "America/Toronto", Duration.ofMinutes(10));
        // prompt goes out at 08:50, reminder due at 12:50 local
        rt.advance(Duration.ofMinutes(20));
    }

    @Test
    void overdueReminderShouldFireOnceAfterGraceDelay() {
        // down from before the reminder was due until an hour after
        clock.set(Instant.parse("2026-10-19T17:50:00Z"));
        TestRuntime restarted = rt.restart();

        RecoveryReport report = restarted.recoveryCoordinator.recoverAll();
        assertEquals(1, report.recovered());
        assertEquals(0, report.errored());
        assertEquals(1, report.timersRearmed());

        assertEquals(0, restarted.drain());
        restarted.advance(Duration.ofSeconds(6));
        restarted.advance(Duration.ofHours(1));

        assertEquals(1, reminders());
        assertEquals(0, restarted.pendingJobs(DailyPromptReminderHandler.KIND));
    }

    @Test
    void repeatedRecoveryShouldNotDuplicateTimers() {
        clock.set(Instant.parse("2026-10-19T17:50:00Z"));
        TestRuntime restarted = rt.restart();

        restarted.recoveryCoordinator.recoverAll();
        restarted.recoveryCoordinator.recoverAll();

        assertEquals(1, restarted.pendingJobs(DailyPromptReminderHandler.KIND));
        assertEquals(1, restarted.jobStore.findAll().stream()
                .filter(j -> j.status() == JobStatus.PENDING && ("schedule:p1:" + scheduleId).equals(j.dedupeKey()))
                .count());

        restarted.advance(Duration.ofSeconds(6));
        assertEquals(1, reminders());
    }

    @Test
    void staleRunningJobShouldBeSupersededOnRecovery() {
        // a worker claimed the reminder and died
        clock.set(Instant.parse("2026-10-19T16:50:00Z"));
        List<Job> claimed = rt.jobStore.claimDue(clock.instant(), 10, Duration.ofMinutes(5), "dead-worker");
        assertEquals(1, claimed.size());

        clock.set(Instant.parse("2026-10-19T17:50:00Z"));
        TestRuntime restarted = rt.restart();
        restarted.recoveryCoordinator.recoverAll();

        assertEquals(JobStatus.CANCELLED, restarted.jobStore.findById(claimed.get(0).id()).orElseThrow().status());
        restarted.advance(Duration.ofSeconds(6));
        restarted.advance(Duration.ofMinutes(10));
        assertEquals(1, reminders());
    }

    @Test
    void promptInFlightAtShutdownShouldBeSentOnce() {
        MutableClock local = new MutableClock(Instant.parse("2026-10-19T12:30:00Z"));
        TestRuntime before = new TestRuntime(local);
        before.participantService.enroll("p2", "+15550002");
        before.scheduleService.createSchedule("p2", ScheduleTarget.fixed("09:00"), "America/Toronto", Duration.ofMinutes(10));

        // a worker claimed today's prompt and died before it finished; its lock is still live at restart
        local.set(Instant.parse("2026-10-19T12:50:00Z"));
        List<Job> claimed = before.jobStore.claimDue(local.instant(), 10, Duration.ofMinutes(10), "dead-worker");
        assertEquals(1, claimed.size());
        assertEquals(DailyPromptHandler.KIND, claimed.get(0).kind());

        local.set(Instant.parse("2026-10-19T12:51:00Z"));
        TestRuntime restarted = before.restart();
        RecoveryReport report = restarted.recoveryCoordinator.recoverAll();
        assertEquals(1, report.timersRearmed());

        restarted.advance(Duration.ofSeconds(6));
        // past the dead worker's lock: the old claim is picked up again
        restarted.advance(Duration.ofMinutes(15));

        long prompts = restarted.sender.sent().stream().filter(s -> "daily_prompt".equals(s.text())).count();
        assertEquals(1, prompts);
        assertEquals(JobStatus.DONE, restarted.jobStore.findById(claimed.get(0).id()).orElseThrow().status());
    }

    @Test
    void futureMarkerShouldKeepItsDueTime() {
        TestRuntime restarted = rt.restart();
        restarted.recoveryCoordinator.recoverAll();

        Job reminder = restarted.jobStore.findPendingByDedupeKey("reminder:p1").orElseThrow();
        assertEquals(Instant.parse("2026-10-19T16:50:00Z"), reminder.runAt());
        PendingTimer marker = restarted.pendingTimers.find("p1", FlowTypes.CONVERSATION, "dailyPromptReminder").orElseThrow();
        assertEquals("job:" + reminder.id(), marker.handle());
    }

    @Test
    void lostRecurringScheduleAndRouteShouldBeRestored() {
        rt.jobStore.cancelByDedupeKey("schedule:p1:" + scheduleId, clock.instant());
        TestRuntime restarted = rt.restart();
        assertTrue(restarted.router.find(ADDRESS).isEmpty());

        restarted.recoveryCoordinator.recoverAll();

        Job series = restarted.jobStore.findPendingByDedupeKey("schedule:p1:" + scheduleId).orElseThrow();
        assertEquals(Instant.parse("2026-10-20T12:50:00Z"), series.runAt());
        assertEquals("p1", restarted.router.find(ADDRESS).orElseThrow().participantId());
    }

    @Test
    void unreadableMarkerShouldBeSkipped() {
        rt.stateManager.setStateData("p1", FlowTypes.CONVERSATION, PendingTimers.key("broken"), "{not json");
        TestRuntime restarted = rt.restart();

        RecoveryReport report = restarted.recoveryCoordinator.recoverAll();

        assertEquals(1, report.recovered());
        assertEquals(0, report.errored());
        assertEquals(1, report.timersRearmed());
    }

    @Test
    void failingParticipantShouldNotStopTheOthers() {
        rt.participantService.enroll("p2", "+15550002");
        FlowRecoverer failing = new FlowRecoverer() {
            @Override
            public String flowType() {
                return FlowTypes.CONVERSATION;
            }

            @Override
            public void rearmRecurring(ParticipantFlowState state) {
                throw new IllegalStateException("broken record");
            }
        };
        RecoveryCoordinator coordinator = new RecoveryCoordinator(rt.stateManager, rt.timerService, rt.pendingTimers,
                rt.router, List.of(new ParticipantFlowRecoverer(), failing), Duration.ofSeconds(5), clock);

        RecoveryReport report = coordinator.recoverAll();

        assertEquals(1, report.errored());
        assertEquals(1, report.recovered());
        assertEquals(2, report.total());
    }

    @Test
    void terminalParticipantShouldBeSkipped() {
        rt.stateManager.setCurrentState("p3", FlowTypes.PARTICIPANT, "WITHDRAWN");

        RecoveryReport report = rt.restart().recoveryCoordinator.recoverAll(List.of("p3"));

        assertEquals(1, report.skipped());
        assertEquals(0, report.recovered());
    }

    private long reminders() {
        return rt.sender.sent().stream().filter(s -> s.text().contains(REMINDER_TEXT_PART)).count();
    }
}
