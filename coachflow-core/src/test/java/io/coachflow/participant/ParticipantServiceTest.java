package io.coachflow.participant;

import io.coachflow.core.FlowTypes;
import io.coachflow.core.JobStatus;
import io.coachflow.exception.ValidationException;
import io.coachflow.schedule.ScheduleTarget;
import io.coachflow.support.MutableClock;
import io.coachflow.support.TestRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParticipantServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T12:30:00Z"));
    private TestRuntime rt;

    @BeforeEach
    void setUp() {
        rt = new TestRuntime(clock);
    }

    @Test
    void enrollShouldStoreCanonicalAddressAndRoute() {
        String canonical = rt.participantService.enroll("p1", "  +15550001 ");

        assertEquals("+15550001", canonical);
        assertTrue(rt.directory.isEnrolled("p1"));
        assertEquals("p1", rt.router.find("+15550001").orElseThrow().participantId());
        assertEquals(FlowTypes.CONVERSATION, rt.router.find("+15550001").orElseThrow().flowType());
    }

    @Test
    void invalidAddressShouldBeRejectedWithoutState() {
        assertThrows(ValidationException.class, () -> rt.participantService.enroll("p1", "not-a-number"));
        assertTrue(rt.stateManager.findAll("p1").isEmpty());
    }

    @Test
    void reEnrollingWithNewAddressShouldMoveTheRoute() {
        rt.participantService.enroll("p1", "+15550001");
        rt.participantService.enroll("p1", "+15550009");

        assertTrue(rt.router.find("+15550001").isEmpty());
        assertEquals("p1", rt.router.find("+15550009").orElseThrow().participantId());
        assertEquals(1, rt.router.size());
    }

    @Test
    void withdrawShouldCancelEveryTimerAndDeleteState() {
        rt.participantService.enroll("p1", "+15550001");
        rt.scheduleService.createSchedule("p1", ScheduleTarget.fixed("09:00"), "America/Toronto", Duration.ofMinutes(10));
        rt.interventionFlow.start("p1");
        rt.interventionFlow.scheduleDailyStart("p1", 8, 0, "America/Toronto");
        assertTrue(rt.jobStore.findAll().stream().anyMatch(j -> j.status() == JobStatus.PENDING));

        assertTrue(rt.participantService.withdraw("p1"));

        assertTrue(rt.jobStore.findAll().stream().noneMatch(j -> j.status() == JobStatus.PENDING));
        assertTrue(rt.stateManager.findAll("p1").isEmpty());
        assertTrue(rt.router.find("+15550001").isEmpty());

        int before = rt.sender.sent().size();
        rt.advance(Duration.ofDays(2));
        assertEquals(before, rt.sender.sent().size());
    }

    @Test
    void withdrawWithoutStateShouldReturnFalse() {
        assertFalse(rt.participantService.withdraw("nobody"));
    }
}
