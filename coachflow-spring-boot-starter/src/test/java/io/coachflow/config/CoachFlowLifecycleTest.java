package io.coachflow.config;

import io.coachflow.internal.JobDispatcher;
import io.coachflow.recovery.RecoveryCoordinator;
import io.coachflow.recovery.RecoveryReport;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

class CoachFlowLifecycleTest {

    private final JobDispatcher dispatcher = mock(JobDispatcher.class);
    private final RecoveryCoordinator recoveryCoordinator = mock(RecoveryCoordinator.class);

    @Test
    void startShouldRecoverOnceBeforeDispatching() {
        RecoveryReport report = mock(RecoveryReport.class);
        when(recoveryCoordinator.recoverAll()).thenReturn(report);
        CoachFlowLifecycle lifecycle = new CoachFlowLifecycle(dispatcher, recoveryCoordinator, true);

        lifecycle.start();

        InOrder order = inOrder(recoveryCoordinator, dispatcher);
        order.verify(recoveryCoordinator).recoverAll();
        order.verify(dispatcher).start();
        verifyNoMoreInteractions(recoveryCoordinator);
        // the report is logged by the coordinator, not read back here
        verifyNoMoreInteractions(report);
        assertThat(lifecycle.isRunning()).isTrue();
    }

    @Test
    void startWithoutRecoveryShouldOnlyStartDispatcher() {
        CoachFlowLifecycle lifecycle = new CoachFlowLifecycle(dispatcher, recoveryCoordinator, false);

        lifecycle.start();
        lifecycle.stop();

        verify(recoveryCoordinator, never()).recoverAll();
        verify(dispatcher).start();
        verify(dispatcher).stop();
        assertThat(lifecycle.isRunning()).isFalse();
    }
}
