package io.coachflow.config;

import io.coachflow.internal.JobDispatcher;
import io.coachflow.recovery.RecoveryCoordinator;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges CoachFlow start/stop with the Spring container lifecycle. Recovery runs before the
 * dispatcher starts polling so re-armed timers and restored routes are in place first.
 */
public class CoachFlowLifecycle implements SmartLifecycle {
    private final JobDispatcher dispatcher;
    private final RecoveryCoordinator recoveryCoordinator;
    private final boolean recoverOnStartup;
    private volatile boolean running = false;

    public CoachFlowLifecycle(JobDispatcher dispatcher, RecoveryCoordinator recoveryCoordinator, boolean recoverOnStartup) {
        this.dispatcher = dispatcher;
        this.recoveryCoordinator = recoveryCoordinator;
        this.recoverOnStartup = recoverOnStartup;
    }

    @Override
    public void start() {
        if (recoverOnStartup) {
            // RecoveryCoordinator logs its own report
            recoveryCoordinator.recoverAll();
        }
        dispatcher.start();
        running = true;
    }

    @Override
    public void stop() {
        dispatcher.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 2;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
