package io.coachflow.recovery;

import io.coachflow.TimerService;
import io.coachflow.core.TimerAction;
import io.coachflow.core.TimerHandle;
import io.coachflow.routing.ResponseRouter;
import io.coachflow.state.StateManager;
import io.coachflow.store.ParticipantFlowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rebuilds outstanding timed work from participant state. Runs once at startup, before the dispatcher
 * starts taking jobs.
 *
 * <p>For each non-terminal flow record: every {@link PendingTimer} marker is re-armed (overdue markers
 * after {@code graceDelay}, future ones at their due time) under the marker's dedupe key, the stored
 * handle is replaced, recurring schedules are re-armed and response routes re-registered. A participant
 * that fails is counted and logged; the pass continues with the next one.
 */
public class RecoveryCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final StateManager stateManager;
    private final TimerService timerService;
    private final PendingTimers pendingTimers;
    private final ResponseRouter responseRouter;
    private final Map<String, FlowRecoverer> recoverers;
    private final Duration graceDelay;
    private final Clock clock;

    public RecoveryCoordinator(StateManager stateManager,
                               TimerService timerService,
                               PendingTimers pendingTimers,
                               ResponseRouter responseRouter,
                               List<FlowRecoverer> recoverers,
                               Duration graceDelay,
                               Clock clock) {
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager must not be null");
        this.timerService = Objects.requireNonNull(timerService, "timerService must not be null");
        this.pendingTimers = Objects.requireNonNull(pendingTimers, "pendingTimers must not be null");
        this.responseRouter = Objects.requireNonNull(responseRouter, "responseRouter must not be null");
        this.recoverers = Objects.requireNonNull(recoverers, "recoverers must not be null").stream()
                .collect(Collectors.toUnmodifiableMap(
                        FlowRecoverer::flowType,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate FlowRecoverer flowType: " + a.flowType());
                        }
                ));
        this.graceDelay = Objects.requireNonNull(graceDelay, "graceDelay must not be null");
        if (graceDelay.isNegative()) {
            throw new IllegalArgumentException("graceDelay must not be negative");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Recover every participant that has state.
     */
    public RecoveryReport recoverAll() {
        return recoverAll(stateManager.listParticipantIds());
    }

    public RecoveryReport recoverAll(Collection<String> participantIds) {
        Objects.requireNonNull(participantIds, "participantIds must not be null");
        log.info("Recovery starting participants={}", participantIds.size());

        int recovered = 0;
        int skipped = 0;
        int errored = 0;
        int timers = 0;

        for (String participantId : participantIds) {
            try {
                int rearmed = recoverParticipant(participantId);
                if (rearmed < 0) {
                    skipped++;
                } else {
                    recovered++;
                    timers += rearmed;
                }
            } catch (RuntimeException e) {
                errored++;
                log.error("Recovery failed participantId={} msg={}", participantId, e.getMessage(), e);
            }
        }

        RecoveryReport report = new RecoveryReport(recovered, skipped, errored, timers);
        log.info("Recovery finished recovered={} skipped={} errored={} timersRearmed={}",
                report.recovered(), report.skipped(), report.errored(), report.timersRearmed());
        return report;
    }

    /**
     * @return number of timers re-armed, or -1 when the participant had nothing active
     */
    private int recoverParticipant(String participantId) {
        List<ParticipantFlowState> states = stateManager.findAll(participantId);
        boolean active = false;
        int rearmed = 0;

        for (ParticipantFlowState state : states) {
            FlowRecoverer recoverer = recoverers.get(state.flowType());
            if (recoverer != null && recoverer.isTerminal(state)) {
                log.debug("Recovery skipping terminal flow participantId={} flowType={} state={}",
                        participantId, state.flowType(), state.currentState());
                continue;
            }
            active = true;

            for (Map.Entry<String, PendingTimer> e : pendingTimers.markers(state).entrySet()) {
                rearm(state, e.getKey(), e.getValue());
                rearmed++;
            }

            if (recoverer != null) {
                recoverer.rearmRecurring(state);
                recoverer.responseRoute(state).ifPresent(responseRouter::register);
            }
        }
        return active ? rearmed : -1;
    }

    private void rearm(ParticipantFlowState state, String name, PendingTimer marker) {
        Instant now = clock.instant();
        Instant due = marker.dueInstant();
        Instant fireAt = due.isAfter(now) ? due : now.plus(graceDelay);

        String dedupeKey = marker.dedupeKey() != null
                ? marker.dedupeKey()
                : PendingTimers.defaultDedupeKey(state.participantId(), state.flowType(), name);
        TimerAction action = new TimerAction(marker.kind(), marker.payload(), dedupeKey);
        TimerHandle handle = timerService.at(fireAt, action);
        log.info("Recovery re-armed timer participantId={} flowType={} name={} kind={} dueAt={} fireAt={}",
                state.participantId(), state.flowType(), name, marker.kind(), due, fireAt);

        pendingTimers.write(state.participantId(), state.flowType(), name, new PendingTimer(marker.kind(), fireAt.toString(), marker.payload(), dedupeKey, handle.value()));
    }
}
