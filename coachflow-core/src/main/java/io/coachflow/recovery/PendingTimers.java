package io.coachflow.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.coachflow.TimerService;
import io.coachflow.core.TimerAction;
import io.coachflow.core.TimerHandle;
import io.coachflow.state.StateManager;
import io.coachflow.store.ParticipantFlowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Arms one-off timers and records them as {@link PendingTimer} markers under {@code timer:<name>} in the
 * participant's state data, which is where the recovery coordinator looks for outstanding work.
 *
 * <p>Every armed timer gets a dedupe key (derived from participant, flow and name when the action has
 * none), so re-arming after a restart replaces a surviving durable job instead of duplicating it.
 * Marker writes are bookkeeping: if one fails after the timer was armed, it is logged and the timer
 * stays in force.
 */
public class PendingTimers {
    private static final Logger log = LoggerFactory.getLogger(PendingTimers.class);

    public static final String KEY_PREFIX = "timer:";

    private final StateManager stateManager;
    private final TimerService timerService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PendingTimers(StateManager stateManager, TimerService timerService, ObjectMapper objectMapper, Clock clock) {
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager must not be null");
        this.timerService = Objects.requireNonNull(timerService, "timerService must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public TimerHandle armAfter(String participantId, String flowType, String name, TimerAction action, Duration delay) {
        return arm(participantId, flowType, name, action, clock.instant().plus(delay));
    }

    /**
     * Arm {@code action} at {@code dueAt}, replacing any timer recorded under the same name.
     */
    public TimerHandle arm(String participantId, String flowType, String name, TimerAction action, Instant dueAt) {
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(dueAt, "dueAt must not be null");

        find(participantId, flowType, name).ifPresent(previous -> cancelQuietly(previous.handle()));

        String dedupeKey = action.dedupeKey() != null ? action.dedupeKey() : defaultDedupeKey(participantId, flowType, name);
        TimerHandle handle = timerService.at(dueAt, action.withDedupeKey(dedupeKey));

        PendingTimer marker = new PendingTimer(action.kind(), dueAt.toString(), action.payload(), dedupeKey, handle.value());
        write(participantId, flowType, name, marker);
        return handle;
    }

    /**
     * Cancel the timer recorded under {@code name} and drop its marker.
     */
    public void disarm(String participantId, String flowType, String name) {
        find(participantId, flowType, name).ifPresent(marker -> cancelQuietly(marker.handle()));
        clear(participantId, flowType, name);
    }

    /**
     * Drop the marker without cancelling; called by handlers once their timer fired.
     */
    public void clear(String participantId, String flowType, String name) {
        try {
            stateManager.removeStateData(participantId, flowType, key(name));
        } catch (RuntimeException e) {
            log.warn("pending timer marker not removed participantId={} flowType={} name={} msg={}",
                    participantId, flowType, name, e.getMessage());
        }
    }

    public Optional<PendingTimer> find(String participantId, String flowType, String name) {
        return stateManager.getStateData(participantId, flowType, key(name))
                .flatMap(json -> decode(participantId, name, json));
    }

    /**
     * Decodable markers of one flow record, keyed by timer name. Unreadable markers are logged and
     * skipped.
     */
    public Map<String, PendingTimer> markers(ParticipantFlowState state) {
        Map<String, PendingTimer> result = new LinkedHashMap<>();
        state.stateData().forEach((key, value) -> {
            if (key.startsWith(KEY_PREFIX)) {
                String name = key.substring(KEY_PREFIX.length());
                decode(state.participantId(), name, value).ifPresent(marker -> result.put(name, marker));
            }
        });
        return result;
    }

    public void disarmAll(ParticipantFlowState state) {
        markers(state).forEach((name, marker) -> cancelQuietly(marker.handle()));
    }

    void write(String participantId, String flowType, String name, PendingTimer marker) {
        try {
            stateManager.setStateData(participantId, flowType, key(name), encode(marker));
        } catch (RuntimeException e) {
            log.warn("pending timer armed but marker not recorded participantId={} flowType={} name={} handle={} msg={}",
                    participantId, flowType, name, marker.handle(), e.getMessage());
        }
    }

    public static String key(String name) {
        return KEY_PREFIX + name;
    }

    static String defaultDedupeKey(String participantId, String flowType, String name) {
        return "timer:" + participantId + ":" + flowType + ":" + name;
    }

    private void cancelQuietly(String handle) {
        try {
            timerService.cancel(TimerHandle.of(handle));
        } catch (RuntimeException e) {
            log.warn("pending timer cancel failed handle={} msg={}", handle, e.getMessage());
        }
    }

    private String encode(PendingTimer marker) {
        try {
            return objectMapper.writeValueAsString(marker);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("pending timer marker is not serializable: " + marker.kind(), e);
        }
    }

    private Optional<PendingTimer> decode(String participantId, String name, String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            PendingTimer marker = objectMapper.readValue(json, PendingTimer.class);
            if (marker.kind() == null || marker.dueAt() == null) {
                log.warn("pending timer marker incomplete participantId={} name={}", participantId, name);
                return Optional.empty();
            }
            marker.dueInstant();
            return Optional.of(marker);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("pending timer marker unreadable participantId={} name={} msg={}", participantId, name, e.getMessage());
            return Optional.empty();
        }
    }
}
