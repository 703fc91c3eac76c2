package io.coachflow.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.coachflow.core.FlowTypes;
import io.coachflow.state.StateManager;
import io.coachflow.store.ParticipantFlowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of the schedule list kept as JSON under {@code schedules} in the conversation flow.
 */
public class ScheduleRegistry {
    private static final Logger log = LoggerFactory.getLogger(ScheduleRegistry.class);

    static final String KEY_SCHEDULES = "schedules";
    private static final TypeReference<List<ScheduleDescriptor>> LIST_TYPE = new TypeReference<>() {
    };

    private final StateManager stateManager;
    private final ObjectMapper objectMapper;

    public ScheduleRegistry(StateManager stateManager, ObjectMapper objectMapper) {
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public List<ScheduleDescriptor> list(String participantId) {
        return stateManager.find(participantId, FlowTypes.CONVERSATION)
                .map(this::list)
                .orElse(List.of());
    }

    public List<ScheduleDescriptor> list(ParticipantFlowState state) {
        String json = state.get(KEY_SCHEDULES);
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<ScheduleDescriptor> schedules = new ArrayList<>(objectMapper.readValue(json, LIST_TYPE));
            schedules.sort(Comparator.comparing(ScheduleDescriptor::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));
            return List.copyOf(schedules);
        } catch (JsonProcessingException e) {
            log.warn("schedule list unreadable participantId={} msg={}", state.participantId(), e.getMessage());
            return List.of();
        }
    }

    public Optional<ScheduleDescriptor> find(String participantId, String scheduleId) {
        return list(participantId).stream()
                .filter(d -> d.id().equals(scheduleId))
                .findFirst();
    }

    /**
     * Insert or replace by id.
     */
    public void put(String participantId, ScheduleDescriptor descriptor) {
        stateManager.update(participantId, FlowTypes.CONVERSATION, s -> {
            List<ScheduleDescriptor> schedules = new ArrayList<>(list(s));
            schedules.removeIf(d -> d.id().equals(descriptor.id()));
            schedules.add(descriptor);
            return s.withData(KEY_SCHEDULES, encode(schedules));
        });
    }

    public boolean remove(String participantId, String scheduleId) {
        boolean[] removed = {false};
        stateManager.update(participantId, FlowTypes.CONVERSATION, s -> {
            List<ScheduleDescriptor> schedules = new ArrayList<>(list(s));
            removed[0] = schedules.removeIf(d -> d.id().equals(scheduleId));
            return schedules.isEmpty() ? s.withoutData(KEY_SCHEDULES) : s.withData(KEY_SCHEDULES, encode(schedules));
        });
        return removed[0];
    }

    private String encode(List<ScheduleDescriptor> schedules) {
        try {
            return objectMapper.writeValueAsString(schedules);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("schedule list is not serializable", e);
        }
    }
}
