package io.coachflow.internal.mongo;

import com.mongodb.client.MongoClients;
import io.coachflow.state.StateManager;
import io.coachflow.store.ParticipantFlowState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoFlowStateStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2026-01-01T09:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoFlowStateStore store;
    private StateManager stateManager;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "coachflow_test");
        mongoTemplate.dropCollection(FlowStateDocument.class);
        store = new MongoFlowStateStore(mongoTemplate);
        stateManager = new StateManager(store, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(FlowStateDocument.class);
    }

    @Test
    void saveShouldReplaceTheWholeRecord() {
        stateManager.setCurrentState("p1", "conversation", "IDLE");
        stateManager.setStateData("p1", "conversation", "timer:dailyPromptReminder", "{\"kind\":\"daily_prompt_reminder\"}");
        stateManager.setStateData("p1", "conversation", "lastReplyAt", T0.toString());
        stateManager.removeStateData("p1", "conversation", "lastReplyAt");

        ParticipantFlowState loaded = store.find("p1", "conversation").orElseThrow();

        assertEquals("IDLE", loaded.currentState());
        assertEquals(1, loaded.stateData().size());
        assertEquals("{\"kind\":\"daily_prompt_reminder\"}", loaded.get("timer:dailyPromptReminder"));
        assertEquals(T0, loaded.createdAt());
        assertEquals(T0, loaded.updatedAt());
    }

    @Test
    void participantQueriesShouldSpanFlows() {
        stateManager.setCurrentState("p2", "participant", "ENROLLED");
        stateManager.setCurrentState("p1", "participant", "ENROLLED");
        stateManager.setCurrentState("p1", "micro_health_intervention", "END_OF_DAY");

        assertEquals(List.of("p1", "p2"), store.listParticipantIds());
        assertEquals(2, store.findByParticipant("p1").size());

        assertEquals(2, store.deleteByParticipant("p1"));
        assertTrue(store.findByParticipant("p1").isEmpty());
        assertEquals(List.of("p2"), store.listParticipantIds());

        store.delete("p2", "participant");
        assertTrue(store.find("p2", "participant").isEmpty());
    }
}
