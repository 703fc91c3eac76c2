package io.coachflow.flow;

import io.coachflow.JobHandler;

import java.util.Objects;

public class InterventionTimeoutHandler implements JobHandler<InterventionTimeoutHandler.Payload> {

    public static final String KIND = "intervention_timeout";

    public record Payload(String participantId, String expectedState) {
    }

    private final InterventionFlow flow;

    public InterventionTimeoutHandler(InterventionFlow flow) {
        this.flow = Objects.requireNonNull(flow, "flow must not be null");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Class<Payload> payloadClass() {
        return Payload.class;
    }

    @Override
    public void execute(Payload payload) {
        InterventionState expected = InterventionState.parse(payload.expectedState())
                .orElseThrow(() -> new IllegalArgumentException("unknown intervention state: " + payload.expectedState()));
        flow.onTimeout(payload.participantId(), expected);
    }
}
