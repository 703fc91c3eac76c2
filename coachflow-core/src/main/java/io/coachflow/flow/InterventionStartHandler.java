package io.coachflow.flow;

import io.coachflow.JobHandler;

import java.util.Objects;

public class InterventionStartHandler implements JobHandler<InterventionStartHandler.Payload> {

    public static final String KIND = "intervention_start";

    public record Payload(String participantId) {
    }

    private final InterventionFlow flow;

    public InterventionStartHandler(InterventionFlow flow) {
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
        flow.start(payload.participantId());
    }
}
