package io.coachflow.routing;

/**
 * Incoming messages from {@code address} belong to {@code participantId} and are handled by the flow
 * {@code flowType}.
 */
public record ResponseRoute(String address, String participantId, String flowType) {
}
