package io.coachflow.routing;

/**
 * Receives free-text replies routed to one flow type.
 */
public interface ReplyHandler {
    String flowType();

    void onReply(String participantId, String text);
}
