package io.coachflow.spi;

import java.util.List;

/**
 * Outbound message transport. Implementations throw
 * {@link io.coachflow.exception.ValidationException} for bad addresses and
 * {@link io.coachflow.exception.TransientDependencyException} for delivery failures.
 */
public interface MessageSender {

    /**
     * @return canonical form of {@code address}
     */
    String validateRecipient(String address);

    void send(String to, String text);

    /**
     * Send with answer options for channels that can render them. Channels without that support fall
     * back to plain text.
     */
    default void sendInteractive(String to, String text, List<String> options) {
        send(to, text);
    }
}
