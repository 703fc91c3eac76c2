package io.coachflow.spi;

import java.util.Map;

/**
 * Produces message bodies at fire time. {@code context} names what is being generated
 * (e.g. {@code kind}, {@code state}) plus any flow data the generator may use.
 */
public interface ContentGenerator {
    String generate(String participantId, Map<String, String> context);
}
