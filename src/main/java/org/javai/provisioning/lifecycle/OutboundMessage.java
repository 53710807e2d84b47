package org.javai.provisioning.lifecycle;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * A message to publish.
 *
 * @param body Payload bytes
 * @param messageType Application-level type name carried alongside the payload (may be null)
 * @param properties Application properties
 */
public record OutboundMessage(byte[] body, String messageType, Map<String, Object> properties) {

    public OutboundMessage {
        Objects.requireNonNull(body, "body must not be null");
        body = body.clone();
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public static OutboundMessage of(String body, String messageType) {
        return new OutboundMessage(body.getBytes(StandardCharsets.UTF_8), messageType, Map.of());
    }

    @Override
    public byte[] body() {
        return body.clone();
    }
}
