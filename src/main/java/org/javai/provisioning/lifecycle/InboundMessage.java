package org.javai.provisioning.lifecycle;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * A received message.
 *
 * @param messageId Backend-assigned or sender-assigned id
 * @param body Payload bytes
 * @param messageType Application-level type name (may be null)
 * @param sessionId Session the message belongs to (null for sessionless receivers)
 * @param properties Application properties
 */
public record InboundMessage(String messageId, byte[] body, String messageType, String sessionId, Map<String, Object> properties) {

    public InboundMessage {
        Objects.requireNonNull(body, "body must not be null");
        body = body.clone();
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
