package com.ryuqq.icnp.core.spi;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One inbound delivery handed out by a {@link Transport}.
 *
 * @param deliveryId transport-assigned id, unique per delivery attempt
 * @param envelope the raw envelope JSON
 * @param attempt delivery attempt number, starting at 1
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Delivery(String deliveryId, ObjectNode envelope, int attempt) {

    public Delivery {
        if (deliveryId == null || deliveryId.isBlank()) {
            throw new IllegalArgumentException("deliveryId cannot be null or blank");
        }
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        envelope = envelope.deepCopy();
    }

    @Override
    public ObjectNode envelope() {
        return envelope.deepCopy();
    }

    /**
     * Session id text of the envelope, used for lane selection.
     *
     * @return the {@code session_id} member, or an empty string if absent
     */
    public String sessionKey() {
        return envelope.path("session_id").asText("");
    }
}
