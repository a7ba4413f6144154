package com.ryuqq.icnp.core.spi;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Message transport SPI carrying opaque ICNP envelopes.
 *
 * <p>Inbound envelopes are delivered at least once. Consumers acknowledge each
 * {@link Delivery} after the engine has processed it, negatively acknowledge it
 * for redelivery, or move it to the dead-letter queue.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from multiple threads</li>
 *   <li>Idempotent: ack/nack of an unknown delivery is a no-op</li>
 *   <li>At-least-once: the same envelope may be delivered more than once</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * List&lt;Delivery&gt; batch = transport.receive(10);
 * for (Delivery delivery : batch) {
 *     try {
 *         EngineResponse response = engine.handle(delivery.envelope());
 *         response.outbound().forEach(transport::send);
 *         transport.ack(delivery);
 *     } catch (RuntimeException e) {
 *         transport.nack(delivery);
 *     }
 * }
 * </pre>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public interface Transport {

    /**
     * Queues an inbound envelope for the engine.
     *
     * @param envelope raw envelope JSON
     * @param delayMs delay before the envelope becomes receivable (0 for immediate)
     * @throws IllegalArgumentException if envelope is null or delayMs is negative
     */
    void deliver(ObjectNode envelope, long delayMs);

    /**
     * Receives up to {@code batchSize} inbound deliveries.
     *
     * @param batchSize maximum number of deliveries
     * @return deliveries, possibly empty
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<Delivery> receive(int batchSize);

    /**
     * Acknowledges a processed delivery.
     *
     * @param delivery the delivery
     */
    void ack(Delivery delivery);

    /**
     * Returns a delivery to the queue for another attempt.
     *
     * @param delivery the delivery
     */
    void nack(Delivery delivery);

    /**
     * Moves a delivery to the dead-letter queue.
     *
     * @param delivery the delivery
     * @param reason why it could not be processed
     */
    void deadLetter(Delivery delivery, String reason);

    /**
     * Sends an outbound envelope produced by the engine.
     *
     * @param envelope encoded envelope JSON
     */
    void send(ObjectNode envelope);
}
