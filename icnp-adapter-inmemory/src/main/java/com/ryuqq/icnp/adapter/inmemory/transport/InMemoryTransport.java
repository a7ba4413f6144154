package com.ryuqq.icnp.adapter.inmemory.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.spi.Delivery;
import com.ryuqq.icnp.core.spi.Transport;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link Transport} SPI for testing and reference purposes.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Inbound Queue:</strong> DelayQueue&lt;DelayedDelivery&gt; - delayed delivery ordered by availability time</li>
 *   <li><strong>In-Flight Tracking:</strong> ConcurrentHashMap&lt;deliveryId, InFlight&gt; - visibility timeout management</li>
 *   <li><strong>Dead Letter Queue:</strong> CopyOnWriteArrayList&lt;DeadLetter&gt; - deliveries that will not be retried</li>
 *   <li><strong>Outbox:</strong> CopyOnWriteArrayList&lt;ObjectNode&gt; - envelopes sent by the engine</li>
 * </ul>
 *
 * <p>Each receive hands out a new delivery id. A nacked or timed-out delivery returns to the
 * queue with its attempt number incremented, which gives at-least-once semantics and lets
 * consumers bound retries by {@link Delivery#attempt()}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryTransport transport = new InMemoryTransport();
 * transport.deliver(envelope, 0);
 *
 * for (Delivery delivery : transport.receive(10)) {
 *     engine.handle(delivery.envelope()).outbound().forEach(transport::send);
 *     transport.ack(delivery);
 * }
 * List&lt;ObjectNode&gt; replies = transport.sent();
 * </pre>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class InMemoryTransport implements Transport {

    /**
     * Default visibility timeout: 30 seconds.
     */
    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    private final DelayQueue<DelayedDelivery> queue;
    private final ConcurrentHashMap<String, InFlight> inFlight;
    private final List<DeadLetter> dlq;
    private final List<ObjectNode> outbox;
    private final long visibilityTimeoutMs;

    public InMemoryTransport() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    /**
     * @param visibilityTimeoutMs visibility timeout in milliseconds
     * @throws IllegalArgumentException if visibilityTimeoutMs is not positive
     */
    public InMemoryTransport(long visibilityTimeoutMs) {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutMs must be positive, but was: " + visibilityTimeoutMs);
        }
        this.queue = new DelayQueue<>();
        this.inFlight = new ConcurrentHashMap<>();
        this.dlq = new CopyOnWriteArrayList<>();
        this.outbox = new CopyOnWriteArrayList<>();
        this.visibilityTimeoutMs = visibilityTimeoutMs;
    }

    @Override
    public void deliver(ObjectNode envelope, long delayMs) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        queue.put(new DelayedDelivery(envelope.deepCopy(), 1, delayMs));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Polls only deliveries whose delay has expired</li>
     *   <li>Marks each delivery as in-flight with a visibility deadline</li>
     * </ul>
     */
    @Override
    public List<Delivery> receive(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        List<Delivery> result = new ArrayList<>();
        long now = System.currentTimeMillis();

        for (int i = 0; i < batchSize; i++) {
            DelayedDelivery delayed = queue.poll();
            if (delayed == null) {
                break;
            }
            Delivery delivery = new Delivery(UUID.randomUUID().toString(), delayed.envelope, delayed.attempt);
            inFlight.put(delivery.deliveryId(), new InFlight(delivery, now + visibilityTimeoutMs));
            result.add(delivery);
        }

        return result;
    }

    @Override
    public void ack(Delivery delivery) {
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }
        inFlight.remove(delivery.deliveryId());
    }

    /**
     * {@inheritDoc}
     *
     * <p>Unknown or already settled deliveries are ignored.</p>
     */
    @Override
    public void nack(Delivery delivery) {
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }
        InFlight removed = inFlight.remove(delivery.deliveryId());
        if (removed != null) {
            requeue(removed.delivery);
        }
    }

    @Override
    public void deadLetter(Delivery delivery, String reason) {
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        inFlight.remove(delivery.deliveryId());
        dlq.add(new DeadLetter(delivery, reason, System.currentTimeMillis()));
    }

    @Override
    public void send(ObjectNode envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        outbox.add(envelope.deepCopy());
    }

    /**
     * Returns in-flight deliveries whose visibility timeout has expired to the queue.
     *
     * @return number of deliveries requeued
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        int count = 0;

        List<String> expired = new ArrayList<>();
        for (var entry : inFlight.entrySet()) {
            if (entry.getValue().visibilityDeadline <= now) {
                expired.add(entry.getKey());
            }
        }

        for (String deliveryId : expired) {
            InFlight removed = inFlight.remove(deliveryId);
            if (removed != null) {
                requeue(removed.delivery);
                count++;
            }
        }
        return count;
    }

    private void requeue(Delivery delivery) {
        queue.put(new DelayedDelivery(delivery.envelope(), delivery.attempt() + 1, 0));
    }

    /**
     * Clears queue, in-flight, DLQ and outbox. Used for test cleanup.
     */
    public void clear() {
        queue.clear();
        inFlight.clear();
        dlq.clear();
        outbox.clear();
    }

    public int queueSize() {
        return queue.size();
    }

    public int inFlightSize() {
        return inFlight.size();
    }

    public int dlqSize() {
        return dlq.size();
    }

    public List<DeadLetter> getDeadLetters() {
        return new ArrayList<>(dlq);
    }

    /**
     * Envelopes sent by the engine, in send order.
     *
     * @return copies of the sent envelopes
     */
    public List<ObjectNode> sent() {
        List<ObjectNode> copies = new ArrayList<>();
        outbox.forEach(envelope -> copies.add(envelope.deepCopy()));
        return copies;
    }

    private static class DelayedDelivery implements Delayed {
        private final ObjectNode envelope;
        private final int attempt;
        private final long availableAt;

        DelayedDelivery(ObjectNode envelope, int attempt, long delayMs) {
            this.envelope = envelope;
            this.attempt = attempt;
            this.availableAt = System.currentTimeMillis() + delayMs;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long diff = availableAt - System.currentTimeMillis();
            return unit.convert(diff, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(this.getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    private static class InFlight {
        private final Delivery delivery;
        private final long visibilityDeadline;

        InFlight(Delivery delivery, long visibilityDeadline) {
            this.delivery = delivery;
            this.visibilityDeadline = visibilityDeadline;
        }
    }

    /**
     * Dead-lettered delivery with its reason.
     */
    public static class DeadLetter {
        private final Delivery delivery;
        private final String reason;
        private final long timestamp;

        DeadLetter(Delivery delivery, String reason, long timestamp) {
            this.delivery = delivery;
            this.reason = reason;
            this.timestamp = timestamp;
        }

        public Delivery getDelivery() {
            return delivery;
        }

        public String getReason() {
            return reason;
        }

        public long getTimestamp() {
            return timestamp;
        }
    }
}
