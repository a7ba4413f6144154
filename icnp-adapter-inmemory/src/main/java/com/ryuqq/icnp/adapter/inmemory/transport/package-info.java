/**
 * In-memory message transport.
 *
 * <p>{@link com.ryuqq.icnp.adapter.inmemory.transport.InMemoryTransport} simulates an
 * at-least-once queue with visibility timeouts, a dead-letter queue and an outbox.</p>
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.adapter.inmemory.transport;
