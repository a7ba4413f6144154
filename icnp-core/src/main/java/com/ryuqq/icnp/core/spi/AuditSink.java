package com.ryuqq.icnp.core.spi;

import com.ryuqq.icnp.core.audit.AuditEvent;

/**
 * Append-only persistence SPI for audit records.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Append-only: records are never updated or removed</li>
 *   <li>A sequence number is accepted at most once</li>
 *   <li>Thread-safe</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public interface AuditSink {

    /**
     * Appends an event.
     *
     * @param event event with a sequence assigned by the audit log
     * @return the stored sequence
     * @throws IllegalStateException if the sequence was already stored
     */
    long append(AuditEvent event);
}
