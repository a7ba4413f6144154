package com.ryuqq.icnp.core.spi;

/**
 * Result of a rollback request.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum RollbackStatus {
    OK,
    ERROR
}
