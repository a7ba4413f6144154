package com.ryuqq.icnp.core.spi;

/**
 * Rollback SPI invoked when a strict contract with {@code abort_and_rollback}
 * denies an invocation.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public interface RollbackExecutor {

    /**
     * Rolls back whatever the invocation may have started.
     *
     * @param invocationId the denied invocation
     * @return {@link RollbackStatus#OK} or {@link RollbackStatus#ERROR}
     */
    RollbackStatus rollback(String invocationId);
}
