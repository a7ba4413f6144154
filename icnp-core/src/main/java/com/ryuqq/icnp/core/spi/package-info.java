/**
 * Service Provider Interfaces for the collaborators the engine depends on.
 *
 * <ul>
 *   <li>{@link com.ryuqq.icnp.core.spi.Signer} - contract and token signatures</li>
 *   <li>{@link com.ryuqq.icnp.core.spi.Canonicalizer} - canonical JSON bytes for hashing and signing</li>
 *   <li>{@link com.ryuqq.icnp.core.spi.AuditSink} - append-only audit storage</li>
 *   <li>{@link com.ryuqq.icnp.core.spi.CapabilityMatchScorer} - capability ranking strategy</li>
 *   <li>{@link com.ryuqq.icnp.core.spi.TokenRevocationList} - token revocation</li>
 *   <li>{@link com.ryuqq.icnp.core.spi.RollbackExecutor} - rollback of denied invocations</li>
 *   <li>{@link com.ryuqq.icnp.core.spi.Transport} - at-least-once envelope transport</li>
 * </ul>
 *
 * <p>Default implementations live in the {@code icnp-adapter-inmemory} and
 * {@code icnp-adapter-crypto} modules.</p>
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.spi;
