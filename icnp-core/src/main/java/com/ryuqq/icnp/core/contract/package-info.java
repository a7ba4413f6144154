/**
 * Contract model and authorization rules.
 *
 * <p>{@link com.ryuqq.icnp.core.contract.EffectiveAuthorization} is the single place that
 * resolves agreed actions against forbidden actions. It is pure and side-effect free,
 * and both the negotiator and the enforcement gate call it.</p>
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.contract;
