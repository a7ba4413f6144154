/**
 * Governed execution: token checks, replay protection, forbidden dominance,
 * invocation limits and the contract's violation policy.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.application.enforcement;
