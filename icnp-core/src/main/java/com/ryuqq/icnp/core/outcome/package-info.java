/**
 * Enforcement outcome types.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.outcome;
