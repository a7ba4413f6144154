/**
 * Audit record model.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.audit;
