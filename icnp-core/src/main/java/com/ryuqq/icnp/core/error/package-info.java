/**
 * ICNP error taxonomy.
 *
 * <p>{@link com.ryuqq.icnp.core.error.IcnpException} carries one of the six
 * {@link com.ryuqq.icnp.core.error.IcnpErrorCode} values together with a retryable flag
 * and the id of the message that triggered it.</p>
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.error;
