/**
 * Execution token model: validity window, invocation limits and binding hashes.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.token;
