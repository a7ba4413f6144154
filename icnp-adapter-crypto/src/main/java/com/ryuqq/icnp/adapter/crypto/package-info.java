/**
 * Reference crypto adapters: HMAC-SHA256 {@link com.ryuqq.icnp.core.spi.Signer} and
 * sorted-key canonical JSON {@link com.ryuqq.icnp.core.spi.Canonicalizer}.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.adapter.crypto;
