/**
 * In-memory token revocation list.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.adapter.inmemory.token;
