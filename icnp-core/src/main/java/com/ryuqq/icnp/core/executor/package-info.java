/**
 * External action execution SPI.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.executor;
