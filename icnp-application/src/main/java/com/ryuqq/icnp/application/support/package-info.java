/**
 * Shared infrastructure for application services.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.application.support;
