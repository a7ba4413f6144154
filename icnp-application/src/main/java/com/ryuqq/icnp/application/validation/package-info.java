/**
 * Inbound envelope validation: structure, supported version, duplicates and causality.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.application.validation;
