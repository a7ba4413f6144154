/**
 * Collaborator protection: per-collaborator call timeouts.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.protection;
