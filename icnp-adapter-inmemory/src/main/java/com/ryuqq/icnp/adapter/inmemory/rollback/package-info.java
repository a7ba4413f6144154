/**
 * Rollback journal used where no external state needs undoing.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.adapter.inmemory.rollback;
