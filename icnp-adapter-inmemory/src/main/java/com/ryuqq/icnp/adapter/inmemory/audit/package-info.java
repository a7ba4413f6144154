/**
 * In-memory audit record sink.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.adapter.inmemory.audit;
