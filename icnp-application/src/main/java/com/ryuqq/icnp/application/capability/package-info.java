/**
 * Append-only, participant-scoped capability ledger.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.application.capability;
