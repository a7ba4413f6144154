/**
 * Intent declaration model: goal, requested actions and constraints.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.intent;
