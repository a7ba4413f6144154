/**
 * 의도 기록 (세션당 한 번, 이후 불변).
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.application.intent;
