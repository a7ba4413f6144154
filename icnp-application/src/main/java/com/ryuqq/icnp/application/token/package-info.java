/**
 * 실행 토큰 발급, 검증, 폐기와 호출 카운터.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.application.token;
