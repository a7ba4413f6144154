/**
 * 감사 기록.
 *
 * <p>모든 단계 전이와 실행 결과는 {@link com.ryuqq.icnp.application.audit.AuditLog}를 거쳐
 * {@link com.ryuqq.icnp.core.spi.AuditSink}에 기록됩니다.</p>
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.application.audit;
