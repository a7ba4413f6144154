/**
 * 계약 협상: 제안, 역제안, 서명, 수락, 거절과 승인 게이트.
 *
 * <p>능력 점수 계산은 {@link com.ryuqq.icnp.core.spi.CapabilityMatchScorer} 전략으로 분리되어 있으며,
 * 기본 구현은 {@link com.ryuqq.icnp.application.negotiation.ConfidenceMatchScorer}입니다.</p>
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.application.negotiation;
