package com.ryuqq.icnp.core.token;

/**
 * 토큰 호출 한도.
 *
 * @param maxInvocationsTotal 전체 최대 호출 수 (null이면 무제한)
 * @param maxInvocationsPerActor 실행자별 최대 호출 수 (1 이상)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record InvocationLimits(Integer maxInvocationsTotal, int maxInvocationsPerActor) {

    public InvocationLimits {
        if (maxInvocationsTotal != null && maxInvocationsTotal <= 0) {
            throw new IllegalArgumentException(
                "maxInvocationsTotal must be positive (current: " + maxInvocationsTotal + ")");
        }
        if (maxInvocationsPerActor <= 0) {
            throw new IllegalArgumentException(
                "maxInvocationsPerActor must be positive (current: " + maxInvocationsPerActor + ")");
        }
    }
}
