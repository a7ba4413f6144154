package com.ryuqq.icnp.core.contract;

/**
 * 계약에서 합의된 행위.
 *
 * @param actionId 합의 항목 식별자
 * @param capabilityId 근거가 되는 능력 식별자
 * @param executorId 실행 참여자 식별자
 * @param action 행위 이름
 * @param scope 범위 (null이면 범위 제한 없음)
 * @param maxInvocations 이 항목의 최대 호출 횟수 (null이면 무제한)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record AgreedAction(
    String actionId,
    String capabilityId,
    String executorId,
    String action,
    String scope,
    Integer maxInvocations
) {

    public AgreedAction {
        if (actionId == null || actionId.isBlank()) {
            throw new IllegalArgumentException("actionId cannot be null or blank");
        }
        if (capabilityId == null || capabilityId.isBlank()) {
            throw new IllegalArgumentException("capabilityId cannot be null or blank");
        }
        if (executorId == null || executorId.isBlank()) {
            throw new IllegalArgumentException("executorId cannot be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        if (maxInvocations != null && maxInvocations <= 0) {
            throw new IllegalArgumentException("maxInvocations must be positive (current: " + maxInvocations + ")");
        }
    }
}
