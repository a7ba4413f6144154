package com.ryuqq.icnp.core.outcome;

import com.ryuqq.icnp.core.error.IcnpErrorCode;

/**
 * strict 집행에 의한 거부.
 *
 * @param invocationId 호출 식별자
 * @param code 오류 코드 (unauthorised_action 또는 token_invalid)
 * @param reason 거부 사유
 * @param rolledBack 롤백 수행 여부
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Denied(
    String invocationId,
    IcnpErrorCode code,
    String reason,
    boolean rolledBack
) implements ExecutionOutcome {

    public Denied {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
