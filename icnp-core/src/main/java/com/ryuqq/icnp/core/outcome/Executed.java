package com.ryuqq.icnp.core.outcome;

import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.execution.ExecutionResult;

/**
 * 실행 완료.
 *
 * <p>permissive 또는 audit_only 모드에서 위반이 있었지만 실행된 경우
 * violationCode와 violationReason이 설정됩니다.</p>
 *
 * @param result 실행 결과
 * @param violationCode 기록된 위반 코드 (위반 없으면 null)
 * @param violationReason 위반 사유 (위반 없으면 null)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Executed(
    ExecutionResult result,
    IcnpErrorCode violationCode,
    String violationReason
) implements ExecutionOutcome {

    public Executed {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }

    public static Executed clean(ExecutionResult result) {
        return new Executed(result, null, null);
    }

    public boolean hadViolation() {
        return violationCode != null;
    }
}
