package com.ryuqq.icnp.core.intent;

import com.ryuqq.icnp.core.audit.AuditLevel;

/**
 * 의도 제약 조건.
 *
 * <p>계약 제안은 이 제약과 양립해야 합니다. 예를 들어
 * {@code externalSideEffectsAllowed == false}이면 부수 효과가 있는 능력은 선택할 수 없고,
 * {@code riskTolerance == NONE}이면 strict 집행만 허용됩니다.</p>
 *
 * @param riskTolerance 위험 허용 수준
 * @param humanApprovalRequired 사람의 승인 필요 여부
 * @param dataPolicy 데이터 정책
 * @param externalSideEffectsAllowed 외부 부수 효과 허용 여부
 * @param auditLevel 감사 수준
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record IntentConstraints(
    RiskTolerance riskTolerance,
    boolean humanApprovalRequired,
    DataPolicy dataPolicy,
    boolean externalSideEffectsAllowed,
    AuditLevel auditLevel
) {

    public IntentConstraints {
        if (riskTolerance == null) {
            throw new IllegalArgumentException("riskTolerance cannot be null");
        }
        if (dataPolicy == null) {
            dataPolicy = DataPolicy.none();
        }
        if (auditLevel == null) {
            auditLevel = AuditLevel.STANDARD;
        }
    }

    /**
     * constraints가 생략된 의도에 적용하는 기본값.
     *
     * <p>LOW 위험, 승인 불필요, 외부 부수 효과 금지, STANDARD 감사.</p>
     *
     * @return 기본 제약
     */
    public static IntentConstraints defaults() {
        return new IntentConstraints(RiskTolerance.LOW, false, DataPolicy.none(), false, AuditLevel.STANDARD);
    }
}
