package com.ryuqq.icnp.core.contract;

import com.ryuqq.icnp.core.audit.AuditLevel;

/**
 * 계약의 집행 정책.
 *
 * @param mode 집행 모드
 * @param violationAction 위반 시 조치
 * @param auditLevel 감사 수준
 * @param loggingRequired 실행 기록 필수 여부
 * @param rollbackRequired 위반 시 롤백 필수 여부 (ABORT_AND_ROLLBACK 필요)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Enforcement(
    EnforcementMode mode,
    ViolationAction violationAction,
    AuditLevel auditLevel,
    boolean loggingRequired,
    boolean rollbackRequired
) {

    public Enforcement {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (violationAction == null) {
            throw new IllegalArgumentException("violationAction cannot be null");
        }
        if (auditLevel == null) {
            auditLevel = AuditLevel.STANDARD;
        }
    }

    /**
     * 기본 정책: STRICT, ABORT, STANDARD, 기록 필수, 롤백 불필요.
     *
     * @return 기본 Enforcement
     */
    public static Enforcement strictDefault() {
        return new Enforcement(EnforcementMode.STRICT, ViolationAction.ABORT, AuditLevel.STANDARD, true, false);
    }

    /**
     * 위반 시 롤백을 수행해야 하는지 확인.
     *
     * @return STRICT 모드이면서 ABORT_AND_ROLLBACK이면 true
     */
    public boolean rollsBackOnViolation() {
        return mode == EnforcementMode.STRICT && violationAction == ViolationAction.ABORT_AND_ROLLBACK;
    }
}
