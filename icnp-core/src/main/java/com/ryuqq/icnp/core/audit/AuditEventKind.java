package com.ryuqq.icnp.core.audit;

import java.util.Locale;

/**
 * 감사 기록 종류.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum AuditEventKind {

    SESSION_CREATED,
    INTENT_RECORDED,
    PHASE_TRANSITION,
    CAPABILITY_DISCLOSED,
    CONTRACT_PROPOSED,
    CONTRACT_COUNTERPROPOSED,
    CONTRACT_SIGNED,
    CONTRACT_ACCEPTED,
    CONTRACT_REJECTED,
    TOKEN_ISSUED,
    TOKEN_REVOKED,
    EXECUTION_STARTED,
    EXECUTION_COMPLETED,
    VIOLATION,
    ROLLBACK,
    MESSAGE_REJECTED,
    SESSION_EXPIRED;

    /**
     * 와이어 포맷 이름 (소문자 snake_case).
     *
     * @return 예: "execution_completed"
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
