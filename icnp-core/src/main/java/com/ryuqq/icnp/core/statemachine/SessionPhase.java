package com.ryuqq.icnp.core.statemachine;

/**
 * 협상 세션의 단계.
 *
 * <p><strong>진행 흐름:</strong></p>
 * <pre>
 * INTENT → CAPABILITY → CONTRACT → TOKEN → EXECUTION → COMPLETED
 *    └──────────┴───────────┴────────┴──────────┴──→ ABORTED | EXPIRED
 * </pre>
 *
 * <p>종료 상태(COMPLETED, ABORTED, EXPIRED)에서는 더 이상 전이할 수 없습니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum SessionPhase {

    /** 의도 선언 대기/기록 단계. */
    INTENT("intent"),

    /** 능력 공개 단계. */
    CAPABILITY("capability"),

    /** 계약 제안/서명 단계. */
    CONTRACT("contract"),

    /** 실행 토큰 발급 완료, 첫 실행 요청 대기. */
    TOKEN("token"),

    /** 통제된 실행 단계. */
    EXECUTION("execution"),

    /** 정상 종료. */
    COMPLETED("completed"),

    /** 거절 또는 명시적 중단. */
    ABORTED("aborted"),

    /** 협상 TTL 또는 토큰 유효기간 경과. */
    EXPIRED("expired");

    private final String wireName;

    SessionPhase(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 종료 상태 여부 확인.
     *
     * @return COMPLETED, ABORTED, EXPIRED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == EXPIRED;
    }
}
