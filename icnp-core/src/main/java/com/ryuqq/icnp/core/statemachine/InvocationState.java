package com.ryuqq.icnp.core.statemachine;

/**
 * 실행 요청(invocation) 한 건의 처리 상태.
 *
 * <pre>
 * RECEIVED → VALIDATED → EXECUTING → COMPLETED
 *     └──────────┴──→ DENIED
 * </pre>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum InvocationState {

    RECEIVED,
    VALIDATED,
    EXECUTING,
    COMPLETED,
    DENIED;

    public boolean isTerminal() {
        return this == COMPLETED || this == DENIED;
    }
}
