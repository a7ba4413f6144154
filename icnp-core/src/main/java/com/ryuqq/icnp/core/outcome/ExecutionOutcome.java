package com.ryuqq.icnp.core.outcome;

/**
 * Enforcement Gate의 판정 결과.
 *
 * <ul>
 *   <li>{@link Executed}: 행위가 실행됨 (permissive/audit_only 위반 포함)</li>
 *   <li>{@link Denied}: strict 모드에서 거부됨</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public sealed interface ExecutionOutcome permits Executed, Denied {

    /**
     * 실행 여부 확인.
     *
     * @return 실행되었으면 true
     */
    default boolean isExecuted() {
        return this instanceof Executed;
    }

    /**
     * 거부 여부 확인.
     *
     * @return 거부되었으면 true
     */
    default boolean isDenied() {
        return this instanceof Denied;
    }
}
