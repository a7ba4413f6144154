package com.ryuqq.icnp.core.statemachine;

/**
 * Invocation 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>RECEIVED → VALIDATED, DENIED</li>
 *   <li>VALIDATED → EXECUTING, DENIED</li>
 *   <li>EXECUTING → COMPLETED</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class InvocationTransition {

    private InvocationTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(InvocationState from, InvocationState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case RECEIVED -> to == InvocationState.VALIDATED || to == InvocationState.DENIED;
            case VALIDATED -> to == InvocationState.EXECUTING || to == InvocationState.DENIED;
            case EXECUTING -> to == InvocationState.COMPLETED;
            case COMPLETED, DENIED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static InvocationState transition(InvocationState current, InvocationState next) {
        validate(current, next);
        return next;
    }
}
