package com.ryuqq.icnp.core.statemachine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 세션 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INTENT → CAPABILITY</li>
 *   <li>CAPABILITY → CONTRACT</li>
 *   <li>CONTRACT → TOKEN</li>
 *   <li>TOKEN → EXECUTION</li>
 *   <li>EXECUTION → COMPLETED</li>
 *   <li>비종료 상태 → ABORTED, EXPIRED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>단계 건너뛰기, 역방향 전이 불가</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    private static final Map<SessionPhase, Set<SessionPhase>> ALLOWED = new EnumMap<>(SessionPhase.class);

    static {
        ALLOWED.put(SessionPhase.INTENT, EnumSet.of(SessionPhase.CAPABILITY, SessionPhase.ABORTED, SessionPhase.EXPIRED));
        ALLOWED.put(SessionPhase.CAPABILITY, EnumSet.of(SessionPhase.CONTRACT, SessionPhase.ABORTED, SessionPhase.EXPIRED));
        ALLOWED.put(SessionPhase.CONTRACT, EnumSet.of(SessionPhase.TOKEN, SessionPhase.ABORTED, SessionPhase.EXPIRED));
        ALLOWED.put(SessionPhase.TOKEN, EnumSet.of(SessionPhase.EXECUTION, SessionPhase.ABORTED, SessionPhase.EXPIRED));
        ALLOWED.put(SessionPhase.EXECUTION, EnumSet.of(SessionPhase.COMPLETED, SessionPhase.ABORTED, SessionPhase.EXPIRED));
        ALLOWED.put(SessionPhase.COMPLETED, EnumSet.noneOf(SessionPhase.class));
        ALLOWED.put(SessionPhase.ABORTED, EnumSet.noneOf(SessionPhase.class));
        ALLOWED.put(SessionPhase.EXPIRED, EnumSet.noneOf(SessionPhase.class));
    }

    // Utility class - prevent instantiation
    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SessionPhase from, SessionPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        if (!ALLOWED.get(from).contains(to)) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static SessionPhase transition(SessionPhase current, SessionPhase next) {
        validate(current, next);
        return next;
    }

    /**
     * 주어진 단계에서 허용되는 다음 단계 목록.
     *
     * @param from 현재 단계
     * @return 읽기 전용 단계 집합
     */
    public static Set<SessionPhase> allowedFrom(SessionPhase from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }
}
