package com.ryuqq.icnp.core.protection;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 협력자별 고정 타임아웃 정책.
 *
 * <p>지정하지 않은 협력자에는 기본 타임아웃을 적용하며, 발생한 타임아웃 횟수를
 * 협력자별로 집계합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class FixedCollaboratorTimeoutPolicy implements CollaboratorTimeoutPolicy {

    private final long defaultTimeoutMs;
    private final Map<Collaborator, Long> overrides;
    private final Map<Collaborator, AtomicLong> timeoutCounts = new EnumMap<>(Collaborator.class);

    /**
     * 모든 협력자에 같은 타임아웃 적용.
     *
     * @param defaultTimeoutMs 타임아웃 (밀리초, 0이면 직접 실행)
     * @throws IllegalArgumentException 음수인 경우
     */
    public FixedCollaboratorTimeoutPolicy(long defaultTimeoutMs) {
        this(defaultTimeoutMs, Map.of());
    }

    /**
     * 협력자별 타임아웃 지정.
     *
     * @param defaultTimeoutMs 기본 타임아웃 (밀리초)
     * @param overrides 협력자별 타임아웃 (밀리초)
     * @throws IllegalArgumentException 음수 타임아웃이 있는 경우
     */
    public FixedCollaboratorTimeoutPolicy(long defaultTimeoutMs, Map<Collaborator, Long> overrides) {
        if (defaultTimeoutMs < 0) {
            throw new IllegalArgumentException("defaultTimeoutMs cannot be negative (current: " + defaultTimeoutMs + ")");
        }
        if (overrides == null) {
            throw new IllegalArgumentException("overrides cannot be null");
        }
        overrides.forEach((collaborator, timeout) -> {
            if (timeout == null || timeout < 0) {
                throw new IllegalArgumentException("timeout for " + collaborator + " cannot be negative (current: " + timeout + ")");
            }
        });
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.overrides = overrides.isEmpty() ? Map.of() : new EnumMap<>(overrides);
        for (Collaborator collaborator : Collaborator.values()) {
            timeoutCounts.put(collaborator, new AtomicLong());
        }
    }

    /**
     * 타임아웃 없이 모든 호출을 직접 실행하는 정책.
     *
     * @return 타임아웃 0 정책
     */
    public static FixedCollaboratorTimeoutPolicy inline() {
        return new FixedCollaboratorTimeoutPolicy(0);
    }

    @Override
    public long timeoutMs(Collaborator collaborator) {
        return overrides.getOrDefault(collaborator, defaultTimeoutMs);
    }

    @Override
    public void recordTimeout(Collaborator collaborator, long elapsedMs) {
        timeoutCounts.get(collaborator).incrementAndGet();
    }

    /**
     * 협력자별 누적 타임아웃 횟수.
     *
     * @param collaborator 협력자 종류
     * @return 타임아웃 횟수
     */
    public long timeoutCount(Collaborator collaborator) {
        return timeoutCounts.get(collaborator).get();
    }
}
