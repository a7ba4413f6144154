package com.ryuqq.icnp.application.token;

import com.ryuqq.icnp.core.contract.AgreedAction;
import com.ryuqq.icnp.core.token.InvocationLimits;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 토큰별 호출 카운터.
 *
 * <p>전체, 실행자별, 합의 항목별 세 카운터를 compare-and-set으로 하나씩 예약하며,
 * 뒤쪽 예약이 실패하면 앞서 예약한 카운터를 되돌립니다. 따라서 거부된 요청은
 * 어떤 카운터도 소모하지 않습니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class InvocationCounters {

    private final InvocationLimits limits;
    private final AtomicInteger total = new AtomicInteger();
    private final ConcurrentHashMap<String, AtomicInteger> perActor = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> perAgreedAction = new ConcurrentHashMap<>();

    public InvocationCounters(InvocationLimits limits) {
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }
        this.limits = limits;
    }

    /**
     * 호출 1회 예약.
     *
     * @param executorId 실행자 ID
     * @param agreedAction 근거 합의 항목
     * @return 예약 결과
     */
    public Reservation tryReserve(String executorId, AgreedAction agreedAction) {
        if (executorId == null || agreedAction == null) {
            throw new IllegalArgumentException("executorId and agreedAction cannot be null");
        }
        Integer totalLimit = limits.maxInvocationsTotal();
        if (!reserve(total, totalLimit)) {
            return Reservation.denied("max_invocations_total (" + totalLimit + ") exhausted");
        }

        AtomicInteger actorCounter = perActor.computeIfAbsent(executorId, k -> new AtomicInteger());
        if (!reserve(actorCounter, limits.maxInvocationsPerActor())) {
            total.decrementAndGet();
            return Reservation.denied("max_invocations_per_actor (" + limits.maxInvocationsPerActor()
                + ") exhausted for " + executorId);
        }

        AtomicInteger actionCounter = perAgreedAction.computeIfAbsent(agreedAction.actionId(), k -> new AtomicInteger());
        if (!reserve(actionCounter, agreedAction.maxInvocations())) {
            actorCounter.decrementAndGet();
            total.decrementAndGet();
            return Reservation.denied("max_invocations (" + agreedAction.maxInvocations()
                + ") exhausted for agreed action " + agreedAction.actionId());
        }
        return Reservation.allowed();
    }

    public int totalUsed() {
        return total.get();
    }

    public int usedBy(String executorId) {
        AtomicInteger counter = perActor.get(executorId);
        return counter == null ? 0 : counter.get();
    }

    public int usedFor(String agreedActionId) {
        AtomicInteger counter = perAgreedAction.get(agreedActionId);
        return counter == null ? 0 : counter.get();
    }

    public InvocationLimits limits() {
        return limits;
    }

    private static boolean reserve(AtomicInteger counter, Integer limit) {
        while (true) {
            int current = counter.get();
            if (limit != null && current >= limit) {
                return false;
            }
            if (counter.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }
}
