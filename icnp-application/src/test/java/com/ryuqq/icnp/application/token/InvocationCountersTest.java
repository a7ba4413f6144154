package com.ryuqq.icnp.application.token;

import com.ryuqq.icnp.core.contract.AgreedAction;
import com.ryuqq.icnp.core.token.InvocationLimits;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InvocationCountersTest {

    private static final AgreedAction SUMMARIZE =
        new AgreedAction("aa-1", "cap-1", "agent-a", "summarize", null, null);
    private static final AgreedAction PUBLISH_ONCE =
        new AgreedAction("aa-2", "cap-2", "agent-a", "publish", null, 1);

    // ========== 실행자별 한도 ==========

    @Test
    void 실행자별_한도_N이면_N번은_허용되고_N_plus_1번째는_거부된다() {
        // Given
        InvocationCounters counters = new InvocationCounters(new InvocationLimits(null, 3));

        // When
        for (int i = 0; i < 3; i++) {
            assertTrue(counters.tryReserve("agent-a", SUMMARIZE).granted());
        }
        Reservation fourth = counters.tryReserve("agent-a", SUMMARIZE);

        // Then
        assertFalse(fourth.granted());
        assertEquals("max_invocations_per_actor (3) exhausted for agent-a", fourth.reason());
        assertEquals(3, counters.usedBy("agent-a"));
        assertEquals(3, counters.totalUsed());
    }

    @Test
    void 실행자별_한도는_실행자마다_따로_센다() {
        // Given
        InvocationCounters counters = new InvocationCounters(new InvocationLimits(null, 1));

        // When & Then
        assertTrue(counters.tryReserve("agent-a", SUMMARIZE).granted());
        assertTrue(counters.tryReserve("agent-b", SUMMARIZE).granted());
        assertFalse(counters.tryReserve("agent-a", SUMMARIZE).granted());
    }

    // ========== 전체 한도 ==========

    @Test
    void 전체_한도에_걸리면_실행자_카운터는_변하지_않는다() {
        // Given
        InvocationCounters counters = new InvocationCounters(new InvocationLimits(2, 5));
        counters.tryReserve("agent-a", SUMMARIZE);
        counters.tryReserve("agent-b", SUMMARIZE);

        // When
        Reservation third = counters.tryReserve("agent-a", SUMMARIZE);

        // Then
        assertFalse(third.granted());
        assertEquals("max_invocations_total (2) exhausted", third.reason());
        assertEquals(1, counters.usedBy("agent-a"));
        assertEquals(2, counters.totalUsed());
    }

    // ========== 합의 행위별 한도 ==========

    @Test
    void 합의_행위_한도에_걸리면_앞서_잡은_예약을_되돌린다() {
        // Given
        InvocationCounters counters = new InvocationCounters(new InvocationLimits(10, 10));
        assertTrue(counters.tryReserve("agent-a", PUBLISH_ONCE).granted());

        // When
        Reservation second = counters.tryReserve("agent-a", PUBLISH_ONCE);

        // Then
        assertFalse(second.granted());
        assertEquals("max_invocations (1) exhausted for agreed action aa-2", second.reason());
        assertEquals(1, counters.totalUsed());
        assertEquals(1, counters.usedBy("agent-a"));
        assertEquals(1, counters.usedFor("aa-2"));
    }

    // ========== 동시성 ==========

    @Test
    void 동시에_예약해도_한도를_넘지_않는다() throws InterruptedException {
        // Given
        InvocationCounters counters = new InvocationCounters(new InvocationLimits(null, 5));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();

        // When
        for (int i = 0; i < 50; i++) {
            pool.submit(() -> {
                start.await();
                if (counters.tryReserve("agent-a", SUMMARIZE).granted()) {
                    granted.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        // Then
        assertEquals(5, granted.get());
        assertEquals(5, counters.usedBy("agent-a"));
    }

    @Test
    void limits가_null이면_예외() {
        assertThrows(IllegalArgumentException.class, () -> new InvocationCounters(null));
    }
}
