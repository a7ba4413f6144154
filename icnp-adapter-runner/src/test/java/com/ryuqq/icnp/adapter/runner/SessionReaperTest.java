package com.ryuqq.icnp.adapter.runner;

import com.ryuqq.icnp.application.engine.NegotiationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SessionReaper 유닛 테스트.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SessionReaperTest {

    @Mock
    private NegotiationEngine engine;

    private SessionReaper reaper;

    @BeforeEach
    void setUp() {
        reaper = new SessionReaper(engine, new SessionReaperConfig());
    }

    // ============================================================
    // 1. 스캔
    // ============================================================

    @Test
    void scan_설정한_배치_크기와_보관_기간으로_엔진을_호출한다() {
        // given
        when(engine.expireOverdue(50)).thenReturn(2);
        when(engine.evictTerminal(Duration.ofHours(1))).thenReturn(5);

        // when
        SessionReaper.ScanResult result = reaper.scan();

        // then
        assertThat(result.expired()).isEqualTo(2);
        assertThat(result.evicted()).isEqualTo(5);
    }

    @Test
    void scan_만료_처리가_실패해도_정리는_진행한다() {
        // given
        when(engine.expireOverdue(anyInt())).thenThrow(new IllegalStateException("store unavailable"));
        when(engine.evictTerminal(any())).thenReturn(3);

        // when
        SessionReaper.ScanResult result = reaper.scan();

        // then
        assertThat(result.expired()).isZero();
        assertThat(result.evicted()).isEqualTo(3);
    }

    @Test
    void scan_정리가_실패해도_만료_결과는_반환한다() {
        // given
        when(engine.expireOverdue(anyInt())).thenReturn(1);
        when(engine.evictTerminal(any())).thenThrow(new IllegalStateException("boom"));

        // when
        SessionReaper.ScanResult result = reaper.scan();

        // then
        assertThat(result.expired()).isEqualTo(1);
        assertThat(result.evicted()).isZero();
    }

    @Test
    void scan_보관_기간_0이면_즉시_정리_대상으로_전달한다() {
        // given
        reaper = new SessionReaper(engine, new SessionReaperConfig().withRetentionMs(0).withBatchSize(7));
        when(engine.expireOverdue(7)).thenReturn(0);
        when(engine.evictTerminal(Duration.ZERO)).thenReturn(0);

        // when
        SessionReaper.ScanResult result = reaper.scan();

        // then
        assertThat(result).isEqualTo(new SessionReaper.ScanResult(0, 0));
    }

    // ============================================================
    // 2. 주기 실행
    // ============================================================

    @Test
    void start_주기적으로_스캔한다() throws InterruptedException {
        // given
        reaper = new SessionReaper(engine, new SessionReaperConfig().withScanIntervalMs(10));

        // when
        reaper.start();

        // then
        try {
            verify(engine, timeout(2000).atLeast(2)).expireOverdue(50);
            verify(engine, atLeastOnce()).evictTerminal(Duration.ofHours(1));
        } finally {
            reaper.stop();
        }
    }

    @Test
    void start_두_번_호출하면_예외() throws InterruptedException {
        reaper = new SessionReaper(engine, new SessionReaperConfig().withScanIntervalMs(60000));
        reaper.start();
        try {
            assertThatThrownBy(() -> reaper.start())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already started");
        } finally {
            reaper.stop();
        }
    }

    @Test
    void stop_시작하지_않았으면_아무것도_하지_않는다() throws InterruptedException {
        reaper.stop();
    }

    // ============================================================
    // 3. 설정 검증
    // ============================================================

    @Test
    void 생성자_null_의존성이면_예외() {
        assertThatThrownBy(() -> new SessionReaper(null, new SessionReaperConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("engine cannot be null");
        assertThatThrownBy(() -> new SessionReaper(engine, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }

    @Test
    void config_음수_보관_기간이면_예외() {
        assertThatThrownBy(() -> new SessionReaperConfig().withRetentionMs(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retentionMs cannot be negative");
    }
}
