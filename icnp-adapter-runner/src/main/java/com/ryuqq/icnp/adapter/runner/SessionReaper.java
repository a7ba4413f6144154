package com.ryuqq.icnp.adapter.runner;

import com.ryuqq.icnp.application.engine.NegotiationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 세션 Reaper 컴포넌트.
 *
 * <p>기한이 지난 세션을 EXPIRED로 전이하고, 보관 기간이 지난 종료 세션을 저장소에서 제거합니다.</p>
 *
 * <p><strong>스캔 흐름:</strong></p>
 * <pre>
 * 1. engine.expireOverdue(batchSize) → 만료 처리 수
 *    (만료 시 SESSION_EXPIRED 감사 이벤트, 발급된 토큰은 세션 단계 검사로 무효)
 * 2. engine.evictTerminal(retention) → 제거 수
 * 3. 결과 로깅
 * </pre>
 *
 * <p>한 단계가 실패해도 다음 단계는 진행합니다. 실패는 ERROR 로그로 남고 다음 스캔에서 다시 시도됩니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class SessionReaper {

    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);

    private final NegotiationEngine engine;
    private final SessionReaperConfig config;
    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param engine 협상 엔진
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SessionReaper(NegotiationEngine engine, SessionReaperConfig config) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.engine = engine;
        this.config = config;
    }

    /**
     * 1회 스캔.
     *
     * @return 스캔 결과
     */
    public ScanResult scan() {
        int expired = 0;
        try {
            expired = engine.expireOverdue(config.batchSize());
        } catch (RuntimeException e) {
            log.error("Failed to expire overdue sessions in reaper scan", e);
        }

        int evicted = 0;
        try {
            evicted = engine.evictTerminal(Duration.ofMillis(config.retentionMs()));
        } catch (RuntimeException e) {
            log.error("Failed to evict terminal sessions in reaper scan", e);
        }

        if (expired > 0 || evicted > 0) {
            log.info("Session reaper scan completed: {} expired, {} evicted", expired, evicted);
        } else {
            log.debug("Session reaper scan completed: nothing to reap");
        }
        return new ScanResult(expired, evicted);
    }

    /**
     * scanIntervalMs 주기로 스캔을 시작합니다.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("SessionReaper already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "icnp-session-reaper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::scan, config.scanIntervalMs(), config.scanIntervalMs(),
            TimeUnit.MILLISECONDS);
    }

    /**
     * 주기 스캔 중지.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public synchronized void stop() throws InterruptedException {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        if (!scheduler.awaitTermination(config.scanIntervalMs(), TimeUnit.MILLISECONDS)) {
            scheduler.shutdownNow();
        }
        scheduler = null;
    }

    /**
     * 스캔 결과.
     *
     * @param expired EXPIRED로 전이한 세션 수
     * @param evicted 제거한 종료 세션 수
     */
    public record ScanResult(int expired, int evicted) {
    }
}
