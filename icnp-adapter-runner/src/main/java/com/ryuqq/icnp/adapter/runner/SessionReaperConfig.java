package com.ryuqq.icnp.adapter.runner;

/**
 * SessionReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 30000ms = 30초)</li>
 *   <li>batchSize: 한 번에 만료 처리할 세션 수 (기본 50)</li>
 *   <li>retentionMs: 종료 세션 보관 기간 (기본 3600000ms = 1시간)</li>
 * </ul>
 *
 * <p>retentionMs 동안은 종료된 세션도 남아 있어 재전달된 메시지가 DUPLICATE로 판정됩니다.
 * 보관 기간은 transport의 재전달 가능 기간보다 길게 잡아야 합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param retentionMs 보관 기간 (밀리초, 0 이상이어야 함)
 */
public record SessionReaperConfig(
    long scanIntervalMs,
    int batchSize,
    long retentionMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=30000ms, batchSize=50, retentionMs=3600000ms</p>
     */
    public SessionReaperConfig() {
        this(30000, 50, 3600000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SessionReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (retentionMs < 0) {
            throw new IllegalArgumentException(
                "retentionMs cannot be negative (current: " + retentionMs + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public SessionReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new SessionReaperConfig(scanIntervalMs, batchSize, retentionMs);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public SessionReaperConfig withBatchSize(int batchSize) {
        return new SessionReaperConfig(scanIntervalMs, batchSize, retentionMs);
    }

    /**
     * retentionMs만 변경한 새 인스턴스 생성.
     */
    public SessionReaperConfig withRetentionMs(long retentionMs) {
        return new SessionReaperConfig(scanIntervalMs, batchSize, retentionMs);
    }
}
