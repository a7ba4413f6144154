package com.ryuqq.icnp.adapter.runner;

/**
 * TransportWorkerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: 한 번에 receive할 delivery 수 (기본 10)</li>
 *   <li>lanes: 세션별 직렬 처리 레인 수 (기본 4)</li>
 *   <li>maxDeliveryAttempts: DLQ로 보내기 전 최대 시도 횟수 (기본 3)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 진행 중 작업 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p>같은 session_id의 delivery는 항상 같은 레인에서 순서대로 처리됩니다.
 * 레인 수를 늘리면 서로 다른 세션 간 병렬성이 커집니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param lanes 레인 수 (1 이상이어야 함)
 * @param maxDeliveryAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record TransportWorkerConfig(
    int batchSize,
    int lanes,
    int maxDeliveryAttempts,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchSize=10, lanes=4, maxDeliveryAttempts=3, shutdownTimeoutMs=60000ms</p>
     */
    public TransportWorkerConfig() {
        this(10, 4, 3, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TransportWorkerConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (lanes <= 0) {
            throw new IllegalArgumentException(
                "lanes must be positive (current: " + lanes + ")"
            );
        }
        if (maxDeliveryAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxDeliveryAttempts must be positive (current: " + maxDeliveryAttempts + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public TransportWorkerConfig withBatchSize(int batchSize) {
        return new TransportWorkerConfig(batchSize, lanes, maxDeliveryAttempts, shutdownTimeoutMs);
    }

    public TransportWorkerConfig withLanes(int lanes) {
        return new TransportWorkerConfig(batchSize, lanes, maxDeliveryAttempts, shutdownTimeoutMs);
    }

    public TransportWorkerConfig withMaxDeliveryAttempts(int maxDeliveryAttempts) {
        return new TransportWorkerConfig(batchSize, lanes, maxDeliveryAttempts, shutdownTimeoutMs);
    }

    public TransportWorkerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new TransportWorkerConfig(batchSize, lanes, maxDeliveryAttempts, shutdownTimeoutMs);
    }
}
