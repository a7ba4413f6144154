package com.ryuqq.icnp.core.error;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.model.MessageId;

import java.time.Instant;

/**
 * {@code error} 엔벨로프의 payload 본문.
 *
 * @param errorId 오류 식별자 (UUID)
 * @param code 오류 코드
 * @param message 사람이 읽을 수 있는 오류 메시지
 * @param retryable 재시도 가능 여부
 * @param relatedMessageId 원인 메시지 ID (null 가능)
 * @param timestamp 오류 발생 시각
 * @param details 추가 정보 (null 가능)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record ErrorReport(
    String errorId,
    IcnpErrorCode code,
    String message,
    boolean retryable,
    MessageId relatedMessageId,
    Instant timestamp,
    ObjectNode details
) {

    public ErrorReport {
        if (errorId == null || errorId.isBlank()) {
            throw new IllegalArgumentException("errorId cannot be null or blank");
        }
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (message == null) {
            message = code.wireName();
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        details = details == null ? null : details.deepCopy();
    }
}
