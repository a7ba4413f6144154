package com.ryuqq.icnp.core.execution;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * 실행 결과.
 *
 * @param invocationId 호출 식별자
 * @param tokenId 토큰 ID
 * @param contractId 계약 ID
 * @param status 결과 상태
 * @param startedAt 시작 시각
 * @param endedAt 종료 시각
 * @param output 산출물 JSON
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record ExecutionResult(
    String invocationId,
    String tokenId,
    String contractId,
    ExecutionStatus status,
    Instant startedAt,
    Instant endedAt,
    ObjectNode output
) {

    public ExecutionResult {
        if (invocationId == null || invocationId.isBlank()) {
            throw new IllegalArgumentException("invocationId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (startedAt == null || endedAt == null) {
            throw new IllegalArgumentException("startedAt and endedAt cannot be null");
        }
        output = output == null ? JsonNodeFactory.instance.objectNode() : output.deepCopy();
    }

    @Override
    public ObjectNode output() {
        return output.deepCopy();
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
