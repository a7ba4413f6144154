package com.ryuqq.icnp.core.execution;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.model.Actor;

import java.time.Instant;

/**
 * 통제된 실행 요청.
 *
 * @param invocationId 호출 식별자 (재전송 방지 키)
 * @param tokenId 사용 토큰 ID
 * @param contractId 대상 계약 ID
 * @param action 행위 이름
 * @param scope 범위 (null 가능)
 * @param executor 실행자
 * @param requestedAt 요청 시각 (null 가능)
 * @param nonce 일회용 값 (null 가능)
 * @param parameters 실행 파라미터
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record ExecutionRequest(
    String invocationId,
    String tokenId,
    String contractId,
    String action,
    String scope,
    Actor executor,
    Instant requestedAt,
    String nonce,
    ObjectNode parameters
) {

    public ExecutionRequest {
        if (invocationId == null || invocationId.isBlank()) {
            throw new IllegalArgumentException("invocationId cannot be null or blank");
        }
        if (tokenId == null || tokenId.isBlank()) {
            throw new IllegalArgumentException("tokenId cannot be null or blank");
        }
        if (contractId == null || contractId.isBlank()) {
            throw new IllegalArgumentException("contractId cannot be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        parameters = parameters == null ? JsonNodeFactory.instance.objectNode() : parameters.deepCopy();
    }

    @Override
    public ObjectNode parameters() {
        return parameters.deepCopy();
    }
}
