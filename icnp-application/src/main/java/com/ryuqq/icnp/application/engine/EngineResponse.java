package com.ryuqq.icnp.application.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.error.IcnpErrorCode;

import java.util.List;

/**
 * 인바운드 엔벨로프 하나의 처리 결과.
 *
 * <p><strong>세 가지 상태:</strong></p>
 * <ul>
 *   <li>PROCESSED: 정상 처리, outbound는 송신할 엔벨로프 (없을 수 있음)</li>
 *   <li>DUPLICATE: 이미 처리한 message_id, outbound 없음</li>
 *   <li>REJECTED: 거절, errorCode와 error 엔벨로프 하나</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class EngineResponse {

    public enum Status {
        PROCESSED,
        DUPLICATE,
        REJECTED
    }

    private static final EngineResponse DUPLICATE = new EngineResponse(Status.DUPLICATE, List.of(), null);

    private final Status status;
    private final List<ObjectNode> outbound;
    private final IcnpErrorCode errorCodeOrNull;

    private EngineResponse(Status status, List<ObjectNode> outbound, IcnpErrorCode errorCodeOrNull) {
        this.status = status;
        this.outbound = outbound.stream().map(ObjectNode::deepCopy).toList();
        this.errorCodeOrNull = errorCodeOrNull;
    }

    /**
     * 정상 처리 결과.
     *
     * @param outbound 송신할 엔벨로프 목록
     * @return PROCESSED
     */
    public static EngineResponse processed(List<ObjectNode> outbound) {
        if (outbound == null) {
            throw new IllegalArgumentException("outbound cannot be null");
        }
        return new EngineResponse(Status.PROCESSED, outbound, null);
    }

    public static EngineResponse duplicate() {
        return DUPLICATE;
    }

    /**
     * 거절 결과.
     *
     * @param code 오류 코드
     * @param errorEnvelope error 엔벨로프
     * @return REJECTED
     */
    public static EngineResponse rejected(IcnpErrorCode code, ObjectNode errorEnvelope) {
        if (code == null || errorEnvelope == null) {
            throw new IllegalArgumentException("code and errorEnvelope cannot be null for rejected response");
        }
        return new EngineResponse(Status.REJECTED, List.of(errorEnvelope), code);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isProcessed() {
        return status == Status.PROCESSED;
    }

    public boolean isDuplicate() {
        return status == Status.DUPLICATE;
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    /**
     * 송신할 엔벨로프 (복사본).
     *
     * @return 엔벨로프 목록
     */
    public List<ObjectNode> getOutbound() {
        return outbound.stream().map(ObjectNode::deepCopy).toList();
    }

    /**
     * 거절 코드 조회.
     *
     * <p><strong>주의:</strong> REJECTED인 경우에만 non-null 반환</p>
     *
     * @return 오류 코드 또는 null
     */
    public IcnpErrorCode getErrorCodeOrNull() {
        return errorCodeOrNull;
    }

    @Override
    public String toString() {
        if (status == Status.REJECTED) {
            return "EngineResponse{status=REJECTED, code=" + errorCodeOrNull.code() + "}";
        }
        return "EngineResponse{status=" + status + ", outbound=" + outbound.size() + "}";
    }
}
