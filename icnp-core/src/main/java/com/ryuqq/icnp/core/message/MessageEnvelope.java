package com.ryuqq.icnp.core.message;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.MessageId;
import com.ryuqq.icnp.core.model.SessionId;

import java.time.Instant;

/**
 * ICNP 메시지 엔벨로프.
 *
 * <p>{@code trace}, {@code payload}, {@code extensions}는 불투명한 JSON 객체로 보관합니다.
 * 특히 extensions는 해석하지 않으며 다시 인코딩할 때 그대로 보존됩니다.
 * JSON 필드는 생성 시 복사되고 조회 시에도 복사본을 반환합니다.</p>
 *
 * @param icnpVersion 프로토콜 버전 (예: "1.0.0")
 * @param type 메시지 종류
 * @param phase 메시지 단계 (type의 단계와 일치)
 * @param messageId 메시지 ID
 * @param sessionId 세션 ID
 * @param timestamp 발신 시각
 * @param sender 발신자
 * @param recipient 수신자 (null이면 broadcast)
 * @param inReplyTo 응답 대상 메시지 ID (null 가능)
 * @param trace 추적 정보 (null 가능)
 * @param payload 본문
 * @param extensions 확장 필드 (null 가능)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record MessageEnvelope(
    String icnpVersion,
    MessageType type,
    MessagePhase phase,
    MessageId messageId,
    SessionId sessionId,
    Instant timestamp,
    Actor sender,
    Actor recipient,
    MessageId inReplyTo,
    ObjectNode trace,
    ObjectNode payload,
    ObjectNode extensions
) {

    public MessageEnvelope {
        if (icnpVersion == null || icnpVersion.isBlank()) {
            throw new IllegalArgumentException("icnpVersion cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (phase == null) {
            phase = type.phase();
        }
        if (messageId == null) {
            throw new IllegalArgumentException("messageId cannot be null");
        }
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        trace = trace == null ? null : trace.deepCopy();
        payload = payload.deepCopy();
        extensions = extensions == null ? null : extensions.deepCopy();
    }

    @Override
    public ObjectNode trace() {
        return trace == null ? null : trace.deepCopy();
    }

    @Override
    public ObjectNode payload() {
        return payload.deepCopy();
    }

    @Override
    public ObjectNode extensions() {
        return extensions == null ? null : extensions.deepCopy();
    }
}
