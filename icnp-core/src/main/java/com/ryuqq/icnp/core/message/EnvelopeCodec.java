package com.ryuqq.icnp.core.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.CanonicalUuid;
import com.ryuqq.icnp.core.model.MessageId;
import com.ryuqq.icnp.core.model.SessionId;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * 엔벨로프 JSON ↔ {@link MessageEnvelope} 변환.
 *
 * <p><strong>decode 검증 항목:</strong></p>
 * <ul>
 *   <li>필수 필드 존재 및 타입 (icnp_version, type, phase, message_id, session_id, timestamp, sender, payload)</li>
 *   <li>message_id, session_id, in_reply_to는 정규 UUID</li>
 *   <li>timestamp는 RFC 3339</li>
 *   <li>sender.role은 알려진 역할</li>
 *   <li>type은 알려진 메시지 종류이며 phase가 type의 단계와 일치</li>
 * </ul>
 *
 * <p>검증 실패는 모두 {@link IcnpErrorCode#INVALID_INTENT}로 보고됩니다.
 * 프로토콜 버전의 지원 여부는 EnvelopeValidator가 판단합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class EnvelopeCodec {

    private static final Pattern VERSION = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    private EnvelopeCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 원시 JSON을 엔벨로프로 변환.
     *
     * @param raw 엔벨로프 JSON
     * @return 검증된 엔벨로프
     * @throws IcnpException 구조 검증 실패 (invalid_intent)
     */
    public static MessageEnvelope decode(ObjectNode raw) {
        if (raw == null) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT, "envelope cannot be null");
        }
        MessageId relatedId = peekMessageId(raw);
        try {
            String version = JsonFields.requireText(raw, "icnp_version");
            if (!VERSION.matcher(version).matches()) {
                throw new IllegalArgumentException("field 'icnp_version' must be MAJOR.MINOR.PATCH: " + version);
            }

            String typeName = JsonFields.requireText(raw, "type");
            MessageType type = MessageType.fromWire(typeName)
                .orElseThrow(() -> new IllegalArgumentException("unknown message type: " + typeName));

            String phaseName = JsonFields.requireText(raw, "phase");
            MessagePhase phase = MessagePhase.fromWire(phaseName)
                .orElseThrow(() -> new IllegalArgumentException("unknown phase: " + phaseName));
            if (phase != type.phase()) {
                throw new IllegalArgumentException(
                    "phase '" + phaseName + "' does not match type '" + typeName + "' (expected '" + type.phase().wireName() + "')");
            }

            MessageId messageId = MessageId.of(JsonFields.requireText(raw, "message_id"));
            SessionId sessionId = SessionId.of(JsonFields.requireText(raw, "session_id"));
            Instant timestamp = JsonFields.requireTimestamp(raw, "timestamp");
            Actor sender = JsonFields.readActor(raw.get("sender"), "sender");
            JsonNode recipientNode = raw.get("recipient");
            Actor recipient = recipientNode == null || recipientNode.isNull()
                ? null
                : JsonFields.readActor(recipientNode, "recipient");
            String inReplyToText = JsonFields.optionalText(raw, "in_reply_to");
            MessageId inReplyTo = inReplyToText == null ? null : MessageId.of(inReplyToText);

            return new MessageEnvelope(
                version,
                type,
                phase,
                messageId,
                sessionId,
                timestamp,
                sender,
                recipient,
                inReplyTo,
                JsonFields.optionalObject(raw, "trace"),
                JsonFields.requireObject(raw, "payload"),
                JsonFields.optionalObject(raw, "extensions")
            );
        } catch (IllegalArgumentException e) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT,
                "malformed envelope: " + e.getMessage(), false, relatedId, e);
        }
    }

    /**
     * 엔벨로프를 JSON으로 변환.
     *
     * <p>필드 순서: icnp_version, type, phase, message_id, session_id, timestamp, sender,
     * recipient, in_reply_to, trace, payload, extensions. 선택 필드는 값이 있을 때만 기록합니다.</p>
     *
     * @param envelope 엔벨로프
     * @return 엔벨로프 JSON
     * @throws IllegalArgumentException envelope가 null인 경우
     */
    public static ObjectNode encode(MessageEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        ObjectNode node = ProtocolJson.objectNode();
        node.put("icnp_version", envelope.icnpVersion());
        node.put("type", envelope.type().wireName());
        node.put("phase", envelope.phase().wireName());
        node.put("message_id", envelope.messageId().getValue());
        node.put("session_id", envelope.sessionId().getValue());
        JsonFields.putTimestamp(node, "timestamp", envelope.timestamp());
        node.set("sender", JsonFields.writeActor(envelope.sender()));
        if (envelope.recipient() != null) {
            node.set("recipient", JsonFields.writeActor(envelope.recipient()));
        }
        if (envelope.inReplyTo() != null) {
            node.put("in_reply_to", envelope.inReplyTo().getValue());
        }
        if (envelope.trace() != null) {
            node.set("trace", envelope.trace());
        }
        node.set("payload", envelope.payload());
        if (envelope.extensions() != null) {
            node.set("extensions", envelope.extensions());
        }
        return node;
    }

    /**
     * 검증 없이 message_id만 추출 (오류 응답의 related_message_id 용도).
     *
     * @param raw 엔벨로프 JSON
     * @return 정규 UUID인 경우 MessageId, 아니면 null
     */
    public static MessageId peekMessageId(JsonNode raw) {
        String text = raw == null ? null : raw.path("message_id").textValue();
        return CanonicalUuid.isCanonical(text) ? MessageId.of(text) : null;
    }

    /**
     * 검증 없이 session_id만 추출.
     *
     * @param raw 엔벨로프 JSON
     * @return 정규 UUID인 경우 SessionId, 아니면 null
     */
    public static SessionId peekSessionId(JsonNode raw) {
        String text = raw == null ? null : raw.path("session_id").textValue();
        return CanonicalUuid.isCanonical(text) ? SessionId.of(text) : null;
    }

    /**
     * 검증 없이 sender 추출.
     *
     * @param raw 엔벨로프 JSON
     * @return 형식이 올바르면 Actor, 아니면 null
     */
    public static Actor peekSender(JsonNode raw) {
        if (raw == null || !raw.path("sender").isObject()) {
            return null;
        }
        try {
            return JsonFields.readActor(raw.get("sender"), "sender");
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
