package com.ryuqq.icnp.application.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.error.ErrorReport;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.message.EnvelopeCodec;
import com.ryuqq.icnp.core.message.MessageEnvelope;
import com.ryuqq.icnp.core.message.MessageType;
import com.ryuqq.icnp.core.message.PayloadCodec;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.MessageId;
import com.ryuqq.icnp.core.model.SessionId;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * 엔진이 송신하는 엔벨로프 생성기.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class EnvelopeFactory {

    private final String icnpVersion;
    private final Actor sender;
    private final Clock clock;

    public EnvelopeFactory(String icnpVersion, Actor sender, Clock clock) {
        if (icnpVersion == null || sender == null || clock == null) {
            throw new IllegalArgumentException("icnpVersion, sender and clock cannot be null");
        }
        this.icnpVersion = icnpVersion;
        this.sender = sender;
        this.clock = clock;
    }

    /**
     * 엔벨로프 생성.
     *
     * @param type 메시지 종류
     * @param sessionId 세션 ID
     * @param recipient 수신자 (null이면 broadcast)
     * @param inReplyTo 응답 대상 (null 가능)
     * @param trace 인바운드에서 이어받을 추적 정보 (null 가능)
     * @param payload 본문
     * @return 엔벨로프
     */
    public MessageEnvelope create(MessageType type, SessionId sessionId, Actor recipient,
                                  MessageId inReplyTo, ObjectNode trace, ObjectNode payload) {
        return new MessageEnvelope(
            icnpVersion,
            type,
            type.phase(),
            MessageId.random(),
            sessionId,
            now(),
            sender,
            recipient,
            inReplyTo,
            trace,
            payload,
            null);
    }

    /**
     * error 엔벨로프 생성.
     *
     * @param sessionId 세션 ID (null이면 nil UUID)
     * @param recipient 수신자 (null 가능)
     * @param inReplyTo 원인 메시지 (null 가능)
     * @param error 오류
     * @return 엔벨로프
     */
    public MessageEnvelope error(SessionId sessionId, Actor recipient, MessageId inReplyTo, IcnpException error) {
        MessageId related = error.getRelatedMessageId() != null ? error.getRelatedMessageId() : inReplyTo;
        ErrorReport report = new ErrorReport(
            UUID.randomUUID().toString(),
            error.getCode(),
            error.getMessage(),
            error.isRetryable(),
            related,
            now(),
            null);
        return create(MessageType.ERROR, sessionId == null ? SessionId.UNKNOWN : sessionId,
            recipient, inReplyTo, null, PayloadCodec.writeError(report));
    }

    public ObjectNode encode(MessageEnvelope envelope) {
        return EnvelopeCodec.encode(envelope);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
