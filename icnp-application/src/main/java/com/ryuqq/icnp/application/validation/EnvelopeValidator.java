package com.ryuqq.icnp.application.validation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.message.EnvelopeCodec;
import com.ryuqq.icnp.core.message.MessageEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 엔벨로프 구조/인과 관계 검증기.
 *
 * <p><strong>검증 단계:</strong></p>
 * <ol>
 *   <li>{@link #parse(ObjectNode)}: 필드 구조, UUID, 타임스탬프, 역할, 종류/단계 일치, 지원 major 버전</li>
 *   <li>{@link #admit(Session, MessageEnvelope)}: 중복 message_id, in_reply_to 인과 관계</li>
 * </ol>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class EnvelopeValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeValidator.class);

    private final int supportedMajorVersion;

    /**
     * @param supportedMajorVersion 지원하는 icnp_version의 major 값
     */
    public EnvelopeValidator(int supportedMajorVersion) {
        if (supportedMajorVersion < 0) {
            throw new IllegalArgumentException(
                "supportedMajorVersion cannot be negative (current: " + supportedMajorVersion + ")");
        }
        this.supportedMajorVersion = supportedMajorVersion;
    }

    /**
     * 원시 엔벨로프 파싱 및 구조 검증.
     *
     * @param raw 엔벨로프 JSON
     * @return 검증된 엔벨로프
     * @throws IcnpException invalid_intent
     */
    public MessageEnvelope parse(ObjectNode raw) {
        MessageEnvelope envelope = EnvelopeCodec.decode(raw);
        int major = majorOf(envelope.icnpVersion());
        if (major != supportedMajorVersion) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT,
                "unsupported icnp_version " + envelope.icnpVersion() + " (supported major: " + supportedMajorVersion + ")",
                false, envelope.messageId(), null);
        }
        return envelope;
    }

    /**
     * 세션에 메시지 수용.
     *
     * <p>중복이 아니고 인과 관계가 올바르면 message_id를 seen 집합에 넣습니다.
     * in_reply_to 검증에 실패한 메시지는 seen 집합에 넣지 않습니다.</p>
     *
     * @param session 세션 (락 보유 필요)
     * @param envelope 검증된 엔벨로프
     * @return ACCEPTED 또는 DUPLICATE
     * @throws IcnpException in_reply_to가 세션에 기록되지 않은 메시지를 가리키는 경우 (invalid_intent)
     */
    public Admission admit(Session session, MessageEnvelope envelope) {
        session.requireWriter();
        if (session.hasSeen(envelope.messageId())) {
            log.debug("Duplicate message {} in session {}", envelope.messageId().getValue(), session.id().getValue());
            return Admission.DUPLICATE;
        }
        if (envelope.inReplyTo() != null
            && !session.hasSeen(envelope.inReplyTo())
            && !session.hasEmitted(envelope.inReplyTo())) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT,
                "in_reply_to " + envelope.inReplyTo().getValue() + " is unknown to session " + session.id().getValue(),
                false, envelope.messageId(), null);
        }
        session.markSeen(envelope.messageId());
        return Admission.ACCEPTED;
    }

    private static int majorOf(String version) {
        try {
            return Integer.parseInt(version.substring(0, version.indexOf('.')));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
