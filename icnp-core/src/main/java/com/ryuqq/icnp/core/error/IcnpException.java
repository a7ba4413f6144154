package com.ryuqq.icnp.core.error;

import com.ryuqq.icnp.core.model.MessageId;

/**
 * 프로토콜 오류.
 *
 * <p>엔진의 모든 컴포넌트는 프로토콜 규칙 위반을 이 예외로 보고하며,
 * 엔진은 이를 {@code error} 엔벨로프와 {@code message_rejected} 감사 기록으로 변환합니다.</p>
 *
 * <p><strong>retryable:</strong> 협력자 타임아웃처럼 일시적인 실패에만 true입니다.
 * 구조/인과 관계 오류는 항상 false입니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class IcnpException extends RuntimeException {

    private final IcnpErrorCode code;
    private final boolean retryable;
    private final MessageId relatedMessageId;

    /**
     * 재시도 불가 오류 생성.
     *
     * @param code 오류 코드
     * @param message 오류 메시지
     */
    public IcnpException(IcnpErrorCode code, String message) {
        this(code, message, false, null, null);
    }

    /**
     * 재시도 여부를 지정한 오류 생성.
     *
     * @param code 오류 코드
     * @param message 오류 메시지
     * @param retryable 재시도 가능 여부
     */
    public IcnpException(IcnpErrorCode code, String message, boolean retryable) {
        this(code, message, retryable, null, null);
    }

    /**
     * 전체 필드 생성자.
     *
     * @param code 오류 코드
     * @param message 오류 메시지
     * @param retryable 재시도 가능 여부
     * @param relatedMessageId 원인 메시지 ID (null 가능)
     * @param cause 원인 예외 (null 가능)
     * @throws IllegalArgumentException code가 null인 경우
     */
    public IcnpException(IcnpErrorCode code, String message, boolean retryable,
                         MessageId relatedMessageId, Throwable cause) {
        super(message, cause);
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        this.code = code;
        this.retryable = retryable;
        this.relatedMessageId = relatedMessageId;
    }

    public IcnpErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public MessageId getRelatedMessageId() {
        return relatedMessageId;
    }

    /**
     * 원인 메시지 ID를 연결한 사본 생성.
     *
     * <p>이미 연결되어 있으면 자기 자신을 반환합니다.</p>
     *
     * @param messageId 원인 메시지 ID
     * @return 원인 메시지 ID가 설정된 예외
     */
    public IcnpException relatedTo(MessageId messageId) {
        if (relatedMessageId != null || messageId == null) {
            return this;
        }
        return new IcnpException(code, getMessage(), retryable, messageId, this);
    }

    @Override
    public String toString() {
        return "IcnpException{" + code.code() + " " + code.wireName() + ": " + getMessage() + '}';
    }
}
