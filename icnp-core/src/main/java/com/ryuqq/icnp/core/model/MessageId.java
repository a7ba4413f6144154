package com.ryuqq.icnp.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Message 식별자.
 *
 * <p>정규 UUID 문자열을 감싸는 값 객체입니다. 생성 시 형식을 검증하고
 * 소문자로 정규화하므로 대소문자가 다른 동일 UUID는 같은 식별자로 취급됩니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class MessageId {

    private final String value;

    private MessageId(String value) {
        this.value = CanonicalUuid.require(value, "MessageId");
    }

    /**
     * MessageId 생성.
     *
     * @param value UUID 문자열
     * @return MessageId 인스턴스
     * @throws IllegalArgumentException 정규 UUID가 아닌 경우
     */
    public static MessageId of(String value) {
        return new MessageId(value);
    }

    /**
     * 랜덤 MessageId 생성.
     *
     * @return 새 MessageId
     */
    public static MessageId random() {
        return new MessageId(CanonicalUuid.random());
    }

    /**
     * MessageId 값 조회.
     *
     * @return 소문자 UUID 문자열
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageId that = (MessageId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MessageId{" + value + '}';
    }
}
