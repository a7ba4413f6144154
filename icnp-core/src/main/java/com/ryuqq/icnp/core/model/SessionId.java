package com.ryuqq.icnp.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Session 식별자.
 *
 * <p>정규 UUID 문자열을 감싸는 값 객체입니다. 생성 시 형식을 검증하고
 * 소문자로 정규화하므로 대소문자가 다른 동일 UUID는 같은 식별자로 취급됩니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class SessionId {

    /**
     * 세션을 특정할 수 없는 오류 응답에 사용하는 nil UUID.
     */
    public static final SessionId UNKNOWN = new SessionId("00000000-0000-0000-0000-000000000000");

    private final String value;

    private SessionId(String value) {
        this.value = CanonicalUuid.require(value, "SessionId");
    }

    /**
     * SessionId 생성.
     *
     * @param value UUID 문자열
     * @return SessionId 인스턴스
     * @throws IllegalArgumentException 정규 UUID가 아닌 경우
     */
    public static SessionId of(String value) {
        return new SessionId(value);
    }

    /**
     * 랜덤 SessionId 생성.
     *
     * @return 새 SessionId
     */
    public static SessionId random() {
        return new SessionId(CanonicalUuid.random());
    }

    /**
     * SessionId 값 조회.
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
        SessionId that = (SessionId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SessionId{" + value + '}';
    }
}
