package com.ryuqq.icnp.core.model;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 프로토콜 식별자(UUID) 정규화 유틸리티.
 *
 * <p>ICNP의 {@code message_id}, {@code session_id}, {@code in_reply_to}는 모두
 * 8-4-4-4-12 형태의 정규 UUID 문자열이어야 합니다. 대소문자는 허용하되
 * 내부 표현은 소문자로 통일합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class CanonicalUuid {

    private static final Pattern CANONICAL =
        Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private CanonicalUuid() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 정규 UUID 형식인지 확인.
     *
     * @param value 검사할 문자열 (null 허용)
     * @return 정규 UUID 형식이면 true
     */
    public static boolean isCanonical(String value) {
        return value != null && CANONICAL.matcher(value).matches();
    }

    /**
     * 정규 UUID 검증 후 소문자로 정규화.
     *
     * @param value 검사할 문자열
     * @param label 오류 메시지에 사용할 필드 이름
     * @return 소문자 UUID 문자열
     * @throws IllegalArgumentException 정규 UUID가 아닌 경우
     */
    public static String require(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + " cannot be null or blank");
        }
        if (!isCanonical(value)) {
            throw new IllegalArgumentException(label + " must be a canonical UUID (current: " + value + ")");
        }
        return value.toLowerCase(Locale.ROOT);
    }

    /**
     * 새 랜덤 UUID 문자열 생성.
     *
     * @return 소문자 UUID 문자열
     */
    public static String random() {
        return UUID.randomUUID().toString();
    }
}
