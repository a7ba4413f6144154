package com.ryuqq.icnp.core.message;

import java.util.Arrays;
import java.util.Optional;

/**
 * 엔벨로프의 {@code phase} 필드 값.
 *
 * <p>세션 단계와 별개로, 메시지 종류가 속하는 프로토콜 단계를 나타냅니다.
 * {@code audit}, {@code error}는 세션 단계와 무관하게 언제든 오갈 수 있습니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum MessagePhase {

    INTENT("intent"),
    CAPABILITY("capability"),
    CONTRACT("contract"),
    TOKEN("token"),
    EXECUTION("execution"),
    AUDIT("audit"),
    ERROR("error");

    private final String wireName;

    MessagePhase(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessagePhase> fromWire(String wireName) {
        return Arrays.stream(values()).filter(v -> v.wireName.equals(wireName)).findFirst();
    }
}
