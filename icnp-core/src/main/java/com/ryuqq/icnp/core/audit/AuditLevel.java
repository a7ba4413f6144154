package com.ryuqq.icnp.core.audit;

import java.util.Arrays;
import java.util.Optional;

/**
 * 감사 기록 상세 수준.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum AuditLevel {

    MINIMAL("minimal"),
    STANDARD("standard"),
    FULL("full");

    private final String wireName;

    AuditLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<AuditLevel> fromWire(String wireName) {
        return Arrays.stream(values()).filter(v -> v.wireName.equals(wireName)).findFirst();
    }
}
