package com.ryuqq.icnp.core.contract;

import java.util.Arrays;
import java.util.Optional;

/**
 * 계약 위반 시 집행 방식. STRICT만 요청을 거부하며, 나머지는 실행 후 위반을 기록합니다.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum EnforcementMode {

    STRICT("strict"),
    PERMISSIVE("permissive"),
    AUDIT_ONLY("audit_only");

    private final String wireName;

    EnforcementMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<EnforcementMode> fromWire(String wireName) {
        return Arrays.stream(values()).filter(v -> v.wireName.equals(wireName)).findFirst();
    }
}
