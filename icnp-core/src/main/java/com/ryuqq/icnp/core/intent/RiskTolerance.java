package com.ryuqq.icnp.core.intent;

import java.util.Arrays;
import java.util.Optional;

/**
 * 의도 선언자가 허용하는 위험 수준.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum RiskTolerance {

    NONE("none"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    RiskTolerance(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<RiskTolerance> fromWire(String wireName) {
        return Arrays.stream(values()).filter(v -> v.wireName.equals(wireName)).findFirst();
    }
}
