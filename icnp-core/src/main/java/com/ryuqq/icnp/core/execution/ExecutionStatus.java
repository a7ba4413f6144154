package com.ryuqq.icnp.core.execution;

import java.util.Arrays;
import java.util.Optional;

/**
 * 실행 결과 상태.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum ExecutionStatus {

    SUCCESS("success"),
    FAILED("failed");

    private final String wireName;

    ExecutionStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ExecutionStatus> fromWire(String wireName) {
        return Arrays.stream(values()).filter(v -> v.wireName.equals(wireName)).findFirst();
    }
}
