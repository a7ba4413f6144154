package com.ryuqq.icnp.core.contract;

import java.util.Arrays;
import java.util.Optional;

/**
 * 승인자의 결정.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum ApprovalDecision {

    APPROVE("approve"),
    REJECT("reject");

    private final String wireName;

    ApprovalDecision(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ApprovalDecision> fromWire(String wireName) {
        return Arrays.stream(values()).filter(v -> v.wireName.equals(wireName)).findFirst();
    }
}
