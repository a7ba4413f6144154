package com.ryuqq.icnp.core.contract;

import java.util.Arrays;
import java.util.Optional;

/**
 * contract_acceptance 메시지의 결정.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum AcceptanceDecision {

    ACCEPT("accept"),
    REJECT("reject");

    private final String wireName;

    AcceptanceDecision(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<AcceptanceDecision> fromWire(String wireName) {
        return Arrays.stream(values()).filter(v -> v.wireName.equals(wireName)).findFirst();
    }
}
