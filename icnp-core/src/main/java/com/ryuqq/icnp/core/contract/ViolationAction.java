package com.ryuqq.icnp.core.contract;

import java.util.Arrays;
import java.util.Optional;

/**
 * STRICT 모드에서 위반이 발생했을 때 수행할 조치.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum ViolationAction {

    ABORT("abort"),
    ABORT_AND_ROLLBACK("abort_and_rollback"),
    LOG_ONLY("log_only");

    private final String wireName;

    ViolationAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ViolationAction> fromWire(String wireName) {
        return Arrays.stream(values()).filter(v -> v.wireName.equals(wireName)).findFirst();
    }
}
