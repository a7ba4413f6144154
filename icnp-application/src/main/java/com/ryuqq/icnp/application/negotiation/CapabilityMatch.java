package com.ryuqq.icnp.application.negotiation;

import com.ryuqq.icnp.core.capability.Capability;
import com.ryuqq.icnp.core.capability.CapabilityAction;

/**
 * 행위 후보 하나와 점수.
 *
 * @param capability 능력
 * @param action 능력 안의 행위
 * @param score 점수 [0, 1]
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record CapabilityMatch(Capability capability, CapabilityAction action, double score) {

    public CapabilityMatch {
        if (capability == null || action == null) {
            throw new IllegalArgumentException("capability and action cannot be null");
        }
    }

    public String executorId() {
        return capability.ownerId();
    }
}
