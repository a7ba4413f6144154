package com.ryuqq.icnp.application.negotiation;

import com.ryuqq.icnp.core.capability.Capability;
import com.ryuqq.icnp.core.capability.CapabilityAction;
import com.ryuqq.icnp.core.intent.Intent;
import com.ryuqq.icnp.core.spi.CapabilityMatchScorer;

/**
 * 기본 점수기: 의도가 요청한 행위이면 공개된 confidence, 아니면 0.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class ConfidenceMatchScorer implements CapabilityMatchScorer {

    @Override
    public double score(Intent intent, Capability capability, CapabilityAction action) {
        if (intent == null || !intent.requests(action.action())) {
            return 0.0;
        }
        return action.confidence();
    }
}
