package com.ryuqq.icnp.core.spi;

import com.ryuqq.icnp.core.capability.Capability;
import com.ryuqq.icnp.core.capability.CapabilityAction;
import com.ryuqq.icnp.core.intent.Intent;

/**
 * Strategy that rates how well a capability action serves an intent.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public interface CapabilityMatchScorer {

    /**
     * Scores a capability action.
     *
     * @param intent the session intent
     * @param capability the disclosed capability
     * @param action the action inside the capability
     * @return score in [0, 1]; higher is better
     */
    double score(Intent intent, Capability capability, CapabilityAction action);
}
