package com.ryuqq.icnp.core.message;

import java.util.Arrays;
import java.util.Optional;

/**
 * ICNP 메시지 종류와 소속 단계.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum MessageType {

    INTENT_DECLARATION("intent_declaration", MessagePhase.INTENT),
    CAPABILITY_DISCLOSURE("capability_disclosure", MessagePhase.CAPABILITY),
    CONTRACT_PROPOSAL("contract_proposal", MessagePhase.CONTRACT),
    CONTRACT_COUNTER_PROPOSAL("contract_counter_proposal", MessagePhase.CONTRACT),
    CONTRACT_ACCEPTANCE("contract_acceptance", MessagePhase.CONTRACT),
    EXECUTION_TOKEN("execution_token", MessagePhase.TOKEN),
    EXECUTION_REQUEST("execution_request", MessagePhase.EXECUTION),
    EXECUTION_RESULT("execution_result", MessagePhase.EXECUTION),
    AUDIT_EVENT("audit_event", MessagePhase.AUDIT),
    ERROR("error", MessagePhase.ERROR);

    private final String wireName;
    private final MessagePhase phase;

    MessageType(String wireName, MessagePhase phase) {
        this.wireName = wireName;
        this.phase = phase;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 이 메시지 종류가 반드시 가져야 하는 phase 값.
     *
     * @return 소속 단계
     */
    public MessagePhase phase() {
        return phase;
    }

    public static Optional<MessageType> fromWire(String wireName) {
        return Arrays.stream(values()).filter(v -> v.wireName.equals(wireName)).findFirst();
    }
}
