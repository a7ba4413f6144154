package com.ryuqq.icnp.core.contract;

import com.ryuqq.icnp.core.model.Signature;

/**
 * contract_acceptance 메시지 본문.
 *
 * @param contractId 대상 계약 ID
 * @param decision 수락 또는 거절
 * @param signature 수락 시 서명 (거절 시 null 가능)
 * @param reason 거절 사유 (null 가능)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record ContractAcceptance(
    String contractId,
    AcceptanceDecision decision,
    Signature signature,
    String reason
) {

    public ContractAcceptance {
        if (contractId == null || contractId.isBlank()) {
            throw new IllegalArgumentException("contractId cannot be null or blank");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
    }
}
