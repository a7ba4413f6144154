package com.ryuqq.icnp.application.negotiation;

import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.core.capability.CapabilityAction;
import com.ryuqq.icnp.core.contract.AgreedAction;
import com.ryuqq.icnp.core.contract.ApprovalDecision;
import com.ryuqq.icnp.core.contract.Contract;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;

/**
 * 승인 게이트.
 *
 * <p>의도가 human_approval_required이거나, 선택된 능력 행위 중 하나라도
 * requires_approval이면 계약에 approve가 하나 이상 있고 reject가 없어야 합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class ApprovalGate {

    /**
     * 승인이 필요한 계약인지 확인.
     *
     * @param session 세션 (의도와 능력 보유)
     * @param contract 계약
     * @return 승인이 필요하면 true
     */
    public boolean requiresApproval(Session session, Contract contract) {
        if (session.intent() != null && session.intent().constraints().humanApprovalRequired()) {
            return true;
        }
        for (AgreedAction agreed : contract.agreedActions()) {
            boolean required = session.capability(agreed.executorId(), agreed.capabilityId())
                .flatMap(capability -> capability.findAction(agreed.action(), agreed.scope()))
                .map(CapabilityAction::requiresApproval)
                .orElse(false);
            if (required) {
                return true;
            }
        }
        return false;
    }

    /**
     * 승인 기록이 조건을 만족하는지 확인.
     *
     * @param contract 계약
     * @return approve가 있고 reject가 없으면 true
     */
    public boolean isSatisfied(Contract contract) {
        boolean approved = contract.approvals().stream().anyMatch(a -> a.decision() == ApprovalDecision.APPROVE);
        boolean rejected = contract.approvals().stream().anyMatch(a -> a.decision() == ApprovalDecision.REJECT);
        return approved && !rejected;
    }

    /**
     * 승인 조건 강제.
     *
     * @param session 세션
     * @param contract 계약
     * @throws IcnpException 승인이 필요한데 만족하지 않는 경우 (unauthorised_action)
     */
    public void enforce(Session session, Contract contract) {
        if (requiresApproval(session, contract) && !isSatisfied(contract)) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "contract " + contract.contractId() + " requires an approve decision and no reject");
        }
    }
}
