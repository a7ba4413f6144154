package com.ryuqq.icnp.application.intent;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.application.audit.AuditLog;
import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.intent.Intent;
import com.ryuqq.icnp.core.intent.RiskTolerance;
import com.ryuqq.icnp.core.message.PayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 세션 의도 기록기.
 *
 * <p><strong>거절 조건 (모두 invalid_intent):</strong></p>
 * <ul>
 *   <li>goal 누락 또는 공백</li>
 *   <li>requested_actions 누락 또는 빈 목록</li>
 *   <li>risk_tolerance가 none인데 human_approval_required가 true가 아님</li>
 *   <li>이미 의도가 기록된 세션</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class IntentRegistry {

    private static final Logger log = LoggerFactory.getLogger(IntentRegistry.class);

    private final AuditLog auditLog;

    public IntentRegistry(AuditLog auditLog) {
        if (auditLog == null) {
            throw new IllegalArgumentException("auditLog cannot be null");
        }
        this.auditLog = auditLog;
    }

    /**
     * 의도 기록.
     *
     * @param session 세션 (락 보유 필요)
     * @param intent 의도
     * @return 기록된 의도
     * @throws IcnpException invalid_intent
     */
    public Intent recordIntent(Session session, Intent intent) {
        session.requireWriter();
        if (session.intent() != null) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT,
                "intent already recorded for session " + session.id().getValue());
        }
        if (intent.goal() == null || intent.goal().isBlank()) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT, "intent goal is required");
        }
        if (intent.requestedActions().isEmpty()) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT, "intent requested_actions is required");
        }
        if (intent.constraints().riskTolerance() == RiskTolerance.NONE
            && !intent.constraints().humanApprovalRequired()) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT,
                "risk_tolerance 'none' requires human_approval_required=true");
        }

        ObjectNode canonicalPayload = PayloadCodec.writeIntent(intent);
        session.recordIntent(intent, canonicalPayload);
        auditLog.record(AuditEventKind.INTENT_RECORDED, session.id(), List.of(session.initiator().id()),
            AuditLog.details(
                "goal", intent.goal(),
                "risk_tolerance", intent.constraints().riskTolerance().wireName(),
                "requested_actions", String.valueOf(intent.requestedActions().size())));
        log.debug("Intent recorded for session {}: {}", session.id().getValue(), intent.goal());
        return intent;
    }
}
