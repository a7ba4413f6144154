package com.ryuqq.icnp.application.negotiation;

import com.ryuqq.icnp.application.audit.AuditLog;
import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.application.session.SessionStore;
import com.ryuqq.icnp.application.support.CollaboratorGuard;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.capability.Capability;
import com.ryuqq.icnp.core.capability.CapabilityAction;
import com.ryuqq.icnp.core.contract.AgreedAction;
import com.ryuqq.icnp.core.contract.Contract;
import com.ryuqq.icnp.core.contract.Enforcement;
import com.ryuqq.icnp.core.contract.EnforcementMode;
import com.ryuqq.icnp.core.contract.ViolationAction;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.intent.Intent;
import com.ryuqq.icnp.core.intent.IntentConstraints;
import com.ryuqq.icnp.core.intent.RiskTolerance;
import com.ryuqq.icnp.core.message.PayloadCodec;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.Signature;
import com.ryuqq.icnp.core.protection.Collaborator;
import com.ryuqq.icnp.core.spi.Canonicalizer;
import com.ryuqq.icnp.core.spi.CapabilityMatchScorer;
import com.ryuqq.icnp.core.spi.Signer;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 계약 협상기.
 *
 * <p><strong>계약 수명:</strong></p>
 * <pre>
 * propose (capability → contract)
 *   → counterPropose* (초안 교체, 서명 폐기)
 *   → acknowledge (실행자별 서명)
 *   → accept (모든 실행자 서명 + 승인 게이트 → 고정)
 * reject → aborted
 * </pre>
 *
 * <p>초안 검증 규칙:</p>
 * <ul>
 *   <li>합의 항목이 없거나, 능력을 찾을 수 없거나, 실행자가 능력의 소유자가 아니거나,
 *       능력이 행위/범위를 제공하지 않거나, 점수가 최소값 미만이면 capability_mismatch</li>
 *   <li>부수 효과 금지 의도에 부수 효과 능력, ABORT_AND_ROLLBACK 없는 rollback_required,
 *       위험 허용 none에 strict 외 집행 모드이면 constraints_unsatisfiable</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class ContractNegotiator {

    private static final Logger log = LoggerFactory.getLogger(ContractNegotiator.class);

    private final SessionStore sessionStore;
    private final AuditLog auditLog;
    private final CapabilityMatchScorer scorer;
    private final double minimumScore;
    private final ApprovalGate approvalGate;
    private final Signer signer;
    private final Canonicalizer canonicalizer;
    private final CollaboratorGuard guard;

    public ContractNegotiator(SessionStore sessionStore, AuditLog auditLog, CapabilityMatchScorer scorer,
                              double minimumScore, ApprovalGate approvalGate, Signer signer,
                              Canonicalizer canonicalizer, CollaboratorGuard guard) {
        if (sessionStore == null || auditLog == null || scorer == null || approvalGate == null
            || signer == null || canonicalizer == null || guard == null) {
            throw new IllegalArgumentException("collaborators cannot be null");
        }
        if (Double.isNaN(minimumScore) || minimumScore < 0.0 || minimumScore > 1.0) {
            throw new IllegalArgumentException("minimumScore must be within [0, 1] (current: " + minimumScore + ")");
        }
        this.sessionStore = sessionStore;
        this.auditLog = auditLog;
        this.scorer = scorer;
        this.minimumScore = minimumScore;
        this.approvalGate = approvalGate;
        this.signer = signer;
        this.canonicalizer = canonicalizer;
        this.guard = guard;
    }

    /**
     * 계약 제안.
     *
     * @param session 세션 (락 보유 필요)
     * @param proposer 제안자
     * @param draft 초안 (포함된 서명은 버림)
     * @return 저장된 초안
     * @throws IcnpException capability_mismatch, constraints_unsatisfiable, unauthorised_action, invalid_intent
     */
    public Contract propose(Session session, Actor proposer, Contract draft) {
        session.requireWriter();
        requireOpen(session);
        if (session.phase() == SessionPhase.INTENT) {
            throw new IcnpException(IcnpErrorCode.CAPABILITY_MISMATCH,
                "no capabilities disclosed yet for session " + session.id().getValue());
        }
        if (session.phase() != SessionPhase.CAPABILITY) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "contract proposal is not allowed in phase " + session.phase().wireName());
        }
        Contract stored = validateDraft(session, draft).withoutSignatures();
        stored.parties().forEach(session::addParticipant);
        session.addParticipant(proposer);
        session.replaceDraft(stored);
        sessionStore.transition(session, SessionPhase.CONTRACT);
        auditLog.record(AuditEventKind.CONTRACT_PROPOSED, session.id(), List.of(proposer.id(), stored.contractId()),
            AuditLog.details(
                "contract_id", stored.contractId(),
                "agreed_actions", String.valueOf(stored.agreedActions().size()),
                "forbidden_actions", String.valueOf(stored.forbiddenActions().size()),
                "mode", stored.enforcement().mode().wireName()));
        log.info("Contract proposed: {} in session {}", stored.contractId(), session.id().getValue());
        return stored;
    }

    /**
     * 역제안. 초안을 교체하고 수집된 서명을 버립니다.
     *
     * @param session 세션 (락 보유 필요)
     * @param proposer 제안자
     * @param draft 새 초안
     * @return 저장된 초안
     */
    public Contract counterPropose(Session session, Actor proposer, Contract draft) {
        session.requireWriter();
        requireOpen(session);
        if (session.phase() != SessionPhase.CONTRACT || session.draftContract() == null) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "counter proposal requires an open contract negotiation (phase: " + session.phase().wireName() + ")");
        }
        if (session.acceptedContract() != null) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "contract " + session.acceptedContract().contractId() + " is already accepted");
        }
        Contract previous = session.draftContract();
        Contract stored = validateDraft(session, draft).withoutSignatures();
        stored.parties().forEach(session::addParticipant);
        session.addParticipant(proposer);
        session.replaceDraft(stored);
        auditLog.record(AuditEventKind.CONTRACT_COUNTERPROPOSED, session.id(), List.of(proposer.id(), stored.contractId()),
            AuditLog.details(
                "contract_id", stored.contractId(),
                "replaces", previous.contractId(),
                "discarded_signatures", String.valueOf(previous.signatures().size())));
        log.info("Contract counter-proposed: {} replaces {} in session {}",
            stored.contractId(), previous.contractId(), session.id().getValue());
        return stored;
    }

    /**
     * 서명 수집. 모든 실행자가 서명하면 {@link #accept(Session)}를 실행합니다.
     *
     * @param session 세션 (락 보유 필요)
     * @param participant 서명 참여자
     * @param contractId 대상 계약 ID
     * @param signature 서명
     * @return 이번 서명으로 계약이 수락되었으면 수락된 계약
     * @throws IcnpException unauthorised_action
     */
    public Optional<Contract> acknowledge(Session session, Actor participant, String contractId, Signature signature) {
        session.requireWriter();
        Contract draft = requireOpenDraft(session, contractId);
        if (signature == null) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "contract acceptance by " + participant.id() + " carries no signature");
        }
        if (!participant.id().equals(signature.signedBy())) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "signature is by " + signature.signedBy() + ", not by " + participant.id());
        }
        if (!draft.executorIds().contains(participant.id()) && draft.findParty(participant.id()).isEmpty()) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                participant.id() + " is not a party of contract " + contractId);
        }
        byte[] body = guard.call(Collaborator.CANONICALIZER,
            () -> canonicalizer.canonicalize(PayloadCodec.contractTree(draft.withoutSignatures())));
        boolean verified = guard.callOrElse(Collaborator.VERIFIER,
            () -> signer.verify(body, signature, signature.keyId()), false);
        if (!verified) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "contract signature by " + participant.id() + " does not verify");
        }

        Contract signed = draft.withSignature(participant.id(), signature);
        if (signed.signedByAllExecutors()) {
            approvalGate.enforce(session, signed);
        }
        session.replaceDraft(signed);
        auditLog.record(AuditEventKind.CONTRACT_SIGNED, session.id(), List.of(participant.id(), contractId),
            AuditLog.details("contract_id", contractId, "signed_by", participant.id(), "key_id", signature.keyId()));

        if (signed.signedByAllExecutors()) {
            return Optional.of(accept(session));
        }
        return Optional.empty();
    }

    /**
     * 초안 수락 및 고정.
     *
     * @param session 세션 (락 보유 필요)
     * @return 수락된 계약
     * @throws IcnpException 서명 누락 또는 승인 미충족 (unauthorised_action)
     */
    public Contract accept(Session session) {
        session.requireWriter();
        Contract draft = session.draftContract();
        if (draft == null || session.acceptedContract() != null) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "no open contract draft in session " + session.id().getValue());
        }
        if (!draft.signedByAllExecutors()) {
            List<String> missing = new ArrayList<>(draft.executorIds());
            missing.removeAll(draft.signatures().keySet());
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "contract " + draft.contractId() + " is missing signatures from " + missing);
        }
        approvalGate.enforce(session, draft);
        session.acceptContract(draft);
        auditLog.record(AuditEventKind.CONTRACT_ACCEPTED, session.id(), List.of(draft.contractId()),
            AuditLog.details("contract_id", draft.contractId(), "signatures", String.valueOf(draft.signatures().size())));
        log.info("Contract accepted: {} in session {}", draft.contractId(), session.id().getValue());
        return draft;
    }

    /**
     * 수락 취소. 수락 직후 토큰 발급이 실패하면 계약을 다시 열어 서명을 재전송할 수 있게 합니다.
     *
     * @param session 세션 (락 보유 필요)
     * @param cause 발급 실패 원인
     */
    public void reopen(Session session, RuntimeException cause) {
        session.requireWriter();
        Contract accepted = session.acceptedContract();
        if (accepted == null || session.token() != null) {
            return;
        }
        session.withdrawAcceptance();
        log.warn("Contract acceptance withdrawn: {} in session {} ({})",
            accepted.contractId(), session.id().getValue(), cause.getMessage());
    }

    /**
     * 계약 거절. 세션을 aborted로 전이합니다.
     *
     * @param session 세션 (락 보유 필요)
     * @param participant 거절 참여자
     * @param contractId 대상 계약 ID
     * @param reason 사유 (null 가능)
     */
    public void reject(Session session, Actor participant, String contractId, String reason) {
        session.requireWriter();
        requireOpenDraft(session, contractId);
        auditLog.record(AuditEventKind.CONTRACT_REJECTED, session.id(), List.of(participant.id(), contractId),
            AuditLog.details("contract_id", contractId, "rejected_by", participant.id(), "reason", reason));
        sessionStore.transition(session, SessionPhase.ABORTED);
        log.info("Contract rejected: {} by {} in session {}", contractId, participant.id(), session.id().getValue());
    }

    /**
     * 행위 후보를 점수 순으로 정렬.
     *
     * <p>점수가 같으면 공개 순서를 유지합니다.</p>
     *
     * @param session 세션
     * @param action 행위 이름
     * @param scope 범위 (null 가능)
     * @return 최소 점수 이상인 후보 목록
     */
    public List<CapabilityMatch> rankCapabilities(Session session, String action, String scope) {
        Intent intent = session.intent();
        List<CapabilityMatch> matches = new ArrayList<>();
        for (Capability capability : session.capabilities()) {
            capability.findAction(action, scope).ifPresent(candidate -> {
                double score = scorer.score(intent, capability, candidate);
                if (score >= minimumScore) {
                    matches.add(new CapabilityMatch(capability, candidate, score));
                }
            });
        }
        matches.sort(Comparator.comparingDouble(CapabilityMatch::score).reversed());
        return matches;
    }

    private Contract validateDraft(Session session, Contract draft) {
        if (!draft.sessionId().equals(session.id())) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT,
                "contract targets session " + draft.sessionId().getValue() + ", not " + session.id().getValue());
        }
        if (draft.agreedActions().isEmpty()) {
            throw new IcnpException(IcnpErrorCode.CAPABILITY_MISMATCH, "contract has no agreed actions");
        }
        Intent intent = session.intent();
        IntentConstraints constraints = intent.constraints();

        for (AgreedAction agreed : draft.agreedActions()) {
            Capability capability = session.capability(agreed.executorId(), agreed.capabilityId())
                .orElseThrow(() -> session.findCapability(agreed.capabilityId()).isPresent()
                    ? new IcnpException(IcnpErrorCode.CAPABILITY_MISMATCH,
                        "executor " + agreed.executorId() + " does not own capability " + agreed.capabilityId())
                    : new IcnpException(IcnpErrorCode.CAPABILITY_MISMATCH,
                        "capability " + agreed.capabilityId() + " was never disclosed"));
            CapabilityAction offered = capability.findAction(agreed.action(), agreed.scope())
                .orElseThrow(() -> new IcnpException(IcnpErrorCode.CAPABILITY_MISMATCH,
                    "capability " + agreed.capabilityId() + " does not offer '" + agreed.action() + "'"
                        + (agreed.scope() == null ? "" : " in scope '" + agreed.scope() + "'")));
            double score = scorer.score(intent, capability, offered);
            if (score < minimumScore) {
                throw new IcnpException(IcnpErrorCode.CAPABILITY_MISMATCH, String.format(
                    "capability %s scored %.3f for '%s', below minimum %.3f",
                    agreed.capabilityId(), score, agreed.action(), minimumScore));
            }
            if (offered.hasSideEffects() && !constraints.externalSideEffectsAllowed()) {
                throw new IcnpException(IcnpErrorCode.CONSTRAINTS_UNSATISFIABLE,
                    "action '" + agreed.action() + "' has side effects (" + offered.effects()
                        + ") but the intent forbids external side effects");
            }
        }

        Enforcement enforcement = draft.enforcement();
        if (enforcement.rollbackRequired() && enforcement.violationAction() != ViolationAction.ABORT_AND_ROLLBACK) {
            throw new IcnpException(IcnpErrorCode.CONSTRAINTS_UNSATISFIABLE,
                "rollback_required needs violation_action abort_and_rollback (current: "
                    + enforcement.violationAction().wireName() + ")");
        }
        if (constraints.riskTolerance() == RiskTolerance.NONE && enforcement.mode() != EnforcementMode.STRICT) {
            throw new IcnpException(IcnpErrorCode.CONSTRAINTS_UNSATISFIABLE,
                "risk_tolerance none requires strict enforcement (current: " + enforcement.mode().wireName() + ")");
        }
        return draft;
    }

    private Contract requireOpenDraft(Session session, String contractId) {
        requireOpen(session);
        Contract draft = session.draftContract();
        if (session.phase() != SessionPhase.CONTRACT || draft == null) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "no contract under negotiation in phase " + session.phase().wireName());
        }
        if (!draft.contractId().equals(contractId)) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "unknown contract " + contractId + " (current draft: " + draft.contractId() + ")");
        }
        if (session.acceptedContract() != null) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "contract " + contractId + " is already accepted");
        }
        return draft;
    }

    private static void requireOpen(Session session) {
        if (session.isTerminal()) {
            throw new IcnpException(IcnpErrorCode.CONSTRAINTS_UNSATISFIABLE,
                "session " + session.id().getValue() + " is " + session.phase().wireName());
        }
    }
}
