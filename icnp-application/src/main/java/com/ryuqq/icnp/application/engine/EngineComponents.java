package com.ryuqq.icnp.application.engine;

import com.ryuqq.icnp.application.audit.AuditLog;
import com.ryuqq.icnp.application.capability.CapabilityLedger;
import com.ryuqq.icnp.application.enforcement.EnforcementGate;
import com.ryuqq.icnp.application.intent.IntentRegistry;
import com.ryuqq.icnp.application.negotiation.ApprovalGate;
import com.ryuqq.icnp.application.negotiation.ContractNegotiator;
import com.ryuqq.icnp.application.session.SessionStore;
import com.ryuqq.icnp.application.support.CollaboratorGuard;
import com.ryuqq.icnp.application.token.BindingHasher;
import com.ryuqq.icnp.application.token.TokenIssuer;
import com.ryuqq.icnp.application.validation.EnvelopeValidator;

import java.time.Clock;

/**
 * 조립된 엔진 컴포넌트.
 *
 * <p>{@link #wire(EngineConfig, EngineCollaborators, Clock)}가 잎 컴포넌트부터 차례로 생성합니다.
 * 세션 저장소와 감사 기록기는 리퍼나 테스트에서 직접 쓸 수 있도록 공개합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EngineComponents components = EngineComponents.wire(EngineConfig.defaults(), collaborators, Clock.systemUTC());
 * NegotiationEngine engine = components.engine();
 * ...
 * components.shutdown();
 * </pre>
 *
 * @param config 엔진 설정
 * @param guard 협력자 호출 보호기
 * @param auditLog 감사 기록기
 * @param sessionStore 세션 저장소
 * @param negotiator 계약 협상기
 * @param tokenIssuer 토큰 발급기
 * @param enforcementGate 실행 게이트
 * @param engine 엔진
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record EngineComponents(
    EngineConfig config,
    CollaboratorGuard guard,
    AuditLog auditLog,
    SessionStore sessionStore,
    ContractNegotiator negotiator,
    TokenIssuer tokenIssuer,
    EnforcementGate enforcementGate,
    NegotiationEngine engine
) {

    /**
     * 엔진 조립.
     *
     * @param config 엔진 설정
     * @param collaborators 외부 협력자
     * @param clock 시계
     * @return 조립된 컴포넌트
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static EngineComponents wire(EngineConfig config, EngineCollaborators collaborators, Clock clock) {
        if (config == null || collaborators == null || clock == null) {
            throw new IllegalArgumentException("config, collaborators and clock cannot be null");
        }
        CollaboratorGuard guard = new CollaboratorGuard(collaborators.timeoutPolicy());
        AuditLog auditLog = new AuditLog(collaborators.auditSink(), guard, clock);
        SessionStore sessionStore = new SessionStore(auditLog, clock, config.negotiationTtl());
        EnvelopeValidator validator = new EnvelopeValidator(config.supportedMajorVersion());
        IntentRegistry intentRegistry = new IntentRegistry(auditLog);
        CapabilityLedger capabilityLedger = new CapabilityLedger(sessionStore, auditLog);
        ApprovalGate approvalGate = new ApprovalGate();
        ContractNegotiator negotiator = new ContractNegotiator(sessionStore, auditLog, collaborators.scorer(),
            config.minimumMatchScore(), approvalGate, collaborators.signer(), collaborators.canonicalizer(), guard);
        BindingHasher bindingHasher = new BindingHasher(collaborators.canonicalizer(), guard);
        TokenIssuer tokenIssuer = new TokenIssuer(config.engineActor(), config.tokenTtl(), config.invocationLimits(),
            config.signingKeyRef(), collaborators.signer(), collaborators.canonicalizer(),
            collaborators.revocationList(), bindingHasher, approvalGate, sessionStore, auditLog, guard, clock);
        EnforcementGate enforcementGate = new EnforcementGate(tokenIssuer, bindingHasher, sessionStore, auditLog,
            collaborators.actionExecutor(), collaborators.rollbackExecutor(), guard, clock);
        EnvelopeFactory envelopes = new EnvelopeFactory(config.icnpVersion(), config.engineActor(), clock);
        NegotiationEngine engine = new IcnpNegotiationEngine(validator, sessionStore, intentRegistry,
            capabilityLedger, negotiator, tokenIssuer, enforcementGate, auditLog, envelopes);
        return new EngineComponents(config, guard, auditLog, sessionStore, negotiator, tokenIssuer,
            enforcementGate, engine);
    }

    /**
     * 협력자 호출 스레드 정리.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트
     */
    public void shutdown() throws InterruptedException {
        guard.shutdown();
    }
}
