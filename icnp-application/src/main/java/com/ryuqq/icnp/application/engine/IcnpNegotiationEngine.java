package com.ryuqq.icnp.application.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.application.audit.AuditLog;
import com.ryuqq.icnp.application.capability.CapabilityLedger;
import com.ryuqq.icnp.application.enforcement.EnforcementGate;
import com.ryuqq.icnp.application.intent.IntentRegistry;
import com.ryuqq.icnp.application.negotiation.ContractNegotiator;
import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.application.session.SessionSnapshot;
import com.ryuqq.icnp.application.session.SessionStore;
import com.ryuqq.icnp.application.token.TokenIssuer;
import com.ryuqq.icnp.application.validation.Admission;
import com.ryuqq.icnp.application.validation.EnvelopeValidator;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.capability.Capability;
import com.ryuqq.icnp.core.contract.AcceptanceDecision;
import com.ryuqq.icnp.core.contract.Contract;
import com.ryuqq.icnp.core.contract.ContractAcceptance;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.execution.ExecutionRequest;
import com.ryuqq.icnp.core.intent.Intent;
import com.ryuqq.icnp.core.message.EnvelopeCodec;
import com.ryuqq.icnp.core.message.MessageEnvelope;
import com.ryuqq.icnp.core.message.MessageType;
import com.ryuqq.icnp.core.message.PayloadCodec;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.MessageId;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.outcome.Denied;
import com.ryuqq.icnp.core.outcome.Executed;
import com.ryuqq.icnp.core.outcome.ExecutionOutcome;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import com.ryuqq.icnp.core.token.ExecutionToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link NegotiationEngine} 기본 구현.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * handle(raw)
 *   ↓
 * EnvelopeValidator.parse → 실패 시 message_rejected + error
 *   ↓
 * intent_declaration이면 세션 생성, 아니면 기존 세션 조회
 *   ↓
 * withSession: admit (DUPLICATE면 종료) → 종류별 처리
 *   ↓
 * 송신 엔벨로프 (execution_token, execution_result, error)
 * </pre>
 *
 * <p>모든 거절은 정확히 하나의 감사 기록을 남깁니다. 프로토콜 오류는
 * {@code message_rejected}, 실행 게이트의 거부는 게이트가 기록한 {@code violation}입니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class IcnpNegotiationEngine implements NegotiationEngine {

    private static final Logger log = LoggerFactory.getLogger(IcnpNegotiationEngine.class);

    private final EnvelopeValidator validator;
    private final SessionStore sessionStore;
    private final IntentRegistry intentRegistry;
    private final CapabilityLedger capabilityLedger;
    private final ContractNegotiator negotiator;
    private final TokenIssuer tokenIssuer;
    private final EnforcementGate enforcementGate;
    private final AuditLog auditLog;
    private final EnvelopeFactory envelopes;

    public IcnpNegotiationEngine(EnvelopeValidator validator, SessionStore sessionStore, IntentRegistry intentRegistry,
                                 CapabilityLedger capabilityLedger, ContractNegotiator negotiator,
                                 TokenIssuer tokenIssuer, EnforcementGate enforcementGate, AuditLog auditLog,
                                 EnvelopeFactory envelopes) {
        if (validator == null || sessionStore == null || intentRegistry == null || capabilityLedger == null
            || negotiator == null || tokenIssuer == null || enforcementGate == null || auditLog == null
            || envelopes == null) {
            throw new IllegalArgumentException("engine components cannot be null");
        }
        this.validator = validator;
        this.sessionStore = sessionStore;
        this.intentRegistry = intentRegistry;
        this.capabilityLedger = capabilityLedger;
        this.negotiator = negotiator;
        this.tokenIssuer = tokenIssuer;
        this.enforcementGate = enforcementGate;
        this.auditLog = auditLog;
        this.envelopes = envelopes;
    }

    @Override
    public EngineResponse handle(ObjectNode rawEnvelope) {
        MessageEnvelope envelope;
        try {
            envelope = validator.parse(rawEnvelope);
        } catch (IcnpException e) {
            return reject(EnvelopeCodec.peekSessionId(rawEnvelope), EnvelopeCodec.peekSender(rawEnvelope),
                EnvelopeCodec.peekMessageId(rawEnvelope), null, e);
        }

        try {
            if (envelope.type() == MessageType.INTENT_DECLARATION) {
                return declareIntent(envelope);
            }
            Session session = sessionStore.find(envelope.sessionId())
                .orElseThrow(() -> new IcnpException(IcnpErrorCode.INVALID_INTENT,
                    "unknown session " + envelope.sessionId().getValue()));
            return sessionStore.withSession(session, s -> dispatch(s, envelope));
        } catch (IcnpException e) {
            return reject(envelope, e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling {} {}", envelope.type().wireName(), envelope.messageId().getValue(), e);
            return reject(envelope, new IcnpException(IcnpErrorCode.INTERNAL_ERROR,
                "unexpected failure: " + e.getMessage(), false, envelope.messageId(), e));
        }
    }

    private EngineResponse declareIntent(MessageEnvelope envelope) {
        Optional<Session> created = sessionStore.createSession(envelope.sessionId(), envelope.sender());
        if (created.isEmpty()) {
            Session existing = sessionStore.find(envelope.sessionId())
                .orElseThrow(() -> new IcnpException(IcnpErrorCode.INVALID_INTENT,
                    "session " + envelope.sessionId().getValue() + " was evicted"));
            return sessionStore.withSession(existing, s -> {
                if (validator.admit(s, envelope) == Admission.DUPLICATE) {
                    return EngineResponse.duplicate();
                }
                throw new IcnpException(IcnpErrorCode.INVALID_INTENT,
                    "intent already declared for session " + s.id().getValue());
            });
        }
        return sessionStore.withSession(created.get(), s -> {
            validator.admit(s, envelope);
            try {
                Intent intent = PayloadCodec.readIntent(envelope.payload());
                intentRegistry.recordIntent(s, intent);
            } catch (IcnpException e) {
                sessionStore.transition(s, SessionPhase.ABORTED);
                throw e;
            }
            return EngineResponse.processed(List.of());
        });
    }

    private EngineResponse dispatch(Session session, MessageEnvelope envelope) {
        if (validator.admit(session, envelope) == Admission.DUPLICATE) {
            return EngineResponse.duplicate();
        }
        Actor sender = envelope.sender();
        switch (envelope.type()) {
            case CAPABILITY_DISCLOSURE -> {
                List<Capability> capabilities = PayloadCodec.readCapabilities(envelope.payload(), sender.id());
                capabilityLedger.discloseAll(session, sender, capabilities);
                return EngineResponse.processed(List.of());
            }
            case CONTRACT_PROPOSAL -> {
                negotiator.propose(session, sender, PayloadCodec.readContract(envelope.payload()));
                return EngineResponse.processed(List.of());
            }
            case CONTRACT_COUNTER_PROPOSAL -> {
                negotiator.counterPropose(session, sender, PayloadCodec.readContract(envelope.payload()));
                return EngineResponse.processed(List.of());
            }
            case CONTRACT_ACCEPTANCE -> {
                return acknowledge(session, envelope);
            }
            case EXECUTION_REQUEST -> {
                return execute(session, envelope);
            }
            case EXECUTION_TOKEN, EXECUTION_RESULT -> throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                envelope.type().wireName() + " is only emitted by the engine");
            case ERROR -> {
                log.warn("Error received in session {} from {}: {}", session.id().getValue(), sender.id(),
                    PayloadCodec.readErrorCode(envelope.payload()).wireName());
                return EngineResponse.processed(List.of());
            }
            case AUDIT_EVENT -> {
                log.debug("Audit event received in session {} from {}", session.id().getValue(), sender.id());
                return EngineResponse.processed(List.of());
            }
            default -> throw new IcnpException(IcnpErrorCode.INVALID_INTENT,
                "unexpected message type " + envelope.type().wireName());
        }
    }

    private EngineResponse acknowledge(Session session, MessageEnvelope envelope) {
        ContractAcceptance acceptance = PayloadCodec.readAcceptance(envelope.payload());
        if (acceptance.decision() == AcceptanceDecision.REJECT) {
            negotiator.reject(session, envelope.sender(), acceptance.contractId(), acceptance.reason());
            return EngineResponse.processed(List.of());
        }
        ExecutionToken token;
        try {
            Optional<Contract> accepted = negotiator.acknowledge(
                session, envelope.sender(), acceptance.contractId(), acceptance.signature());
            if (accepted.isEmpty()) {
                return EngineResponse.processed(List.of());
            }
            token = issueToken(session, accepted.get());
        } catch (IcnpException e) {
            if (e.isRetryable()) {
                negotiator.reopen(session, e);
                session.forgetSeen(envelope.messageId());
            }
            throw e;
        }
        List<ObjectNode> outbound = new ArrayList<>();
        for (Actor member : token.audience()) {
            MessageEnvelope tokenEnvelope = envelopes.create(MessageType.EXECUTION_TOKEN, session.id(), member,
                envelope.messageId(), envelope.trace(), PayloadCodec.writeToken(token));
            session.markEmitted(tokenEnvelope.messageId());
            outbound.add(envelopes.encode(tokenEnvelope));
        }
        return EngineResponse.processed(outbound);
    }

    private ExecutionToken issueToken(Session session, Contract accepted) {
        try {
            return tokenIssuer.issue(session, accepted);
        } catch (RuntimeException e) {
            negotiator.reopen(session, e);
            throw e;
        }
    }

    private EngineResponse execute(Session session, MessageEnvelope envelope) {
        ExecutionRequest request = PayloadCodec.readExecutionRequest(envelope.payload());
        if (!request.executor().id().equals(envelope.sender().id())) {
            throw new IcnpException(IcnpErrorCode.UNAUTHORISED_ACTION,
                "executor " + request.executor().id() + " does not match sender " + envelope.sender().id());
        }
        ExecutionOutcome outcome = enforcementGate.evaluate(session, request);
        if (outcome instanceof Executed executed) {
            MessageEnvelope resultEnvelope = envelopes.create(MessageType.EXECUTION_RESULT, session.id(),
                envelope.sender(), envelope.messageId(), envelope.trace(),
                PayloadCodec.writeExecutionResult(executed.result()));
            session.markEmitted(resultEnvelope.messageId());
            return EngineResponse.processed(List.of(envelopes.encode(resultEnvelope)));
        }
        Denied denied = (Denied) outcome;
        IcnpException error = new IcnpException(denied.code(), denied.reason(), false, envelope.messageId(), null);
        MessageEnvelope errorEnvelope = envelopes.error(session.id(), envelope.sender(), envelope.messageId(), error);
        session.markEmitted(errorEnvelope.messageId());
        return EngineResponse.rejected(denied.code(), envelopes.encode(errorEnvelope));
    }

    private EngineResponse reject(MessageEnvelope envelope, IcnpException error) {
        return reject(envelope.sessionId(), envelope.sender(), envelope.messageId(), envelope.type(), error);
    }

    private EngineResponse reject(SessionId sessionId, Actor sender, MessageId messageId, MessageType type,
                                  IcnpException error) {
        IcnpException related = error.relatedTo(messageId);
        auditLog.record(AuditEventKind.MESSAGE_REJECTED, sessionId, List.of(),
            AuditLog.details(
                "message_id", messageId == null ? null : messageId.getValue(),
                "type", type == null ? null : type.wireName(),
                "sender", sender == null ? null : sender.id(),
                "code", related.getCode().code(),
                "name", related.getCode().wireName(),
                "reason", related.getMessage(),
                "retryable", String.valueOf(related.isRetryable())));
        log.info("Message rejected: {} {} ({})", related.getCode().wireName(),
            messageId == null ? "-" : messageId.getValue(), related.getMessage());

        MessageEnvelope errorEnvelope = envelopes.error(sessionId, sender, messageId, related);
        if (sessionId != null) {
            sessionStore.find(sessionId).ifPresent(session -> session.markEmitted(errorEnvelope.messageId()));
        }
        return EngineResponse.rejected(related.getCode(), envelopes.encode(errorEnvelope));
    }

    @Override
    public Optional<SessionSnapshot> snapshot(SessionId sessionId) {
        return sessionStore.snapshot(sessionId);
    }

    @Override
    public boolean completeSession(SessionId sessionId) {
        return sessionStore.find(sessionId)
            .map(session -> sessionStore.withSession(session, s -> {
                sessionStore.transition(s, SessionPhase.COMPLETED);
                return true;
            }))
            .orElse(false);
    }

    @Override
    public boolean abortSession(SessionId sessionId, String reason) {
        return sessionStore.find(sessionId)
            .map(session -> sessionStore.withSession(session, s -> {
                sessionStore.transition(s, SessionPhase.ABORTED);
                tokenIssuer.revoke(s, reason == null ? "session aborted" : reason);
                log.info("Session aborted: {} ({})", s.id().getValue(), reason);
                return true;
            }))
            .orElse(false);
    }

    @Override
    public boolean revokeToken(SessionId sessionId, String reason) {
        return sessionStore.find(sessionId)
            .map(session -> sessionStore.withSession(session, s -> tokenIssuer.revoke(s, reason)))
            .orElse(false);
    }

    @Override
    public int expireOverdue(int batchSize) {
        return sessionStore.expireOverdue(batchSize);
    }

    @Override
    public int evictTerminal(Duration retention) {
        return sessionStore.evictTerminal(retention);
    }
}
