package com.ryuqq.icnp.application.enforcement;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.application.audit.AuditLog;
import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.application.session.SessionStore;
import com.ryuqq.icnp.application.support.CollaboratorGuard;
import com.ryuqq.icnp.application.token.BindingHasher;
import com.ryuqq.icnp.application.token.Reservation;
import com.ryuqq.icnp.application.token.TokenIssuer;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.contract.AgreedAction;
import com.ryuqq.icnp.core.contract.Authorization;
import com.ryuqq.icnp.core.contract.Contract;
import com.ryuqq.icnp.core.contract.EffectiveAuthorization;
import com.ryuqq.icnp.core.contract.EnforcementMode;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.execution.ExecutionRequest;
import com.ryuqq.icnp.core.execution.ExecutionResult;
import com.ryuqq.icnp.core.execution.ExecutionStatus;
import com.ryuqq.icnp.core.executor.ActionExecutor;
import com.ryuqq.icnp.core.message.ProtocolJson;
import com.ryuqq.icnp.core.outcome.Denied;
import com.ryuqq.icnp.core.outcome.Executed;
import com.ryuqq.icnp.core.outcome.ExecutionOutcome;
import com.ryuqq.icnp.core.protection.Collaborator;
import com.ryuqq.icnp.core.spi.RollbackExecutor;
import com.ryuqq.icnp.core.spi.RollbackStatus;
import com.ryuqq.icnp.core.statemachine.InvocationState;
import com.ryuqq.icnp.core.statemachine.InvocationTransition;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import com.ryuqq.icnp.core.token.ExecutionToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * 통제된 실행 게이트.
 *
 * <p><strong>검사 순서:</strong></p>
 * <ol>
 *   <li>invocation_id, nonce 재사용 (unauthorised_action)</li>
 *   <li>토큰 해석, 유효 구간, 서명, 폐기 여부 (token_invalid)</li>
 *   <li>요청 계약/세션 일치, 바인딩 해시 일치 (token_invalid)</li>
 *   <li>금지 우선 권한 판정, audience 포함 여부 (unauthorised_action)</li>
 *   <li>호출 카운터 예약 (unauthorised_action)</li>
 * </ol>
 *
 * <p>재사용과 종료된 세션은 집행 모드와 관계없이 거부합니다. 2~5단계 위반은 strict이면 거부하고,
 * permissive와 audit_only이면 실행합니다. 첫 위반에서 검사를 멈추므로 토큰 위반으로 실행된 요청은
 * 호출 카운터를 소모하지 않습니다. 모든 위반은 {@code violation}으로 감사됩니다.</p>
 *
 * <p>strict 거부이면서 violation_action이 abort_and_rollback이면 롤백을 수행하고
 * {@code rollback}을 감사합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class EnforcementGate {

    private static final Logger log = LoggerFactory.getLogger(EnforcementGate.class);

    private final TokenIssuer tokenIssuer;
    private final BindingHasher bindingHasher;
    private final SessionStore sessionStore;
    private final AuditLog auditLog;
    private final ActionExecutor actionExecutor;
    private final RollbackExecutor rollbackExecutor;
    private final CollaboratorGuard guard;
    private final Clock clock;

    public EnforcementGate(TokenIssuer tokenIssuer, BindingHasher bindingHasher, SessionStore sessionStore,
                           AuditLog auditLog, ActionExecutor actionExecutor, RollbackExecutor rollbackExecutor,
                           CollaboratorGuard guard, Clock clock) {
        if (tokenIssuer == null || bindingHasher == null || sessionStore == null || auditLog == null
            || actionExecutor == null || rollbackExecutor == null || guard == null || clock == null) {
            throw new IllegalArgumentException("collaborators cannot be null");
        }
        this.tokenIssuer = tokenIssuer;
        this.bindingHasher = bindingHasher;
        this.sessionStore = sessionStore;
        this.auditLog = auditLog;
        this.actionExecutor = actionExecutor;
        this.rollbackExecutor = rollbackExecutor;
        this.guard = guard;
        this.clock = clock;
    }

    /**
     * 실행 요청 처리.
     *
     * @param session 세션 (락 보유 필요)
     * @param request 실행 요청
     * @return 실행 또는 거부 결과
     */
    public ExecutionOutcome evaluate(Session session, ExecutionRequest request) {
        session.requireWriter();
        Instant now = clock.instant();
        ExecutionToken token = session.token();
        Contract contract = session.acceptedContract();

        if (token == null || contract == null || session.isTerminal()) {
            String reason = token == null
                ? "no execution token issued for session " + session.id().getValue()
                : "session " + session.id().getValue() + " is " + session.phase().wireName();
            return deny(session, request, null, IcnpErrorCode.TOKEN_INVALID, reason, !session.hasInvocation(request.invocationId()));
        }

        boolean replayedInvocation = session.hasInvocation(request.invocationId());
        Violation replay = checkReplay(session, request, replayedInvocation);
        if (replay != null) {
            return deny(session, request, contract, replay.code(), replay.reason(), !replayedInvocation);
        }

        Violation violation = checkToken(session, request, token, contract, now);
        if (violation == null) {
            violation = checkAuthorization(session, request, token, contract);
        }

        EnforcementMode mode = contract.enforcement().mode();
        if (violation != null && mode == EnforcementMode.STRICT) {
            return deny(session, request, contract, violation.code(), violation.reason(), true);
        }
        return execute(session, request, contract, violation);
    }

    private Violation checkAuthorization(Session session, ExecutionRequest request, ExecutionToken token,
                                         Contract contract) {
        Authorization authorization = EffectiveAuthorization.authorize(
            contract, request.executor().id(), request.action(), request.scope());
        if (!authorization.permitted()) {
            return new Violation(IcnpErrorCode.UNAUTHORISED_ACTION, authorization.reason());
        }
        if (!token.isAudience(request.executor().id())) {
            return new Violation(IcnpErrorCode.UNAUTHORISED_ACTION,
                request.executor().id() + " is not in the token audience");
        }
        AgreedAction agreedAction = authorization.agreedAction();
        Reservation reservation = tokenIssuer.tryConsume(session, request.executor().id(), agreedAction);
        if (!reservation.granted()) {
            return new Violation(IcnpErrorCode.UNAUTHORISED_ACTION, reservation.reason());
        }
        return null;
    }

    private Violation checkToken(Session session, ExecutionRequest request, ExecutionToken token,
                                 Contract contract, Instant now) {
        if (!token.tokenId().equals(request.tokenId())) {
            return new Violation(IcnpErrorCode.TOKEN_INVALID, "token " + request.tokenId() + " cannot be resolved");
        }
        if (!tokenIssuer.validate(token, now)) {
            return new Violation(IcnpErrorCode.TOKEN_INVALID,
                "token " + token.tokenId() + " is expired, revoked or unverifiable");
        }
        if (!token.contractId().equals(request.contractId())) {
            return new Violation(IcnpErrorCode.TOKEN_INVALID,
                "token " + token.tokenId() + " is bound to contract " + token.contractId()
                    + ", not " + request.contractId());
        }
        if (!token.sessionId().equals(session.id()) || !contract.contractId().equals(token.contractId())) {
            return new Violation(IcnpErrorCode.TOKEN_INVALID, "token " + token.tokenId() + " does not belong to this session");
        }
        if (!bindingHasher.compute(session, contract).equals(token.binding())) {
            return new Violation(IcnpErrorCode.TOKEN_INVALID,
                "token " + token.tokenId() + " binding hashes do not match session artifacts");
        }
        return null;
    }

    private static Violation checkReplay(Session session, ExecutionRequest request, boolean replayedInvocation) {
        if (replayedInvocation) {
            return new Violation(IcnpErrorCode.UNAUTHORISED_ACTION,
                "invocation " + request.invocationId() + " was already used");
        }
        if (request.nonce() != null && session.hasNonce(request.nonce())) {
            return new Violation(IcnpErrorCode.UNAUTHORISED_ACTION, "nonce " + request.nonce() + " was already used");
        }
        return null;
    }

    private Denied deny(Session session, ExecutionRequest request, Contract contract,
                        IcnpErrorCode code, String reason, boolean trackInvocation) {
        if (trackInvocation) {
            advance(session, request.invocationId(), InvocationState.RECEIVED);
            advance(session, request.invocationId(), InvocationState.DENIED);
        }
        useNonce(session, request);
        auditLog.record(AuditEventKind.VIOLATION, session.id(), subjects(request),
            AuditLog.details(
                "invocation_id", request.invocationId(),
                "code", code.code(),
                "name", code.wireName(),
                "reason", reason,
                "action", request.action(),
                "scope", request.scope(),
                "executor", request.executor().id(),
                "mode", contract == null ? null : contract.enforcement().mode().wireName(),
                "severity", "error",
                "outcome", "denied"));
        log.warn("Execution denied: session={}, invocation={}, code={}, reason={}",
            session.id().getValue(), request.invocationId(), code.wireName(), reason);

        boolean rolledBack = false;
        if (contract != null && contract.enforcement().rollsBackOnViolation()) {
            RollbackStatus status = rollback(request.invocationId());
            auditLog.record(AuditEventKind.ROLLBACK, session.id(), List.of(request.invocationId()),
                AuditLog.details("invocation_id", request.invocationId(), "status", status.name().toLowerCase(Locale.ROOT)));
            rolledBack = status == RollbackStatus.OK;
        }
        return new Denied(request.invocationId(), code, reason, rolledBack);
    }

    private Executed execute(Session session, ExecutionRequest request, Contract contract, Violation violation) {
        advance(session, request.invocationId(), InvocationState.RECEIVED);
        advance(session, request.invocationId(), InvocationState.VALIDATED);
        useNonce(session, request);

        if (violation != null) {
            EnforcementMode mode = contract.enforcement().mode();
            auditLog.record(AuditEventKind.VIOLATION, session.id(), subjects(request),
                AuditLog.details(
                    "invocation_id", request.invocationId(),
                    "code", violation.code().code(),
                    "name", violation.code().wireName(),
                    "reason", violation.reason(),
                    "action", request.action(),
                    "scope", request.scope(),
                    "executor", request.executor().id(),
                    "mode", mode.wireName(),
                    "severity", mode == EnforcementMode.PERMISSIVE ? "warning" : "info",
                    "outcome", "executed"));
            log.warn("Violation tolerated ({}): session={}, invocation={}, reason={}",
                mode.wireName(), session.id().getValue(), request.invocationId(), violation.reason());
        }

        if (session.phase() == SessionPhase.TOKEN) {
            sessionStore.transition(session, SessionPhase.EXECUTION);
        }
        advance(session, request.invocationId(), InvocationState.EXECUTING);
        Instant startedAt = clock.instant();
        auditLog.record(AuditEventKind.EXECUTION_STARTED, session.id(), subjects(request),
            AuditLog.details(
                "invocation_id", request.invocationId(),
                "action", request.action(),
                "scope", request.scope(),
                "executor", request.executor().id()));

        ExecutionStatus status = ExecutionStatus.SUCCESS;
        ObjectNode output;
        try {
            output = guard.call(Collaborator.ACTION_EXECUTOR, () -> actionExecutor.perform(request));
        } catch (IcnpException e) {
            log.error("Action executor failed: invocation={}", request.invocationId(), e);
            status = ExecutionStatus.FAILED;
            output = failureOutput(e.getCode(), e.getMessage(), e.isRetryable());
        } catch (RuntimeException e) {
            log.error("Action executor failed: invocation={}", request.invocationId(), e);
            status = ExecutionStatus.FAILED;
            output = failureOutput(IcnpErrorCode.INTERNAL_ERROR, e.getMessage(), false);
        }
        Instant endedAt = clock.instant();

        ExecutionResult result = new ExecutionResult(request.invocationId(), request.tokenId(), request.contractId(),
            status, startedAt, endedAt, output);
        advance(session, request.invocationId(), InvocationState.COMPLETED);
        auditLog.record(AuditEventKind.EXECUTION_COMPLETED, session.id(), subjects(request),
            AuditLog.details("invocation_id", request.invocationId(), "status", status.wireName()));

        return violation == null
            ? Executed.clean(result)
            : new Executed(result, violation.code(), violation.reason());
    }

    private RollbackStatus rollback(String invocationId) {
        try {
            return guard.callOrElse(Collaborator.ROLLBACK, () -> rollbackExecutor.rollback(invocationId), RollbackStatus.ERROR);
        } catch (RuntimeException e) {
            log.error("Rollback failed: invocation={}", invocationId, e);
            return RollbackStatus.ERROR;
        }
    }

    private static void advance(Session session, String invocationId, InvocationState next) {
        InvocationState current = session.invocationState(invocationId).orElse(null);
        if (current != null) {
            InvocationTransition.validate(current, next);
        } else if (next != InvocationState.RECEIVED) {
            throw new IllegalStateException("Invocation " + invocationId + " must start in RECEIVED (requested: " + next + ")");
        }
        session.recordInvocationState(invocationId, next);
    }

    private static void useNonce(Session session, ExecutionRequest request) {
        if (request.nonce() != null && !session.hasNonce(request.nonce())) {
            session.useNonce(request.nonce());
        }
    }

    private static List<String> subjects(ExecutionRequest request) {
        return List.of(request.invocationId(), request.executor().id());
    }

    private static ObjectNode failureOutput(IcnpErrorCode code, String message, boolean retryable) {
        ObjectNode output = ProtocolJson.objectNode();
        ObjectNode error = output.putObject("error");
        error.put("code", code.code());
        error.put("name", code.wireName());
        error.put("message", message == null ? code.wireName() : message);
        error.put("retryable", retryable);
        return output;
    }

    private record Violation(IcnpErrorCode code, String reason) {
    }
}
