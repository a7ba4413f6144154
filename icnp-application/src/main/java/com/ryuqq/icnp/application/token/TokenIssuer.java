package com.ryuqq.icnp.application.token;

import com.ryuqq.icnp.application.audit.AuditLog;
import com.ryuqq.icnp.application.negotiation.ApprovalGate;
import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.application.session.SessionStore;
import com.ryuqq.icnp.application.support.CollaboratorGuard;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.contract.AgreedAction;
import com.ryuqq.icnp.core.contract.Contract;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.message.PayloadCodec;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.ActorRole;
import com.ryuqq.icnp.core.model.Signature;
import com.ryuqq.icnp.core.protection.Collaborator;
import com.ryuqq.icnp.core.spi.Canonicalizer;
import com.ryuqq.icnp.core.spi.Signer;
import com.ryuqq.icnp.core.spi.TokenRevocationList;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import com.ryuqq.icnp.core.token.BindingHashes;
import com.ryuqq.icnp.core.token.ExecutionToken;
import com.ryuqq.icnp.core.token.InvocationLimits;
import com.ryuqq.icnp.core.token.TokenValidity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 실행 토큰 발급기.
 *
 * <p><strong>발급 순서:</strong></p>
 * <ol>
 *   <li>세션이 contract 단계인지 확인 (token_invalid)</li>
 *   <li>승인 게이트 (unauthorised_action)</li>
 *   <li>계약이 수락된 계약인지 확인 (token_invalid)</li>
 *   <li>바인딩 해시, 유효 구간 [now, now+TTL), 한도, audience 구성</li>
 *   <li>서명 없는 본문에 서명, 카운터 등록, token 단계로 전이</li>
 * </ol>
 *
 * <p>토큰을 발급하면 세션 기한이 토큰의 not_after까지 연장됩니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class TokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);

    private final Actor issuer;
    private final Duration tokenTtl;
    private final InvocationLimits limits;
    private final String keyRef;
    private final Signer signer;
    private final Canonicalizer canonicalizer;
    private final TokenRevocationList revocationList;
    private final BindingHasher bindingHasher;
    private final ApprovalGate approvalGate;
    private final SessionStore sessionStore;
    private final AuditLog auditLog;
    private final CollaboratorGuard guard;
    private final Clock clock;

    public TokenIssuer(Actor issuer, Duration tokenTtl, InvocationLimits limits, String keyRef,
                       Signer signer, Canonicalizer canonicalizer, TokenRevocationList revocationList,
                       BindingHasher bindingHasher, ApprovalGate approvalGate, SessionStore sessionStore,
                       AuditLog auditLog, CollaboratorGuard guard, Clock clock) {
        if (issuer == null || tokenTtl == null || limits == null || keyRef == null) {
            throw new IllegalArgumentException("issuer, tokenTtl, limits and keyRef cannot be null");
        }
        if (tokenTtl.isNegative() || tokenTtl.isZero()) {
            throw new IllegalArgumentException("tokenTtl must be positive (current: " + tokenTtl + ")");
        }
        if (signer == null || canonicalizer == null || revocationList == null || bindingHasher == null
            || approvalGate == null || sessionStore == null || auditLog == null || guard == null || clock == null) {
            throw new IllegalArgumentException("collaborators cannot be null");
        }
        this.issuer = issuer;
        this.tokenTtl = tokenTtl;
        this.limits = limits;
        this.keyRef = keyRef;
        this.signer = signer;
        this.canonicalizer = canonicalizer;
        this.revocationList = revocationList;
        this.bindingHasher = bindingHasher;
        this.approvalGate = approvalGate;
        this.sessionStore = sessionStore;
        this.auditLog = auditLog;
        this.guard = guard;
        this.clock = clock;
    }

    /**
     * 토큰 발급.
     *
     * @param session 세션 (락 보유 필요)
     * @param contract 수락된 계약
     * @return 서명된 토큰
     * @throws IcnpException token_invalid, unauthorised_action, internal_error
     */
    public ExecutionToken issue(Session session, Contract contract) {
        session.requireWriter();
        if (session.phase() != SessionPhase.CONTRACT) {
            throw new IcnpException(IcnpErrorCode.TOKEN_INVALID,
                "token can only be issued in contract phase (current: " + session.phase().wireName() + ")");
        }
        Contract accepted = session.acceptedContract();
        approvalGate.enforce(session, accepted != null ? accepted : contract);
        if (accepted == null || !accepted.equals(contract)) {
            throw new IcnpException(IcnpErrorCode.TOKEN_INVALID,
                "contract " + contract.contractId() + " is not the accepted contract of session " + session.id().getValue());
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        BindingHashes binding = bindingHasher.compute(session, accepted);
        List<Actor> audience = new ArrayList<>();
        for (String executorId : accepted.executorIds()) {
            audience.add(session.participant(executorId)
                .or(() -> accepted.findParty(executorId))
                .orElse(Actor.of(executorId, ActorRole.AGENT)));
        }

        ExecutionToken unsigned = new ExecutionToken(
            UUID.randomUUID().toString(),
            session.id(),
            accepted.contractId(),
            issuer,
            audience,
            now,
            new TokenValidity(now, now.plus(tokenTtl)),
            limits,
            binding,
            null);
        byte[] body = canonicalBody(unsigned);
        Signature signature = guard.call(Collaborator.SIGNER, () -> signer.sign(body, keyRef));
        ExecutionToken token = unsigned.withSignature(signature);

        session.attachToken(token, new InvocationCounters(limits));
        sessionStore.transition(session, SessionPhase.TOKEN);
        sessionStore.extendDeadline(session, token.validity().notAfter());
        auditLog.record(AuditEventKind.TOKEN_ISSUED, session.id(), List.of(token.tokenId(), accepted.contractId()),
            AuditLog.details(
                "token_id", token.tokenId(),
                "contract_id", accepted.contractId(),
                "not_before", token.validity().notBefore().toString(),
                "not_after", token.validity().notAfter().toString()));
        log.info("Token issued: {} for session {} (contract {})", token.tokenId(), session.id().getValue(), accepted.contractId());
        return token;
    }

    /**
     * 토큰 유효성 검사.
     *
     * <p>서명 검증이 타임아웃되면 유효하지 않은 것으로 봅니다.</p>
     *
     * @param token 토큰
     * @param now 검사 시각
     * @return not_before &lt;= now &lt; not_after, 서명 일치, 폐기되지 않음을 모두 만족하면 true
     */
    public boolean validate(ExecutionToken token, Instant now) {
        if (token == null || now == null) {
            return false;
        }
        if (!token.validity().contains(now)) {
            return false;
        }
        Signature signature = token.signature();
        if (signature == null) {
            return false;
        }
        byte[] body = canonicalBody(token.unsignedBody());
        boolean verified = guard.callOrElse(Collaborator.VERIFIER,
            () -> signer.verify(body, signature, signature.keyId()), false);
        if (!verified) {
            log.warn("Token signature rejected: {}", token.tokenId());
            return false;
        }
        return !revocationList.isRevoked(token.tokenId());
    }

    /**
     * 토큰 폐기.
     *
     * @param tokenId 토큰 ID
     * @param reason 사유
     * @return 새로 폐기되었으면 true
     */
    public boolean revoke(String tokenId, String reason) {
        return revoke(tokenId, reason, null);
    }

    /**
     * 세션 토큰 폐기.
     *
     * @param session 세션
     * @param reason 사유
     * @return 새로 폐기되었으면 true, 토큰이 없거나 이미 폐기되었으면 false
     */
    public boolean revoke(Session session, String reason) {
        ExecutionToken token = session.token();
        if (token == null) {
            return false;
        }
        return revoke(token.tokenId(), reason, session);
    }

    /**
     * 호출 1회 예약.
     *
     * @param session 세션 (토큰 보유)
     * @param executorId 실행자 ID
     * @param agreedAction 근거 합의 항목
     * @return 예약 결과
     */
    public Reservation tryConsume(Session session, String executorId, AgreedAction agreedAction) {
        InvocationCounters counters = session.counters();
        if (counters == null) {
            return Reservation.denied("no token issued for session " + session.id().getValue());
        }
        return counters.tryReserve(executorId, agreedAction);
    }

    private boolean revoke(String tokenId, String reason, Session session) {
        if (tokenId == null || tokenId.isBlank()) {
            throw new IllegalArgumentException("tokenId cannot be null or blank");
        }
        String effectiveReason = reason == null || reason.isBlank() ? "revoked" : reason;
        boolean revoked = revocationList.revoke(tokenId, effectiveReason);
        if (revoked) {
            auditLog.record(AuditEventKind.TOKEN_REVOKED, session == null ? null : session.id(), List.of(tokenId),
                AuditLog.details("token_id", tokenId, "reason", effectiveReason));
            log.info("Token revoked: {} ({})", tokenId, effectiveReason);
        }
        return revoked;
    }

    private byte[] canonicalBody(ExecutionToken unsigned) {
        return guard.call(Collaborator.CANONICALIZER, () -> canonicalizer.canonicalize(PayloadCodec.tokenTree(unsigned)));
    }
}
