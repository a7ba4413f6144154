package com.ryuqq.icnp.application.engine;

import com.ryuqq.icnp.application.negotiation.ConfidenceMatchScorer;
import com.ryuqq.icnp.core.executor.ActionExecutor;
import com.ryuqq.icnp.core.protection.CollaboratorTimeoutPolicy;
import com.ryuqq.icnp.core.protection.FixedCollaboratorTimeoutPolicy;
import com.ryuqq.icnp.core.spi.AuditSink;
import com.ryuqq.icnp.core.spi.Canonicalizer;
import com.ryuqq.icnp.core.spi.CapabilityMatchScorer;
import com.ryuqq.icnp.core.spi.RollbackExecutor;
import com.ryuqq.icnp.core.spi.Signer;
import com.ryuqq.icnp.core.spi.TokenRevocationList;

/**
 * 엔진 외부 협력자 묶음.
 *
 * <p>scorer가 null이면 {@link ConfidenceMatchScorer}, timeoutPolicy가 null이면
 * 모든 협력자에 5초 타임아웃을 적용합니다.</p>
 *
 * @param signer 서명/검증
 * @param canonicalizer 정규 JSON 변환
 * @param auditSink 감사 저장소
 * @param revocationList 토큰 폐기 목록
 * @param rollbackExecutor 위반 시 롤백
 * @param actionExecutor 외부 행위 실행
 * @param scorer 능력 점수기
 * @param timeoutPolicy 협력자 타임아웃 정책
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record EngineCollaborators(
    Signer signer,
    Canonicalizer canonicalizer,
    AuditSink auditSink,
    TokenRevocationList revocationList,
    RollbackExecutor rollbackExecutor,
    ActionExecutor actionExecutor,
    CapabilityMatchScorer scorer,
    CollaboratorTimeoutPolicy timeoutPolicy
) {

    public static final long DEFAULT_TIMEOUT_MS = 5000;

    public EngineCollaborators {
        if (signer == null) {
            throw new IllegalArgumentException("signer cannot be null");
        }
        if (canonicalizer == null) {
            throw new IllegalArgumentException("canonicalizer cannot be null");
        }
        if (auditSink == null) {
            throw new IllegalArgumentException("auditSink cannot be null");
        }
        if (revocationList == null) {
            throw new IllegalArgumentException("revocationList cannot be null");
        }
        if (rollbackExecutor == null) {
            throw new IllegalArgumentException("rollbackExecutor cannot be null");
        }
        if (actionExecutor == null) {
            throw new IllegalArgumentException("actionExecutor cannot be null");
        }
        if (scorer == null) {
            scorer = new ConfidenceMatchScorer();
        }
        if (timeoutPolicy == null) {
            timeoutPolicy = new FixedCollaboratorTimeoutPolicy(DEFAULT_TIMEOUT_MS);
        }
    }

    public EngineCollaborators withScorer(CapabilityMatchScorer scorer) {
        return new EngineCollaborators(signer, canonicalizer, auditSink, revocationList,
            rollbackExecutor, actionExecutor, scorer, timeoutPolicy);
    }

    public EngineCollaborators withTimeoutPolicy(CollaboratorTimeoutPolicy timeoutPolicy) {
        return new EngineCollaborators(signer, canonicalizer, auditSink, revocationList,
            rollbackExecutor, actionExecutor, scorer, timeoutPolicy);
    }
}
