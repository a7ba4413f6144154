package com.ryuqq.icnp.core.token;

import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.model.Signature;

import java.time.Instant;
import java.util.List;

/**
 * 실행 토큰.
 *
 * <p>수락된 계약에 세션을 묶는 서명된 증명입니다. 서명은 {@link #unsignedBody()}의
 * 정규 바이트에 대해 계산되며, 호출 카운터는 토큰이 아닌 TokenIssuer가 소유합니다.</p>
 *
 * @param tokenId 토큰 식별자
 * @param sessionId 세션 식별자
 * @param contractId 계약 식별자
 * @param issuer 발급자
 * @param audience 실행 가능 참여자 목록
 * @param issuedAt 발급 시각
 * @param validity 유효 구간
 * @param limits 호출 한도
 * @param binding 바인딩 해시
 * @param signature 서명 (서명 전 본문에서는 null)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record ExecutionToken(
    String tokenId,
    SessionId sessionId,
    String contractId,
    Actor issuer,
    List<Actor> audience,
    Instant issuedAt,
    TokenValidity validity,
    InvocationLimits limits,
    BindingHashes binding,
    Signature signature
) {

    public ExecutionToken {
        if (tokenId == null || tokenId.isBlank()) {
            throw new IllegalArgumentException("tokenId cannot be null or blank");
        }
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (contractId == null || contractId.isBlank()) {
            throw new IllegalArgumentException("contractId cannot be null or blank");
        }
        if (issuer == null) {
            throw new IllegalArgumentException("issuer cannot be null");
        }
        audience = audience == null ? List.of() : List.copyOf(audience);
        if (issuedAt == null) {
            throw new IllegalArgumentException("issuedAt cannot be null");
        }
        if (validity == null) {
            throw new IllegalArgumentException("validity cannot be null");
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }
        if (binding == null) {
            throw new IllegalArgumentException("binding cannot be null");
        }
    }

    /**
     * 서명을 제거한 본문.
     *
     * @return signature가 null인 사본
     */
    public ExecutionToken unsignedBody() {
        return withSignature(null);
    }

    /**
     * 서명을 설정한 사본.
     *
     * @param newSignature 서명
     * @return 서명이 설정된 토큰
     */
    public ExecutionToken withSignature(Signature newSignature) {
        return new ExecutionToken(tokenId, sessionId, contractId, issuer, audience, issuedAt,
            validity, limits, binding, newSignature);
    }

    /**
     * audience에 포함된 참여자인지 확인.
     *
     * @param actorId 참여자 ID
     * @return 포함되면 true
     */
    public boolean isAudience(String actorId) {
        return audience.stream().anyMatch(member -> member.id().equals(actorId));
    }
}
