package com.ryuqq.icnp.application.engine;

import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.ActorRole;
import com.ryuqq.icnp.core.token.InvocationLimits;

import java.time.Duration;

/**
 * 협상 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>icnpVersion: 송신 엔벨로프 버전, major 값이 수신 허용 버전 (기본 "1.0.0")</li>
 *   <li>engineActor: 엔진의 참여자 정보, 토큰 issuer (기본 icnp-engine / orchestrator)</li>
 *   <li>negotiationTtl: 세션 생성부터 토큰 발급까지의 기한 (기본 15분)</li>
 *   <li>tokenTtl: 토큰 유효 기간 (기본 10분)</li>
 *   <li>maxInvocationsPerActor: 실행자별 최대 호출 수 (기본 3)</li>
 *   <li>maxInvocationsTotal: 전체 최대 호출 수, null이면 무제한 (기본 20)</li>
 *   <li>signingKeyRef: 토큰 서명 키 참조 (기본 "engine-key")</li>
 *   <li>minimumMatchScore: 계약에 선택 가능한 최소 능력 점수 (기본 0.0)</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 * @param icnpVersion 프로토콜 버전 (MAJOR.MINOR.PATCH)
 * @param engineActor 엔진 참여자
 * @param negotiationTtl 협상 기한 (양수)
 * @param tokenTtl 토큰 유효 기간 (양수)
 * @param maxInvocationsPerActor 실행자별 최대 호출 수 (1 이상)
 * @param maxInvocationsTotal 전체 최대 호출 수 (null 또는 1 이상)
 * @param signingKeyRef 서명 키 참조
 * @param minimumMatchScore 최소 능력 점수 [0, 1]
 */
public record EngineConfig(
    String icnpVersion,
    Actor engineActor,
    Duration negotiationTtl,
    Duration tokenTtl,
    int maxInvocationsPerActor,
    Integer maxInvocationsTotal,
    String signingKeyRef,
    double minimumMatchScore
) {

    public static final String DEFAULT_VERSION = "1.0.0";

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineConfig {
        if (icnpVersion == null || !icnpVersion.matches("\\d+\\.\\d+\\.\\d+")) {
            throw new IllegalArgumentException("icnpVersion must be MAJOR.MINOR.PATCH (current: " + icnpVersion + ")");
        }
        if (engineActor == null) {
            throw new IllegalArgumentException("engineActor cannot be null");
        }
        if (negotiationTtl == null || negotiationTtl.isNegative() || negotiationTtl.isZero()) {
            throw new IllegalArgumentException("negotiationTtl must be positive (current: " + negotiationTtl + ")");
        }
        if (tokenTtl == null || tokenTtl.isNegative() || tokenTtl.isZero()) {
            throw new IllegalArgumentException("tokenTtl must be positive (current: " + tokenTtl + ")");
        }
        if (maxInvocationsPerActor <= 0) {
            throw new IllegalArgumentException(
                "maxInvocationsPerActor must be positive (current: " + maxInvocationsPerActor + ")");
        }
        if (maxInvocationsTotal != null && maxInvocationsTotal <= 0) {
            throw new IllegalArgumentException(
                "maxInvocationsTotal must be positive (current: " + maxInvocationsTotal + ")");
        }
        if (signingKeyRef == null || signingKeyRef.isBlank()) {
            throw new IllegalArgumentException("signingKeyRef cannot be null or blank");
        }
        if (Double.isNaN(minimumMatchScore) || minimumMatchScore < 0.0 || minimumMatchScore > 1.0) {
            throw new IllegalArgumentException("minimumMatchScore must be within [0, 1] (current: " + minimumMatchScore + ")");
        }
    }

    /**
     * 기본 설정.
     *
     * @return 기본값으로 채운 EngineConfig
     */
    public static EngineConfig defaults() {
        return new EngineConfig(
            DEFAULT_VERSION,
            Actor.of("icnp-engine", ActorRole.ORCHESTRATOR),
            Duration.ofMinutes(15),
            Duration.ofMinutes(10),
            3,
            20,
            "engine-key",
            0.0);
    }

    /**
     * 수신 허용 major 버전.
     *
     * @return icnpVersion의 major 값
     */
    public int supportedMajorVersion() {
        return Integer.parseInt(icnpVersion.substring(0, icnpVersion.indexOf('.')));
    }

    /**
     * 토큰에 기록할 호출 한도.
     *
     * @return InvocationLimits
     */
    public InvocationLimits invocationLimits() {
        return new InvocationLimits(maxInvocationsTotal, maxInvocationsPerActor);
    }

    public EngineConfig withEngineActor(Actor engineActor) {
        return new EngineConfig(icnpVersion, engineActor, negotiationTtl, tokenTtl,
            maxInvocationsPerActor, maxInvocationsTotal, signingKeyRef, minimumMatchScore);
    }

    public EngineConfig withNegotiationTtl(Duration negotiationTtl) {
        return new EngineConfig(icnpVersion, engineActor, negotiationTtl, tokenTtl,
            maxInvocationsPerActor, maxInvocationsTotal, signingKeyRef, minimumMatchScore);
    }

    public EngineConfig withTokenTtl(Duration tokenTtl) {
        return new EngineConfig(icnpVersion, engineActor, negotiationTtl, tokenTtl,
            maxInvocationsPerActor, maxInvocationsTotal, signingKeyRef, minimumMatchScore);
    }

    public EngineConfig withMaxInvocationsPerActor(int maxInvocationsPerActor) {
        return new EngineConfig(icnpVersion, engineActor, negotiationTtl, tokenTtl,
            maxInvocationsPerActor, maxInvocationsTotal, signingKeyRef, minimumMatchScore);
    }

    public EngineConfig withMaxInvocationsTotal(Integer maxInvocationsTotal) {
        return new EngineConfig(icnpVersion, engineActor, negotiationTtl, tokenTtl,
            maxInvocationsPerActor, maxInvocationsTotal, signingKeyRef, minimumMatchScore);
    }

    public EngineConfig withSigningKeyRef(String signingKeyRef) {
        return new EngineConfig(icnpVersion, engineActor, negotiationTtl, tokenTtl,
            maxInvocationsPerActor, maxInvocationsTotal, signingKeyRef, minimumMatchScore);
    }

    public EngineConfig withMinimumMatchScore(double minimumMatchScore) {
        return new EngineConfig(icnpVersion, engineActor, negotiationTtl, tokenTtl,
            maxInvocationsPerActor, maxInvocationsTotal, signingKeyRef, minimumMatchScore);
    }
}
