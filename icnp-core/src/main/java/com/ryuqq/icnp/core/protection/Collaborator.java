package com.ryuqq.icnp.core.protection;

/**
 * 타임아웃 정책이 적용되는 외부 협력자 종류.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum Collaborator {

    /** 토큰 서명. */
    SIGNER,

    /** 계약/토큰 서명 검증. 타임아웃은 검증 실패로 취급. */
    VERIFIER,

    /** 정규 JSON 변환 (바인딩 해시, 서명 대상). */
    CANONICALIZER,

    /** 위반 시 롤백. */
    ROLLBACK,

    /** 외부 행위 실행. */
    ACTION_EXECUTOR,

    /** 감사 기록 저장. */
    AUDIT_SINK
}
