package com.ryuqq.icnp.core.model;

/**
 * 프로토콜 참여자 (발신자, 수신자, 계약 당사자, 토큰 audience).
 *
 * @param id 참여자 식별자
 * @param role 참여자 역할
 * @param displayName 표시 이름 (선택, null 가능)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Actor(
    String id,
    ActorRole role,
    String displayName
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 비어 있거나 role이 null인 경우
     */
    public Actor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
    }

    /**
     * 표시 이름 없이 Actor 생성.
     *
     * @param id 참여자 식별자
     * @param role 참여자 역할
     * @return Actor 인스턴스
     */
    public static Actor of(String id, ActorRole role) {
        return new Actor(id, role, null);
    }
}
