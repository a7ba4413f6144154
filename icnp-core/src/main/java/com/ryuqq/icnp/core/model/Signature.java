package com.ryuqq.icnp.core.model;

import java.time.Instant;

/**
 * 계약 서명 또는 토큰 서명.
 *
 * <p>서명 스킴 자체는 {@code Signer} SPI가 결정하며, 이 record는
 * 와이어 포맷 {@code {alg, value, key_id, signed_by, signed_at}}을 그대로 담습니다.</p>
 *
 * @param alg 서명 알고리즘 (예: "hmac-sha256")
 * @param value 인코딩된 서명 값
 * @param keyId 서명 키 참조
 * @param signedBy 서명한 참여자 식별자
 * @param signedAt 서명 시각
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Signature(
    String alg,
    String value,
    String keyId,
    String signedBy,
    Instant signedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 비어 있는 경우
     */
    public Signature {
        if (alg == null || alg.isBlank()) {
            throw new IllegalArgumentException("alg cannot be null or blank");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value cannot be null or blank");
        }
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId cannot be null or blank");
        }
        if (signedBy == null || signedBy.isBlank()) {
            throw new IllegalArgumentException("signedBy cannot be null or blank");
        }
        if (signedAt == null) {
            throw new IllegalArgumentException("signedAt cannot be null");
        }
    }
}
