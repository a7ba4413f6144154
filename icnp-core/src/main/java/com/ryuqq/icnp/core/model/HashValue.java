package com.ryuqq.icnp.core.model;

/**
 * 알고리즘 이름이 붙은 해시 값.
 *
 * @param alg 해시 알고리즘 (예: "sha256")
 * @param value 16진수 소문자 해시 값
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record HashValue(String alg, String value) {

    public static final String SHA256 = "sha256";

    public HashValue {
        if (alg == null || alg.isBlank()) {
            throw new IllegalArgumentException("alg cannot be null or blank");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value cannot be null or blank");
        }
    }

    /**
     * SHA-256 해시 값 생성.
     *
     * @param hex 16진수 해시 문자열
     * @return HashValue 인스턴스
     */
    public static HashValue sha256(String hex) {
        return new HashValue(SHA256, hex);
    }
}
