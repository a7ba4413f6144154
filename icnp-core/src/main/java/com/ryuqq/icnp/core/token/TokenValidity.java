package com.ryuqq.icnp.core.token;

import java.time.Instant;

/**
 * 토큰 유효 구간 [notBefore, notAfter).
 *
 * @param notBefore 유효 시작 시각 (포함)
 * @param notAfter 유효 종료 시각 (제외)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record TokenValidity(Instant notBefore, Instant notAfter) {

    public TokenValidity {
        if (notBefore == null || notAfter == null) {
            throw new IllegalArgumentException("notBefore and notAfter cannot be null");
        }
        if (!notAfter.isAfter(notBefore)) {
            throw new IllegalArgumentException(
                "notAfter must be after notBefore (notBefore: " + notBefore + ", notAfter: " + notAfter + ")");
        }
    }

    /**
     * 시각이 유효 구간에 포함되는지 확인.
     *
     * @param now 검사 시각
     * @return notBefore &lt;= now &lt; notAfter이면 true
     */
    public boolean contains(Instant now) {
        return !now.isBefore(notBefore) && now.isBefore(notAfter);
    }
}
