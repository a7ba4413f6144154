package com.ryuqq.icnp.core.token;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TokenValidity 경계 테스트.
 *
 * <p>유효 구간은 [notBefore, notAfter) 입니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class TokenValidityTest {

    private static final Instant NOT_BEFORE = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant NOT_AFTER = Instant.parse("2026-01-01T00:10:00Z");

    private final TokenValidity validity = new TokenValidity(NOT_BEFORE, NOT_AFTER);

    @Test
    void contains_ExactlyNotBefore_IsValid() {
        assertTrue(validity.contains(NOT_BEFORE));
    }

    @Test
    void contains_OneMilliBeforeNotBefore_IsInvalid() {
        assertFalse(validity.contains(NOT_BEFORE.minusMillis(1)));
    }

    @Test
    void contains_OneMilliBeforeNotAfter_IsValid() {
        assertTrue(validity.contains(NOT_AFTER.minusMillis(1)));
    }

    @Test
    void contains_ExactlyNotAfter_IsInvalid() {
        assertFalse(validity.contains(NOT_AFTER));
    }

    @Test
    void constructor_NotAfterNotAfterNotBefore_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new TokenValidity(NOT_AFTER, NOT_BEFORE));
        assertThrows(IllegalArgumentException.class, () -> new TokenValidity(NOT_BEFORE, NOT_BEFORE));
    }

    @Test
    void invocationLimits_NonPositiveValues_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> new InvocationLimits(0, 3));
        assertThrows(IllegalArgumentException.class, () -> new InvocationLimits(null, 0));
        assertDoesNotThrow(() -> new InvocationLimits(null, 1));
    }
}
