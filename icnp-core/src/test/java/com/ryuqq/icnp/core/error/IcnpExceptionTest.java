package com.ryuqq.icnp.core.error;

import com.ryuqq.icnp.core.model.MessageId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IcnpException, IcnpErrorCode 테스트.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class IcnpExceptionTest {

    @Test
    void errorCodes_HaveStableWireCodes() {
        assertEquals("ICNP-001", IcnpErrorCode.INVALID_INTENT.code());
        assertEquals("capability_mismatch", IcnpErrorCode.CAPABILITY_MISMATCH.wireName());
        assertEquals("ICNP-006", IcnpErrorCode.INTERNAL_ERROR.code());
        assertEquals(IcnpErrorCode.TOKEN_INVALID, IcnpErrorCode.fromCode("ICNP-005").orElseThrow());
        assertTrue(IcnpErrorCode.fromCode("ICNP-999").isEmpty());
    }

    @Test
    void relatedTo_WithoutExistingId_ReturnsCopyWithCause() {
        // Given
        IcnpException original = new IcnpException(IcnpErrorCode.TOKEN_INVALID, "expired");
        MessageId messageId = MessageId.random();

        // When
        IcnpException related = original.relatedTo(messageId);

        // Then
        assertNotSame(original, related);
        assertEquals(messageId, related.getRelatedMessageId());
        assertEquals(IcnpErrorCode.TOKEN_INVALID, related.getCode());
        assertEquals("expired", related.getMessage());
        assertSame(original, related.getCause());
    }

    @Test
    void relatedTo_WithExistingId_ReturnsSameInstance() {
        IcnpException original = new IcnpException(
            IcnpErrorCode.INTERNAL_ERROR, "boom", true, MessageId.random(), null);

        assertSame(original, original.relatedTo(MessageId.random()));
        assertTrue(original.isRetryable());
    }

    @Test
    void relatedTo_NullId_ReturnsSameInstance() {
        IcnpException original = new IcnpException(IcnpErrorCode.INVALID_INTENT, "bad");

        assertSame(original, original.relatedTo(null));
        assertFalse(original.isRetryable());
    }
}
