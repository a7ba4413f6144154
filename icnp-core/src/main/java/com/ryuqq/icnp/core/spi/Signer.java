package com.ryuqq.icnp.core.spi;

import com.ryuqq.icnp.core.model.Signature;

/**
 * Signing SPI for contract acknowledgements and execution tokens.
 *
 * <p>The engine never interprets signature bytes. It hands canonical bytes to this
 * collaborator and trusts only the boolean result of {@link #verify}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called concurrently from different sessions</li>
 *   <li>{@code verify} must return false (not throw) for unknown keys or wrong algorithms</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public interface Signer {

    /**
     * Signs canonical bytes with the referenced key.
     *
     * @param bytes canonical bytes to sign
     * @param keyRef key reference
     * @return signature whose {@code keyId} is {@code keyRef}
     * @throws IllegalArgumentException if the key is unknown
     */
    Signature sign(byte[] bytes, String keyRef);

    /**
     * Verifies a signature over canonical bytes.
     *
     * @param bytes canonical bytes that were signed
     * @param signature signature to check
     * @param keyRef key reference
     * @return true only if the signature is valid for the key and its owner
     */
    boolean verify(byte[] bytes, Signature signature, String keyRef);
}
