package com.ryuqq.icnp.core.spi;

import java.util.Optional;

/**
 * Revocation list SPI for execution tokens.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public interface TokenRevocationList {

    /**
     * Revokes a token. Revoking twice keeps the first reason.
     *
     * @param tokenId token id
     * @param reason revocation reason
     * @return true if the token was not revoked before
     */
    boolean revoke(String tokenId, String reason);

    /**
     * @param tokenId token id
     * @return true if the token has been revoked
     */
    boolean isRevoked(String tokenId);

    /**
     * @param tokenId token id
     * @return the revocation reason, or empty if not revoked
     */
    Optional<String> reasonFor(String tokenId);
}
