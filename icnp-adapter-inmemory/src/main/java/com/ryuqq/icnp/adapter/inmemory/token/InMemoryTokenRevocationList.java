package com.ryuqq.icnp.adapter.inmemory.token;

import com.ryuqq.icnp.core.spi.TokenRevocationList;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link TokenRevocationList} SPI.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class InMemoryTokenRevocationList implements TokenRevocationList {

    private final ConcurrentHashMap<String, String> revoked = new ConcurrentHashMap<>();

    @Override
    public boolean revoke(String tokenId, String reason) {
        if (tokenId == null || tokenId.isBlank()) {
            throw new IllegalArgumentException("tokenId cannot be null or blank");
        }
        return revoked.putIfAbsent(tokenId, reason == null ? "" : reason) == null;
    }

    @Override
    public boolean isRevoked(String tokenId) {
        return tokenId != null && revoked.containsKey(tokenId);
    }

    @Override
    public Optional<String> reasonFor(String tokenId) {
        return tokenId == null ? Optional.empty() : Optional.ofNullable(revoked.get(tokenId));
    }

    public int size() {
        return revoked.size();
    }
}
