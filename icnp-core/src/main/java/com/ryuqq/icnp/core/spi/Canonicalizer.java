package com.ryuqq.icnp.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Canonical JSON SPI used for hashing and signing.
 *
 * <p>Two structurally equal JSON values must produce identical bytes regardless
 * of their member insertion order.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public interface Canonicalizer {

    /**
     * Produces canonical UTF-8 bytes for a JSON value.
     *
     * @param json the JSON value
     * @return canonical bytes
     * @throws IllegalArgumentException if the value cannot be canonicalized (e.g. NaN)
     */
    byte[] canonicalize(JsonNode json);
}
