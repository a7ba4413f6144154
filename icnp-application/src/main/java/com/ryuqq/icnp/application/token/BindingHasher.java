package com.ryuqq.icnp.application.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.application.support.CollaboratorGuard;
import com.ryuqq.icnp.core.contract.Contract;
import com.ryuqq.icnp.core.message.PayloadCodec;
import com.ryuqq.icnp.core.model.HashValue;
import com.ryuqq.icnp.core.protection.Collaborator;
import com.ryuqq.icnp.core.spi.Canonicalizer;
import com.ryuqq.icnp.core.token.BindingHashes;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 토큰 바인딩 해시 계산기.
 *
 * <p>의도 payload, 수락된 계약, 공개 순서대로 모은 {@code {"capabilities": [...]}}의
 * 정규 바이트에 대한 SHA-256 (소문자 16진수)입니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class BindingHasher {

    private final Canonicalizer canonicalizer;
    private final CollaboratorGuard guard;

    public BindingHasher(Canonicalizer canonicalizer, CollaboratorGuard guard) {
        if (canonicalizer == null || guard == null) {
            throw new IllegalArgumentException("canonicalizer and guard cannot be null");
        }
        this.canonicalizer = canonicalizer;
        this.guard = guard;
    }

    /**
     * 세션 산출물과 계약으로 바인딩 해시 계산.
     *
     * @param session 세션 (의도와 능력 보유)
     * @param contract 수락된 계약
     * @return 바인딩 해시
     */
    public BindingHashes compute(Session session, Contract contract) {
        return new BindingHashes(
            hash(session.intentPayload()),
            hash(PayloadCodec.contractTree(contract)),
            hash(PayloadCodec.writeCapabilities(session.capabilities())));
    }

    /**
     * 정규 바이트에 대한 SHA-256 해시.
     *
     * @param json JSON 값
     * @return sha256 HashValue
     */
    public HashValue hash(JsonNode json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        byte[] canonical = guard.call(Collaborator.CANONICALIZER, () -> canonicalizer.canonicalize(json));
        return HashValue.sha256(HexFormat.of().formatHex(sha256(canonical)));
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
