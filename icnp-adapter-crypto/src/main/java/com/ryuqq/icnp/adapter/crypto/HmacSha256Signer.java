package com.ryuqq.icnp.adapter.crypto;

import com.ryuqq.icnp.core.model.Signature;
import com.ryuqq.icnp.core.spi.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HMAC-SHA256 기반 참조 Signer.
 *
 * <p>키 참조(keyRef)마다 서명 주체와 공유 비밀키를 등록해 둡니다. 서명 값은 표준
 * Base64, 비교는 {@link MessageDigest#isEqual(byte[], byte[])}로 상수 시간에 수행합니다.</p>
 *
 * <p><strong>검증 실패 조건:</strong></p>
 * <ul>
 *   <li>등록되지 않은 keyRef</li>
 *   <li>alg가 {@value #ALGORITHM}가 아님</li>
 *   <li>signed_by가 키 소유자와 다름</li>
 *   <li>값 불일치 또는 Base64 형식 오류</li>
 * </ul>
 *
 * <p>비대칭 서명이 아니므로 운영 환경용이 아닙니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class HmacSha256Signer implements Signer {

    private static final Logger log = LoggerFactory.getLogger(HmacSha256Signer.class);

    public static final String ALGORITHM = "hmac-sha256";
    private static final String JCA_ALGORITHM = "HmacSHA256";

    private final Map<String, SigningKey> keyring = new ConcurrentHashMap<>();
    private final Clock clock;

    public HmacSha256Signer() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock signed_at 기록용 시계
     */
    public HmacSha256Signer(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 키 등록.
     *
     * @param keyRef 키 참조 (서명의 key_id)
     * @param ownerId 서명 주체 (서명의 signed_by)
     * @param secret 비밀키
     * @return this (체이닝)
     * @throws IllegalArgumentException 인자가 비어 있는 경우
     */
    public HmacSha256Signer register(String keyRef, String ownerId, byte[] secret) {
        if (keyRef == null || keyRef.isBlank()) {
            throw new IllegalArgumentException("keyRef cannot be null or blank");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId cannot be null or blank");
        }
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("secret cannot be null or empty");
        }
        keyring.put(keyRef, new SigningKey(ownerId, secret.clone()));
        return this;
    }

    @Override
    public Signature sign(byte[] bytes, String keyRef) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        SigningKey key = keyring.get(keyRef);
        if (key == null) {
            throw new IllegalArgumentException("unknown keyRef: " + keyRef);
        }
        Instant signedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        String value = Base64.getEncoder().encodeToString(mac(key.secret(), bytes));
        return new Signature(ALGORITHM, value, keyRef, key.ownerId(), signedAt);
    }

    @Override
    public boolean verify(byte[] bytes, Signature signature, String keyRef) {
        if (bytes == null || signature == null) {
            return false;
        }
        SigningKey key = keyring.get(keyRef);
        if (key == null) {
            log.debug("Signature verification failed: unknown keyRef {}", keyRef);
            return false;
        }
        if (!ALGORITHM.equalsIgnoreCase(signature.alg())) {
            log.debug("Signature verification failed: unsupported alg {}", signature.alg());
            return false;
        }
        if (!key.ownerId().equals(signature.signedBy())) {
            log.debug("Signature verification failed: signed_by {} is not the owner of {}",
                signature.signedBy(), keyRef);
            return false;
        }
        byte[] presented;
        try {
            presented = Base64.getDecoder().decode(signature.value());
        } catch (IllegalArgumentException e) {
            log.debug("Signature verification failed: value is not Base64 ({})", e.getMessage());
            return false;
        }
        return MessageDigest.isEqual(mac(key.secret(), bytes), presented);
    }

    private static byte[] mac(byte[] secret, byte[] bytes) {
        try {
            Mac mac = Mac.getInstance(JCA_ALGORITHM);
            mac.init(new SecretKeySpec(secret, JCA_ALGORITHM));
            return mac.doFinal(bytes);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }

    private record SigningKey(String ownerId, byte[] secret) {
    }
}
