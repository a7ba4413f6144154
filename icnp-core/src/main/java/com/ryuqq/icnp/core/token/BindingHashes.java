package com.ryuqq.icnp.core.token;

import com.ryuqq.icnp.core.model.HashValue;

/**
 * 토큰이 세션 산출물에 묶여 있음을 보이는 해시 묶음.
 *
 * @param intentHash 의도 해시
 * @param contractHash 수락된 계약 해시
 * @param capabilitiesHash 공개된 능력 목록 해시
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record BindingHashes(HashValue intentHash, HashValue contractHash, HashValue capabilitiesHash) {

    public BindingHashes {
        if (intentHash == null || contractHash == null || capabilitiesHash == null) {
            throw new IllegalArgumentException("binding hashes cannot be null");
        }
    }
}
