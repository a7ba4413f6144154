package com.ryuqq.icnp.core.capability;

import java.util.List;
import java.util.Optional;

/**
 * 참여자가 공개한 능력.
 *
 * <p>참여자별, 세션별로 추가만 가능합니다. 같은 id로 동일한 능력을 다시 공개하면
 * 무시되고, 다른 내용을 공개하면 거절됩니다. 동일성은 record 동등성으로 판단합니다.</p>
 *
 * @param capabilityId 능력 식별자
 * @param ownerId 소유 참여자 식별자
 * @param name 이름 (null 가능)
 * @param description 설명 (null 가능)
 * @param actions 제공 행위 목록 (1개 이상)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Capability(
    String capabilityId,
    String ownerId,
    String name,
    String description,
    List<CapabilityAction> actions
) {

    public Capability {
        if (capabilityId == null || capabilityId.isBlank()) {
            throw new IllegalArgumentException("capabilityId cannot be null or blank");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId cannot be null or blank");
        }
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("actions cannot be null or empty");
        }
        actions = List.copyOf(actions);
    }

    /**
     * 행위와 범위를 제공하는 항목 조회.
     *
     * @param action 행위 이름
     * @param scope 범위 (null 가능)
     * @return 일치하는 행위, 없으면 empty
     */
    public Optional<CapabilityAction> findAction(String action, String scope) {
        return actions.stream()
            .filter(candidate -> candidate.action().equals(action))
            .filter(candidate -> candidate.supportsScope(scope))
            .findFirst();
    }
}
