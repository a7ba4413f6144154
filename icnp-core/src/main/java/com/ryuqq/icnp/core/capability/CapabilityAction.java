package com.ryuqq.icnp.core.capability;

import java.util.List;

/**
 * 능력이 제공하는 행위 하나.
 *
 * @param action 행위 이름
 * @param scopes 지원 범위 목록 ("any"는 모든 범위)
 * @param requiresApproval 선택 시 승인 필요 여부
 * @param confidence 수행 신뢰도 [0, 1]
 * @param effects 부수 효과 설명 ("none"이면 부수 효과 없음)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record CapabilityAction(
    String action,
    List<String> scopes,
    boolean requiresApproval,
    double confidence,
    String effects
) {

    public static final String NO_EFFECTS = "none";
    public static final String ANY_SCOPE = "any";

    public CapabilityAction {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1] (current: " + confidence + ")");
        }
        if (effects == null || effects.isBlank()) {
            effects = NO_EFFECTS;
        }
    }

    /**
     * 외부 부수 효과가 있는지 확인.
     *
     * @return effects가 "none"이 아니면 true
     */
    public boolean hasSideEffects() {
        return !NO_EFFECTS.equalsIgnoreCase(effects);
    }

    /**
     * 주어진 범위를 지원하는지 확인.
     *
     * <p>scope가 null이면 범위를 묻지 않는 것으로 보고 true를 반환합니다.</p>
     *
     * @param scope 범위 (null 가능)
     * @return 지원하면 true
     */
    public boolean supportsScope(String scope) {
        if (scope == null) {
            return true;
        }
        return scopes.contains(scope) || scopes.contains(ANY_SCOPE);
    }
}
