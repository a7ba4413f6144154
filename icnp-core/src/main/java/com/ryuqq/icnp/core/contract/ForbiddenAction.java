package com.ryuqq.icnp.core.contract;

/**
 * 계약에서 명시적으로 금지된 행위.
 *
 * <p>금지 항목은 같은 행위+범위의 합의 항목보다 항상 우선합니다.
 * scope가 null이거나 "any"이면 해당 행위의 모든 범위를 금지합니다.</p>
 *
 * @param action 행위 이름
 * @param scope 범위 (null 가능)
 * @param reason 금지 사유
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record ForbiddenAction(String action, String scope, String reason) {

    public static final String ANY_SCOPE = "any";

    public ForbiddenAction {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        if (reason == null || reason.isBlank()) {
            reason = "forbidden by contract";
        }
    }

    /**
     * 모든 범위를 금지하는지 확인.
     *
     * @return scope가 null이거나 "any"이면 true
     */
    public boolean coversAllScopes() {
        return scope == null || ANY_SCOPE.equals(scope);
    }

    /**
     * 행위+범위가 이 금지 항목에 해당하는지 확인.
     *
     * <p>범위가 지정되지 않은 요청(null)은 해당 행위의 모든 범위를 포함하므로
     * 범위 한정 금지 항목에도 해당합니다.</p>
     *
     * @param candidateAction 행위 이름
     * @param candidateScope 범위 (null 가능)
     * @return 금지 대상이면 true
     */
    public boolean covers(String candidateAction, String candidateScope) {
        if (!action.equals(candidateAction)) {
            return false;
        }
        return coversAllScopes() || candidateScope == null || scope.equals(candidateScope);
    }
}
