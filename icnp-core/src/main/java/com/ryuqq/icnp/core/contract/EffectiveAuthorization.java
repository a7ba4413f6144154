package com.ryuqq.icnp.core.contract;

import java.util.List;

/**
 * 금지 우선(forbidden dominance) 규칙에 따른 실효 권한 계산.
 *
 * <p><strong>판정 순서:</strong></p>
 * <ol>
 *   <li>실행자, 행위, (지정된 경우) 범위가 일치하는 합의 항목을 찾는다</li>
 *   <li>실효 범위(요청 범위, 없으면 합의 범위)가 금지 항목에 해당하면 거부한다</li>
 *   <li>합의 항목이 없으면 거부한다</li>
 * </ol>
 *
 * <p>같은 행위+범위가 합의와 금지 양쪽에 있으면 항상 거부됩니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class EffectiveAuthorization {

    private EffectiveAuthorization() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 실행 요청의 권한 판정.
     *
     * @param contract 수락된 계약
     * @param executorId 실행자 ID
     * @param action 행위 이름
     * @param scope 요청 범위 (null 가능)
     * @return 판정 결과
     * @throws IllegalArgumentException contract, executorId, action이 null인 경우
     */
    public static Authorization authorize(Contract contract, String executorId, String action, String scope) {
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        if (executorId == null || action == null) {
            throw new IllegalArgumentException("executorId and action cannot be null");
        }

        List<AgreedAction> candidates = contract.agreedActions().stream()
            .filter(agreed -> agreed.executorId().equals(executorId))
            .filter(agreed -> agreed.action().equals(action))
            .filter(agreed -> scope == null || agreed.scope() == null || agreed.scope().equals(scope))
            .toList();

        if (candidates.isEmpty()) {
            return Authorization.deny(String.format(
                "action '%s'%s is not agreed for executor %s", action, scopeSuffix(scope), executorId));
        }

        for (AgreedAction candidate : candidates) {
            String effectiveScope = scope != null ? scope : candidate.scope();
            if (isForbidden(contract, action, effectiveScope)) {
                return Authorization.deny(String.format(
                    "action '%s'%s is forbidden by contract", action, scopeSuffix(effectiveScope)));
            }
        }
        return Authorization.permit(candidates.get(0));
    }

    /**
     * 행위+범위가 금지 목록에 해당하는지 확인.
     *
     * @param contract 계약
     * @param action 행위 이름
     * @param scope 범위 (null 가능)
     * @return 금지 대상이면 true
     */
    public static boolean isForbidden(Contract contract, String action, String scope) {
        return contract.forbiddenActions().stream().anyMatch(forbidden -> forbidden.covers(action, scope));
    }

    private static String scopeSuffix(String scope) {
        return scope == null ? "" : " (scope '" + scope + "')";
    }
}
