package com.ryuqq.icnp.core.intent;

/**
 * 의도가 요청하는 행위 하나.
 *
 * @param action 행위 이름
 * @param description 설명 (null 가능)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record RequestedAction(String action, String description) {

    public RequestedAction {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
    }
}
