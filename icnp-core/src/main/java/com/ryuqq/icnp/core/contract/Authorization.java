package com.ryuqq.icnp.core.contract;

/**
 * 실행 권한 판정 결과.
 *
 * @param permitted 허용 여부
 * @param agreedAction 허용된 경우 근거 합의 항목 (거부 시 null)
 * @param reason 거부 사유 (허용 시 null)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Authorization(boolean permitted, AgreedAction agreedAction, String reason) {

    public Authorization {
        if (permitted && agreedAction == null) {
            throw new IllegalArgumentException("agreedAction cannot be null when permitted");
        }
        if (!permitted && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("reason cannot be null or blank when denied");
        }
    }

    public static Authorization permit(AgreedAction agreedAction) {
        return new Authorization(true, agreedAction, null);
    }

    public static Authorization deny(String reason) {
        return new Authorization(false, null, reason);
    }
}
