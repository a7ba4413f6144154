package com.ryuqq.icnp.application.token;

/**
 * 호출 카운터 예약 결과.
 *
 * @param granted 예약 성공 여부
 * @param reason 거부 사유 (성공 시 null)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Reservation(boolean granted, String reason) {

    public Reservation {
        if (!granted && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("reason cannot be null or blank when denied");
        }
    }

    public static Reservation allowed() {
        return new Reservation(true, null);
    }

    public static Reservation denied(String reason) {
        return new Reservation(false, reason);
    }
}
