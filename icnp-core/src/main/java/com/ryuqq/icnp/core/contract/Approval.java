package com.ryuqq.icnp.core.contract;

import java.time.Instant;

/**
 * 계약에 기록된 승인 결정.
 *
 * @param approverId 승인자 식별자
 * @param decision 결정
 * @param decidedAt 결정 시각
 * @param comment 코멘트 (null 가능)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Approval(String approverId, ApprovalDecision decision, Instant decidedAt, String comment) {

    public Approval {
        if (approverId == null || approverId.isBlank()) {
            throw new IllegalArgumentException("approverId cannot be null or blank");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
        if (decidedAt == null) {
            throw new IllegalArgumentException("decidedAt cannot be null");
        }
    }
}
