package com.ryuqq.icnp.core.intent;

import java.util.List;

/**
 * 의도에 첨부된 데이터 취급 정책.
 *
 * @param allowedDataClasses 허용 데이터 등급 (예: "public")
 * @param retentionDays 보존 기간 (일, 0 이상)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record DataPolicy(List<String> allowedDataClasses, int retentionDays) {

    public DataPolicy {
        allowedDataClasses = allowedDataClasses == null ? List.of() : List.copyOf(allowedDataClasses);
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be non-negative (current: " + retentionDays + ")");
        }
    }

    /**
     * 제약 없는 기본 정책.
     *
     * @return 허용 등급 없음, 보존 0일
     */
    public static DataPolicy none() {
        return new DataPolicy(List.of(), 0);
    }
}
