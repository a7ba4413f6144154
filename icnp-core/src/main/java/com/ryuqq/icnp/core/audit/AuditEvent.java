package com.ryuqq.icnp.core.audit;

import com.ryuqq.icnp.core.model.SessionId;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 감사 기록 한 건.
 *
 * <p>sequence는 AuditLog가 부여하며 전체 세션에 걸쳐 단조 증가하고 빈틈이 없습니다.
 * details는 삽입 순서를 유지하는 문자열 맵입니다.</p>
 *
 * @param sequence 전역 순번 (1부터 시작)
 * @param kind 기록 종류
 * @param sessionId 세션 ID (세션을 특정할 수 없는 거절 기록에서는 null)
 * @param subjectIds 관련 식별자 목록 (메시지, 계약, 토큰, 호출 ID 등)
 * @param timestamp 기록 시각
 * @param details 상세 정보
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record AuditEvent(
    long sequence,
    AuditEventKind kind,
    SessionId sessionId,
    List<String> subjectIds,
    Instant timestamp,
    Map<String, String> details
) {

    public AuditEvent {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        subjectIds = subjectIds == null ? List.of() : List.copyOf(subjectIds);
        details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * details 값 조회.
     *
     * @param key 키
     * @return 값, 없으면 null
     */
    public String detail(String key) {
        return details.get(key);
    }
}
