package com.ryuqq.icnp.adapter.inmemory.audit;

import com.ryuqq.icnp.core.audit.AuditEvent;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.spi.AuditSink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link AuditSink} SPI.
 *
 * <p>{@link ConcurrentSkipListMap}에 sequence 순서로 보관합니다. 같은 sequence를
 * 두 번 기록하려 하면 {@link IllegalStateException}을 던집니다.</p>
 *
 * <p><strong>Limitations:</strong> 프로세스 재시작 시 기록이 사라집니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class InMemoryAuditSink implements AuditSink {

    private final ConcurrentSkipListMap<Long, AuditEvent> events = new ConcurrentSkipListMap<>();

    @Override
    public long append(AuditEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        AuditEvent existing = events.putIfAbsent(event.sequence(), event);
        if (existing != null) {
            throw new IllegalStateException("Audit sequence already stored: " + event.sequence());
        }
        return event.sequence();
    }

    /**
     * 전체 기록 (sequence 오름차순).
     *
     * @return 읽기 전용 사본
     */
    public List<AuditEvent> snapshot() {
        return List.copyOf(events.values());
    }

    /**
     * 세션별 기록 (sequence 오름차순).
     *
     * @param sessionId 세션 ID
     * @return 해당 세션의 기록
     */
    public List<AuditEvent> eventsFor(SessionId sessionId) {
        List<AuditEvent> result = new ArrayList<>();
        for (AuditEvent event : events.values()) {
            if (sessionId.equals(event.sessionId())) {
                result.add(event);
            }
        }
        return result;
    }

    /**
     * 세션별, 종류별 기록.
     *
     * @param sessionId 세션 ID
     * @param kind 이벤트 종류
     * @return 일치하는 기록
     */
    public List<AuditEvent> eventsFor(SessionId sessionId, AuditEventKind kind) {
        return eventsFor(sessionId).stream().filter(event -> event.kind() == kind).toList();
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
