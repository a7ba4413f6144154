package com.ryuqq.icnp.adapter.inmemory.audit;

import com.ryuqq.icnp.core.audit.AuditEvent;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.model.SessionId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryAuditSink 테스트.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class InMemoryAuditSinkTest {

    private static final SessionId SESSION_A = SessionId.random();
    private static final SessionId SESSION_B = SessionId.random();

    private final InMemoryAuditSink sink = new InMemoryAuditSink();

    private static AuditEvent event(long sequence, SessionId sessionId, AuditEventKind kind) {
        return new AuditEvent(sequence, kind, sessionId, List.of(), Instant.now(), Map.of("k", "v"));
    }

    @Test
    void append_sequence_순서로_정렬되어_보관() {
        sink.append(event(2, SESSION_A, AuditEventKind.INTENT_RECORDED));
        sink.append(event(1, SESSION_A, AuditEventKind.SESSION_CREATED));

        assertThat(sink.snapshot()).extracting(AuditEvent::sequence).containsExactly(1L, 2L);
    }

    @Test
    void append_중복_sequence는_예외() {
        sink.append(event(1, SESSION_A, AuditEventKind.SESSION_CREATED));

        assertThatThrownBy(() -> sink.append(event(1, SESSION_B, AuditEventKind.SESSION_CREATED)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already stored");
        assertThat(sink.size()).isEqualTo(1);
    }

    @Test
    void eventsFor_세션과_종류로_필터링() {
        sink.append(event(1, SESSION_A, AuditEventKind.SESSION_CREATED));
        sink.append(event(2, SESSION_B, AuditEventKind.SESSION_CREATED));
        sink.append(event(3, SESSION_A, AuditEventKind.VIOLATION));

        assertThat(sink.eventsFor(SESSION_A)).hasSize(2);
        assertThat(sink.eventsFor(SESSION_A, AuditEventKind.VIOLATION))
            .singleElement()
            .satisfies(found -> assertThat(found.sequence()).isEqualTo(3L));
    }
}
