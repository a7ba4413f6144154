package com.ryuqq.icnp.application.audit;

import com.ryuqq.icnp.application.support.CollaboratorGuard;
import com.ryuqq.icnp.core.audit.AuditEvent;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.protection.Collaborator;
import com.ryuqq.icnp.core.spi.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 단조 증가 sequence를 부여하는 감사 기록기.
 *
 * <p>sequence 발급과 sink 기록을 하나의 락 안에서 수행하여 동시 세션 사이에서도
 * sequence가 순서대로 증가합니다. 한 번 발급한 sequence는 다시 쓰지 않습니다.
 * sink 기록이 실패하거나 시간 초과되면 그 번호는 빈 자리로 남고 internal_error로
 * 전파합니다. 시간 초과된 기록이 뒤늦게 저장될 수 있기 때문입니다. sink가 돌려준
 * sequence가 발급한 번호보다 크면 그 값으로 따라갑니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final AuditSink sink;
    private final CollaboratorGuard guard;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantLock appendLock = new ReentrantLock();

    public AuditLog(AuditSink sink, CollaboratorGuard guard, Clock clock) {
        if (sink == null || guard == null || clock == null) {
            throw new IllegalArgumentException("sink, guard and clock cannot be null");
        }
        this.sink = sink;
        this.guard = guard;
        this.clock = clock;
    }

    /**
     * 감사 이벤트 기록.
     *
     * @param kind 이벤트 종류
     * @param sessionId 세션 ID (null 가능)
     * @param subjectIds 대상 식별자 (null 항목은 제외)
     * @param details 상세 정보 (입력 순서 유지)
     * @return 기록된 이벤트
     * @throws IcnpException sink 기록 실패 (INTERNAL_ERROR)
     */
    public AuditEvent record(AuditEventKind kind, SessionId sessionId, List<String> subjectIds,
                             Map<String, String> details) {
        List<String> subjects = new ArrayList<>();
        if (subjectIds != null) {
            subjectIds.stream().filter(Objects::nonNull).forEach(subjects::add);
        }

        appendLock.lock();
        try {
            long next = sequence.incrementAndGet();
            AuditEvent event = new AuditEvent(next, kind, sessionId, subjects, clock.instant(), details);
            long stored;
            try {
                stored = guard.call(Collaborator.AUDIT_SINK, () -> sink.append(event));
            } catch (RuntimeException e) {
                log.error("Audit append failed: kind={}, sequence={}", kind.wireName(), next, e);
                if (e instanceof IcnpException icnp) {
                    throw icnp;
                }
                throw new IcnpException(IcnpErrorCode.INTERNAL_ERROR, "audit sink failed: " + e.getMessage(), true, null, e);
            }
            if (stored > next) {
                sequence.accumulateAndGet(stored, Math::max);
                log.warn("Audit sink stored sequence {} for event #{}; continuing from {}", stored, next, stored);
            }
            log.debug("Audit #{} {} session={}", next, kind.wireName(), sessionId);
            return event;
        } finally {
            appendLock.unlock();
        }
    }

    public AuditEvent record(AuditEventKind kind, SessionId sessionId, Map<String, String> details) {
        return record(kind, sessionId, List.of(), details);
    }

    /**
     * key, value 쌍으로 details 생성. 값이 null인 쌍은 제외합니다.
     *
     * @param keyValues key1, value1, key2, value2, ...
     * @return 입력 순서를 유지하는 Map
     * @throws IllegalArgumentException 인자 개수가 홀수인 경우
     */
    public static Map<String, String> details(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs (current length: " + keyValues.length + ")");
        }
        Map<String, String> details = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                details.put(keyValues[i], keyValues[i + 1]);
            }
        }
        return details;
    }

    /**
     * 마지막으로 발급된 sequence. 실패한 기록의 번호도 포함합니다.
     *
     * @return sequence (발급이 없으면 0)
     */
    public long lastSequence() {
        return sequence.get();
    }
}
