package com.ryuqq.icnp.application.session;

import com.ryuqq.icnp.application.audit.AuditLog;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.statemachine.PhaseTransition;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 세션 저장소.
 *
 * <p>세션별 {@link java.util.concurrent.locks.ReentrantLock}으로 쓰기를 직렬화합니다.
 * 세션에 접근할 때마다 협상 TTL을 검사하여 기한이 지난 세션을 EXPIRED로 전이합니다
 * (lazy expiry). 주기적 정리는 {@link #expireOverdue(int)}, {@link #evictTerminal(Duration)}로
 * 수행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Session session = store.createSession(sessionId, initiator).orElseThrow();
 * store.withSession(session, s -&gt; {
 *     store.transition(s, SessionPhase.CAPABILITY);
 *     return null;
 * });
 * </pre>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final ConcurrentHashMap<SessionId, Session> sessions = new ConcurrentHashMap<>();
    private final AuditLog auditLog;
    private final Clock clock;
    private final Duration negotiationTtl;

    public SessionStore(AuditLog auditLog, Clock clock, Duration negotiationTtl) {
        if (auditLog == null || clock == null) {
            throw new IllegalArgumentException("auditLog and clock cannot be null");
        }
        if (negotiationTtl == null || negotiationTtl.isNegative() || negotiationTtl.isZero()) {
            throw new IllegalArgumentException("negotiationTtl must be positive (current: " + negotiationTtl + ")");
        }
        this.auditLog = auditLog;
        this.clock = clock;
        this.negotiationTtl = negotiationTtl;
    }

    /**
     * 세션 생성.
     *
     * @param id 세션 ID
     * @param initiator 개시자
     * @return 생성된 세션, 이미 존재하면 empty
     */
    public Optional<Session> createSession(SessionId id, Actor initiator) {
        Instant now = clock.instant();
        Session created = new Session(id, initiator, now, now.plus(negotiationTtl));
        if (sessions.putIfAbsent(id, created) != null) {
            return Optional.empty();
        }
        auditLog.record(AuditEventKind.SESSION_CREATED, id, List.of(initiator.id()),
            AuditLog.details("initiator", initiator.id(), "deadline", created.deadline().toString()));
        log.info("Session created: {} by {}", id.getValue(), initiator.id());
        return Optional.of(created);
    }

    public Optional<Session> find(SessionId id) {
        return Optional.ofNullable(sessions.get(id));
    }

    /**
     * 세션 락을 쥔 상태로 작업 실행.
     *
     * <p>작업 전에 기한 초과 여부를 검사합니다.</p>
     *
     * @param session 세션
     * @param work 작업
     * @return 작업 결과
     */
    public <T> T withSession(Session session, Function<Session, T> work) {
        session.lock().lock();
        try {
            expireIfOverdue(session);
            return work.apply(session);
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * 단계 전이 (전이표 검증 후 감사 기록).
     *
     * @param session 세션 (락 보유 필요)
     * @param target 다음 단계
     * @throws IllegalStateException 유효하지 않은 전이이거나 락을 쥐지 않은 경우
     */
    public void transition(Session session, SessionPhase target) {
        session.requireWriter();
        SessionPhase from = session.phase();
        PhaseTransition.validate(from, target);
        session.applyPhase(target, clock.instant());
        auditLog.record(AuditEventKind.PHASE_TRANSITION, session.id(),
            AuditLog.details("from", from.wireName(), "to", target.wireName()));
        log.debug("Session {} phase {} → {}", session.id().getValue(), from, target);
    }

    /**
     * 기한이 지났으면 EXPIRED로 전이.
     *
     * @param session 세션 (락 보유 필요)
     * @return 이번 호출로 만료되었으면 true
     */
    public boolean expireIfOverdue(Session session) {
        session.requireWriter();
        if (session.isTerminal() || clock.instant().isBefore(session.deadline())) {
            return false;
        }
        SessionPhase from = session.phase();
        transition(session, SessionPhase.EXPIRED);
        auditLog.record(AuditEventKind.SESSION_EXPIRED, session.id(),
            AuditLog.details("phase", from.wireName(), "deadline", session.deadline().toString()));
        log.info("Session expired: {} (was {})", session.id().getValue(), from);
        return true;
    }

    /**
     * 세션 기한 연장. 현재 기한보다 이른 값은 무시합니다.
     *
     * @param session 세션 (락 보유 필요)
     * @param newDeadline 새 기한
     */
    public void extendDeadline(Session session, Instant newDeadline) {
        session.requireWriter();
        if (newDeadline.isAfter(session.deadline())) {
            session.applyDeadline(newDeadline);
        }
    }

    /**
     * 기한이 지난 세션을 최대 batchSize개 만료 처리.
     *
     * @param batchSize 최대 처리 개수
     * @return 만료 처리한 세션 수
     */
    public int expireOverdue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        Instant now = clock.instant();
        int expired = 0;
        for (Session session : sessions.values()) {
            if (expired >= batchSize) {
                break;
            }
            if (session.isTerminal() || now.isBefore(session.deadline())) {
                continue;
            }
            boolean changed = withLock(session, () -> expireIfOverdue(session));
            if (changed) {
                expired++;
            }
        }
        return expired;
    }

    /**
     * 종료 후 retention이 지난 세션 제거.
     *
     * @param retention 보관 기간
     * @return 제거한 세션 수
     */
    public int evictTerminal(Duration retention) {
        if (retention == null || retention.isNegative()) {
            throw new IllegalArgumentException("retention cannot be null or negative");
        }
        Instant cutoff = clock.instant().minus(retention);
        List<SessionId> evicted = new ArrayList<>();
        for (Session session : sessions.values()) {
            Instant terminalAt = session.terminalAt();
            if (terminalAt != null && !terminalAt.isAfter(cutoff)) {
                evicted.add(session.id());
            }
        }
        evicted.forEach(sessions::remove);
        if (!evicted.isEmpty()) {
            log.info("Evicted {} terminal sessions", evicted.size());
        }
        return evicted.size();
    }

    /**
     * 세션 스냅샷.
     *
     * @param id 세션 ID
     * @return 스냅샷, 세션이 없으면 empty
     */
    public Optional<SessionSnapshot> snapshot(SessionId id) {
        return find(id).map(session -> withLock(session, () -> SessionSnapshot.of(session)));
    }

    public int size() {
        return sessions.size();
    }

    private static <T> T withLock(Session session, Supplier<T> work) {
        session.lock().lock();
        try {
            return work.get();
        } finally {
            session.lock().unlock();
        }
    }
}
