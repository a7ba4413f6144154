package com.ryuqq.icnp.adapter.inmemory.rollback;

import com.ryuqq.icnp.core.spi.RollbackExecutor;
import com.ryuqq.icnp.core.spi.RollbackStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 롤백 요청을 기록만 하는 {@link RollbackExecutor}.
 *
 * <p>실제로 되돌릴 외부 상태가 없는 환경(테스트, 데모)에서 사용합니다.
 * {@link #failFor(String)}로 지정한 invocation은 {@link RollbackStatus#ERROR}를 반환합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class InMemoryRollbackJournal implements RollbackExecutor {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRollbackJournal.class);

    private final List<String> rolledBack = new CopyOnWriteArrayList<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();

    @Override
    public RollbackStatus rollback(String invocationId) {
        if (invocationId == null || invocationId.isBlank()) {
            throw new IllegalArgumentException("invocationId cannot be null or blank");
        }
        rolledBack.add(invocationId);
        if (failing.contains(invocationId)) {
            log.warn("Rollback failed: invocationId={}", invocationId);
            return RollbackStatus.ERROR;
        }
        log.info("Rollback recorded: invocationId={}", invocationId);
        return RollbackStatus.OK;
    }

    /**
     * 지정한 invocation의 롤백이 실패하도록 설정.
     *
     * @param invocationId invocation ID
     * @return this (체이닝)
     */
    public InMemoryRollbackJournal failFor(String invocationId) {
        failing.add(invocationId);
        return this;
    }

    /**
     * 롤백 요청된 invocation 목록 (요청 순서).
     *
     * @return 읽기 전용 사본
     */
    public List<String> rolledBack() {
        return List.copyOf(rolledBack);
    }
}
