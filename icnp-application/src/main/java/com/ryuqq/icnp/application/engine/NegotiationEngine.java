package com.ryuqq.icnp.application.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.application.session.SessionSnapshot;
import com.ryuqq.icnp.core.model.SessionId;

import java.time.Duration;
import java.util.Optional;

/**
 * ICNP 협상/집행 엔진.
 *
 * <p>인바운드 엔벨로프를 하나씩 처리하고 송신할 엔벨로프를 돌려줍니다.
 * 전송 계층은 알지 못하며, 송신은 호출자(예: TransportWorkerRunner)의 몫입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EngineResponse response = engine.handle(rawEnvelope);
 * response.getOutbound().forEach(transport::send);
 * </pre>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public interface NegotiationEngine {

    /**
     * 인바운드 엔벨로프 처리.
     *
     * <p>프로토콜 오류는 예외가 아니라 REJECTED 응답(error 엔벨로프 포함)으로 반환합니다.</p>
     *
     * @param rawEnvelope 엔벨로프 JSON
     * @return 처리 결과
     */
    EngineResponse handle(ObjectNode rawEnvelope);

    /**
     * 세션 스냅샷.
     *
     * @param sessionId 세션 ID
     * @return 스냅샷, 세션이 없으면 empty
     */
    Optional<SessionSnapshot> snapshot(SessionId sessionId);

    /**
     * 실행 단계의 세션을 정상 종료.
     *
     * @param sessionId 세션 ID
     * @return 세션이 있으면 true
     * @throws IllegalStateException execution 단계가 아닌 경우
     */
    boolean completeSession(SessionId sessionId);

    /**
     * 세션 중단. 발급된 토큰이 있으면 폐기합니다.
     *
     * @param sessionId 세션 ID
     * @param reason 사유
     * @return 세션이 있으면 true
     * @throws IllegalStateException 이미 종료된 세션인 경우
     */
    boolean abortSession(SessionId sessionId, String reason);

    /**
     * 세션 토큰 폐기.
     *
     * @param sessionId 세션 ID
     * @param reason 사유
     * @return 새로 폐기되었으면 true
     */
    boolean revokeToken(SessionId sessionId, String reason);

    /**
     * 기한이 지난 세션 만료 처리.
     *
     * @param batchSize 최대 처리 개수
     * @return 만료 처리한 세션 수
     */
    int expireOverdue(int batchSize);

    /**
     * 보관 기간이 지난 종료 세션 제거.
     *
     * @param retention 보관 기간
     * @return 제거한 세션 수
     */
    int evictTerminal(Duration retention);
}
