package com.ryuqq.icnp.application.session;

import com.ryuqq.icnp.core.intent.Intent;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.statemachine.InvocationState;
import com.ryuqq.icnp.core.statemachine.SessionPhase;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 세션의 읽기 전용 사본.
 *
 * @param sessionId 세션 ID
 * @param phase 현재 단계
 * @param initiatorId 개시자
 * @param participantIds 참여자 (등장 순서)
 * @param seenMessageCount 수신 처리한 메시지 수
 * @param intent 기록된 의도 (없으면 null)
 * @param capabilityIds 공개된 능력 ID (공개 순서)
 * @param contractId 현재 계약 ID (없으면 null)
 * @param contractAccepted 계약 수락 여부
 * @param tokenId 발급된 토큰 ID (없으면 null)
 * @param invocations invocation별 상태
 * @param deadline 세션 기한
 * @param terminalAt 종료 시각 (진행 중이면 null)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record SessionSnapshot(
    SessionId sessionId,
    SessionPhase phase,
    String initiatorId,
    List<String> participantIds,
    int seenMessageCount,
    Intent intent,
    List<String> capabilityIds,
    String contractId,
    boolean contractAccepted,
    String tokenId,
    Map<String, InvocationState> invocations,
    Instant deadline,
    Instant terminalAt
) {

    public SessionSnapshot {
        participantIds = List.copyOf(participantIds);
        capabilityIds = List.copyOf(capabilityIds);
        invocations = Map.copyOf(invocations);
    }

    static SessionSnapshot of(Session session) {
        session.requireWriter();
        return new SessionSnapshot(
            session.id(),
            session.phase(),
            session.initiator().id(),
            session.participants().stream().map(actor -> actor.id()).toList(),
            session.seenCount(),
            session.intent(),
            session.capabilities().stream().map(capability -> capability.capabilityId()).toList(),
            session.draftContract() == null ? null : session.draftContract().contractId(),
            session.acceptedContract() != null,
            session.token() == null ? null : session.token().tokenId(),
            session.invocations(),
            session.deadline(),
            session.terminalAt()
        );
    }
}
