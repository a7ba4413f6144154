package com.ryuqq.icnp.core.contract;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.model.Signature;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 협상된 계약.
 *
 * <p>제안 단계에서는 초안으로, 모든 실행자가 서명하고 승인 조건을 만족하면
 * 수락된 계약으로 고정됩니다. 서명은 {@link #withoutSignatures()}가 반환하는
 * 서명 없는 본문의 정규 바이트에 대해 계산됩니다.</p>
 *
 * @param contractId 계약 식별자
 * @param sessionId 대상 세션
 * @param issuedAt 발행 시각
 * @param parties 계약 당사자
 * @param agreedActions 합의 행위 목록
 * @param forbiddenActions 금지 행위 목록
 * @param constraints 불투명 제약 JSON
 * @param enforcement 집행 정책
 * @param approvals 승인 결정 목록
 * @param signatures 참여자 ID → 서명 (입력 순서 유지)
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Contract(
    String contractId,
    SessionId sessionId,
    Instant issuedAt,
    List<Actor> parties,
    List<AgreedAction> agreedActions,
    List<ForbiddenAction> forbiddenActions,
    ObjectNode constraints,
    Enforcement enforcement,
    List<Approval> approvals,
    Map<String, Signature> signatures
) {

    public Contract {
        if (contractId == null || contractId.isBlank()) {
            throw new IllegalArgumentException("contractId cannot be null or blank");
        }
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (issuedAt == null) {
            throw new IllegalArgumentException("issuedAt cannot be null");
        }
        parties = parties == null ? List.of() : List.copyOf(parties);
        agreedActions = agreedActions == null ? List.of() : List.copyOf(agreedActions);
        forbiddenActions = forbiddenActions == null ? List.of() : List.copyOf(forbiddenActions);
        constraints = constraints == null ? JsonNodeFactory.instance.objectNode() : constraints.deepCopy();
        if (enforcement == null) {
            enforcement = Enforcement.strictDefault();
        }
        approvals = approvals == null ? List.of() : List.copyOf(approvals);
        signatures = signatures == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(signatures));
    }

    @Override
    public ObjectNode constraints() {
        return constraints.deepCopy();
    }

    /**
     * 서명을 제거한 본문 (서명/검증 대상).
     *
     * @return 서명이 없는 Contract
     */
    public Contract withoutSignatures() {
        return new Contract(contractId, sessionId, issuedAt, parties, agreedActions, forbiddenActions,
            constraints, enforcement, approvals, Map.of());
    }

    /**
     * 서명을 추가한 사본 생성.
     *
     * @param participantId 서명 참여자
     * @param signature 서명
     * @return 서명이 추가된 Contract
     */
    public Contract withSignature(String participantId, Signature signature) {
        Map<String, Signature> merged = new LinkedHashMap<>(signatures);
        merged.put(participantId, signature);
        return new Contract(contractId, sessionId, issuedAt, parties, agreedActions, forbiddenActions,
            constraints, enforcement, approvals, merged);
    }

    /**
     * 합의 행위에 등장하는 실행자 ID 집합 (등장 순서 유지).
     *
     * @return 실행자 ID 집합
     */
    public Set<String> executorIds() {
        Set<String> executors = new LinkedHashSet<>();
        for (AgreedAction agreed : agreedActions) {
            executors.add(agreed.executorId());
        }
        return executors;
    }

    /**
     * 모든 실행자가 서명했는지 확인.
     *
     * @return 서명이 누락된 실행자가 없으면 true
     */
    public boolean signedByAllExecutors() {
        return signatures.keySet().containsAll(executorIds());
    }

    /**
     * 당사자 목록에서 참여자 조회.
     *
     * @param participantId 참여자 ID
     * @return 당사자, 없으면 empty
     */
    public Optional<Actor> findParty(String participantId) {
        return parties.stream().filter(party -> party.id().equals(participantId)).findFirst();
    }
}
