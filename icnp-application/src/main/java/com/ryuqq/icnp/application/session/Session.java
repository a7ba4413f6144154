package com.ryuqq.icnp.application.session;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.application.token.InvocationCounters;
import com.ryuqq.icnp.core.capability.Capability;
import com.ryuqq.icnp.core.contract.Contract;
import com.ryuqq.icnp.core.intent.Intent;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.MessageId;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.statemachine.InvocationState;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import com.ryuqq.icnp.core.token.ExecutionToken;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 하나의 협상 세션 상태.
 *
 * <p>{@link SessionStore}만 생성하며, 변경 메서드는 세션 락을 쥔 스레드에서만 호출할 수
 * 있습니다 ({@link #requireWriter()}). 단계(phase)와 기한은 락 없이 읽을 수 있도록
 * volatile로 공개합니다.</p>
 *
 * <p>송신한 메시지 ID 집합은 응답 조립이 락 밖에서도 이뤄지므로 별도의 동시성 집합으로
 * 관리합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class Session {

    private final SessionId id;
    private final Actor initiator;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<MessageId> emitted = ConcurrentHashMap.newKeySet();

    private volatile SessionPhase phase = SessionPhase.INTENT;
    private volatile Instant deadline;
    private volatile Instant terminalAt;

    private final Map<String, Actor> participants = new LinkedHashMap<>();
    private final Set<MessageId> seen = new HashSet<>();

    private Intent intent;
    private ObjectNode intentPayload;

    private final Map<String, Map<String, Capability>> capabilitiesByOwner = new LinkedHashMap<>();
    private final List<Capability> disclosureOrder = new ArrayList<>();

    private Contract draftContract;
    private Contract acceptedContract;

    private ExecutionToken token;
    private InvocationCounters counters;
    private final Map<String, InvocationState> invocations = new LinkedHashMap<>();
    private final Set<String> nonces = new HashSet<>();

    Session(SessionId id, Actor initiator, Instant createdAt, Instant deadline) {
        if (id == null || initiator == null || createdAt == null || deadline == null) {
            throw new IllegalArgumentException("id, initiator, createdAt and deadline cannot be null");
        }
        this.id = id;
        this.initiator = initiator;
        this.createdAt = createdAt;
        this.deadline = deadline;
        this.participants.put(initiator.id(), initiator);
    }

    ReentrantLock lock() {
        return lock;
    }

    /**
     * 현재 스레드가 세션 락을 쥐고 있는지 검증.
     *
     * @throws IllegalStateException 락을 쥐지 않은 경우
     */
    public void requireWriter() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session " + id.getValue() + " must be mutated under its writer lock");
        }
    }

    // ===== identity / lifecycle =====

    public SessionId id() {
        return id;
    }

    public Actor initiator() {
        return initiator;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public SessionPhase phase() {
        return phase;
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }

    public Instant deadline() {
        return deadline;
    }

    public Instant terminalAt() {
        return terminalAt;
    }

    void applyPhase(SessionPhase next, Instant now) {
        requireWriter();
        this.phase = next;
        if (next.isTerminal()) {
            this.terminalAt = now;
        }
    }

    void applyDeadline(Instant newDeadline) {
        requireWriter();
        this.deadline = newDeadline;
    }

    // ===== participants / messages =====

    public void addParticipant(Actor actor) {
        requireWriter();
        participants.putIfAbsent(actor.id(), actor);
    }

    public Optional<Actor> participant(String actorId) {
        return Optional.ofNullable(participants.get(actorId));
    }

    public List<Actor> participants() {
        return List.copyOf(participants.values());
    }

    public boolean hasSeen(MessageId messageId) {
        return seen.contains(messageId);
    }

    public void markSeen(MessageId messageId) {
        requireWriter();
        seen.add(messageId);
    }

    /**
     * seen 집합에서 제거. 재시도 가능한 실패 뒤 같은 메시지의 재전달을 다시 처리하기 위해 사용합니다.
     */
    public void forgetSeen(MessageId messageId) {
        requireWriter();
        seen.remove(messageId);
    }

    public int seenCount() {
        return seen.size();
    }

    public boolean hasEmitted(MessageId messageId) {
        return emitted.contains(messageId);
    }

    public void markEmitted(MessageId messageId) {
        emitted.add(messageId);
    }

    // ===== intent =====

    public Intent intent() {
        return intent;
    }

    public ObjectNode intentPayload() {
        return intentPayload == null ? null : intentPayload.deepCopy();
    }

    public void recordIntent(Intent newIntent, ObjectNode payload) {
        requireWriter();
        if (intent != null) {
            throw new IllegalStateException("Intent already recorded for session " + id.getValue());
        }
        this.intent = newIntent;
        this.intentPayload = payload.deepCopy();
    }

    // ===== capabilities =====

    public Optional<Capability> capability(String ownerId, String capabilityId) {
        Map<String, Capability> owned = capabilitiesByOwner.get(ownerId);
        return owned == null ? Optional.empty() : Optional.ofNullable(owned.get(capabilityId));
    }

    public Optional<Capability> findCapability(String capabilityId) {
        return disclosureOrder.stream().filter(c -> c.capabilityId().equals(capabilityId)).findFirst();
    }

    /**
     * 공개 순서대로 모든 능력.
     *
     * @return 읽기 전용 목록
     */
    public List<Capability> capabilities() {
        return List.copyOf(disclosureOrder);
    }

    public void addCapability(Capability capability) {
        requireWriter();
        Map<String, Capability> owned = capabilitiesByOwner.computeIfAbsent(capability.ownerId(), k -> new LinkedHashMap<>());
        if (owned.containsKey(capability.capabilityId())) {
            throw new IllegalStateException("Capability already disclosed: " + capability.capabilityId());
        }
        owned.put(capability.capabilityId(), capability);
        disclosureOrder.add(capability);
    }

    // ===== contract =====

    public Contract draftContract() {
        return draftContract;
    }

    public void replaceDraft(Contract draft) {
        requireWriter();
        if (acceptedContract != null) {
            throw new IllegalStateException("Contract already accepted for session " + id.getValue());
        }
        this.draftContract = draft;
    }

    public Contract acceptedContract() {
        return acceptedContract;
    }

    public void acceptContract(Contract contract) {
        requireWriter();
        if (acceptedContract != null) {
            throw new IllegalStateException("Contract already accepted for session " + id.getValue());
        }
        this.draftContract = contract;
        this.acceptedContract = contract;
    }

    /**
     * 수락 취소. 토큰 발급에 실패했을 때만 사용하며, 서명이 모두 모인 초안은 그대로 남습니다.
     *
     * @throws IllegalStateException 이미 토큰이 발급된 경우
     */
    public void withdrawAcceptance() {
        requireWriter();
        if (token != null) {
            throw new IllegalStateException("Token already issued for session " + id.getValue());
        }
        this.acceptedContract = null;
    }

    // ===== token / invocations =====

    public ExecutionToken token() {
        return token;
    }

    public InvocationCounters counters() {
        return counters;
    }

    public void attachToken(ExecutionToken issued, InvocationCounters invocationCounters) {
        requireWriter();
        if (token != null) {
            throw new IllegalStateException("Token already issued for session " + id.getValue());
        }
        this.token = issued;
        this.counters = invocationCounters;
    }

    public boolean hasInvocation(String invocationId) {
        return invocations.containsKey(invocationId);
    }

    public Optional<InvocationState> invocationState(String invocationId) {
        return Optional.ofNullable(invocations.get(invocationId));
    }

    public void recordInvocationState(String invocationId, InvocationState state) {
        requireWriter();
        invocations.put(invocationId, state);
    }

    public Map<String, InvocationState> invocations() {
        return Map.copyOf(invocations);
    }

    public boolean hasNonce(String nonce) {
        return nonces.contains(nonce);
    }

    public void useNonce(String nonce) {
        requireWriter();
        nonces.add(nonce);
    }

    @Override
    public String toString() {
        return "Session{id=" + id.getValue() + ", phase=" + phase + '}';
    }
}
