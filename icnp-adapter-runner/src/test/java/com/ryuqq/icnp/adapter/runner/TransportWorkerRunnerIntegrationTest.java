package com.ryuqq.icnp.adapter.runner;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.adapter.crypto.HmacSha256Signer;
import com.ryuqq.icnp.adapter.crypto.JacksonCanonicalizer;
import com.ryuqq.icnp.adapter.inmemory.audit.InMemoryAuditSink;
import com.ryuqq.icnp.adapter.inmemory.rollback.InMemoryRollbackJournal;
import com.ryuqq.icnp.adapter.inmemory.token.InMemoryTokenRevocationList;
import com.ryuqq.icnp.adapter.inmemory.transport.InMemoryTransport;
import com.ryuqq.icnp.application.engine.EngineCollaborators;
import com.ryuqq.icnp.application.engine.EngineComponents;
import com.ryuqq.icnp.application.engine.EngineConfig;
import com.ryuqq.icnp.application.engine.EngineResponse;
import com.ryuqq.icnp.application.engine.NegotiationEngine;
import com.ryuqq.icnp.application.session.SessionSnapshot;
import com.ryuqq.icnp.core.audit.AuditLevel;
import com.ryuqq.icnp.core.capability.Capability;
import com.ryuqq.icnp.core.capability.CapabilityAction;
import com.ryuqq.icnp.core.intent.DataPolicy;
import com.ryuqq.icnp.core.intent.Intent;
import com.ryuqq.icnp.core.intent.IntentConstraints;
import com.ryuqq.icnp.core.intent.RequestedAction;
import com.ryuqq.icnp.core.intent.RiskTolerance;
import com.ryuqq.icnp.core.message.EnvelopeCodec;
import com.ryuqq.icnp.core.message.MessageEnvelope;
import com.ryuqq.icnp.core.message.MessageType;
import com.ryuqq.icnp.core.message.PayloadCodec;
import com.ryuqq.icnp.core.message.ProtocolJson;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.ActorRole;
import com.ryuqq.icnp.core.model.MessageId;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.protection.FixedCollaboratorTimeoutPolicy;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryTransport와 실제 엔진을 연결한 러너/리퍼 통합 테스트.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class TransportWorkerRunnerIntegrationTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    private static final Actor INITIATOR = Actor.of("orchestrator-1", ActorRole.ORCHESTRATOR);
    private static final Actor AGENT_A = Actor.of("agent-a", ActorRole.AGENT);

    private SteppingClock clock;
    private EngineComponents components;
    private NegotiationEngine engine;
    private InMemoryTransport transport;
    private TransportWorkerRunner runner;

    @BeforeEach
    void setUp() {
        clock = new SteppingClock(START);
        HmacSha256Signer signer = new HmacSha256Signer(clock)
            .register("engine-key", "icnp-engine", "secret-engine".getBytes(StandardCharsets.UTF_8));
        EngineCollaborators collaborators = new EngineCollaborators(
            signer,
            new JacksonCanonicalizer(),
            new InMemoryAuditSink(),
            new InMemoryTokenRevocationList(),
            new InMemoryRollbackJournal(),
            request -> ProtocolJson.objectNode().put("performed", request.action()),
            null,
            FixedCollaboratorTimeoutPolicy.inline());
        components = EngineComponents.wire(EngineConfig.defaults(), collaborators, clock);
        engine = components.engine();
        transport = new InMemoryTransport();
        runner = new TransportWorkerRunner(transport, engine, new TransportWorkerConfig().withLanes(2));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        runner.shutdown();
        components.shutdown();
    }

    private ObjectNode envelope(MessageType type, SessionId sessionId, Actor sender, ObjectNode payload) {
        return EnvelopeCodec.encode(new MessageEnvelope("1.0.0", type, null, MessageId.random(), sessionId,
            clock.instant(), sender, null, null, null, payload, null));
    }

    private ObjectNode intentDeclaration(SessionId sessionId) {
        Intent intent = new Intent(
            "summarize quarterly report",
            List.of(new RequestedAction("read", null)),
            List.of("summary"),
            new IntentConstraints(RiskTolerance.LOW, false, DataPolicy.none(), false, AuditLevel.STANDARD));
        return envelope(MessageType.INTENT_DECLARATION, sessionId, INITIATOR, PayloadCodec.writeIntent(intent));
    }

    private ObjectNode capabilityDisclosure(SessionId sessionId) {
        Capability capability = new Capability("cap-a", AGENT_A.id(), null, null,
            List.of(new CapabilityAction("read", List.of("reports"), false, 0.9, null)));
        return envelope(MessageType.CAPABILITY_DISCLOSURE, sessionId, AGENT_A,
            PayloadCodec.writeCapabilities(List.of(capability)));
    }

    private void pumpAll() throws Exception {
        while (transport.queueSize() > 0) {
            runner.pump().get(5, TimeUnit.SECONDS);
        }
    }

    // ============================================================
    // 1. 펌프
    // ============================================================

    @Test
    void 전달된_엔벨로프가_엔진을_거쳐_세션을_진행시킨다() throws Exception {
        // given
        SessionId sessionId = SessionId.random();
        transport.deliver(intentDeclaration(sessionId), 0);

        // when
        pumpAll();
        transport.deliver(capabilityDisclosure(sessionId), 0);
        pumpAll();

        // then
        assertThat(transport.inFlightSize()).isZero();
        assertThat(transport.dlqSize()).isZero();
        assertThat(engine.snapshot(sessionId)).hasValueSatisfying(snapshot -> {
            assertThat(snapshot.phase()).isEqualTo(SessionPhase.CAPABILITY);
            assertThat(snapshot.capabilityIds()).containsExactly("cap-a");
        });
        assertThat(runner.getAcknowledgedCount()).isEqualTo(2);
    }

    @Test
    void 재전달된_엔벨로프는_중복으로_ack되고_상태를_바꾸지_않는다() throws Exception {
        // given
        SessionId sessionId = SessionId.random();
        ObjectNode intent = intentDeclaration(sessionId);
        transport.deliver(intent, 0);
        pumpAll();

        // when
        transport.deliver(intent, 0);
        pumpAll();

        // then
        assertThat(transport.sent()).isEmpty();
        assertThat(engine.snapshot(sessionId)).hasValueSatisfying(snapshot -> {
            assertThat(snapshot.phase()).isEqualTo(SessionPhase.INTENT);
            assertThat(snapshot.seenMessageCount()).isEqualTo(1);
        });
        assertThat(runner.getAcknowledgedCount()).isEqualTo(2);
    }

    @Test
    void 알수없는_세션의_메시지는_error_엔벨로프를_송신하고_ack된다() throws Exception {
        // given
        transport.deliver(capabilityDisclosure(SessionId.random()), 0);

        // when
        pumpAll();

        // then
        assertThat(transport.sent()).hasSize(1);
        ObjectNode error = transport.sent().get(0);
        assertThat(error.get("type").asText()).isEqualTo("error");
        assertThat(transport.inFlightSize()).isZero();
        assertThat(transport.dlqSize()).isZero();
    }

    @Test
    void 계속_실패하는_delivery는_최대_시도_후_DLQ로_간다() throws Exception {
        // given
        runner.shutdown();
        NegotiationEngine failing = new ThrowingEngine(engine);
        runner = new TransportWorkerRunner(transport, failing, new TransportWorkerConfig().withMaxDeliveryAttempts(3));
        transport.deliver(intentDeclaration(SessionId.random()), 0);

        // when
        pumpAll();

        // then
        assertThat(transport.dlqSize()).isEqualTo(1);
        assertThat(transport.getDeadLetters().get(0).getDelivery().attempt()).isEqualTo(3);
        assertThat(transport.getDeadLetters().get(0).getReason()).contains("engine offline");
        assertThat(runner.getRedeliveredCount()).isEqualTo(2);
        assertThat(runner.getDeadLetteredCount()).isEqualTo(1);
    }

    // ============================================================
    // 2. 리퍼
    // ============================================================

    @Test
    void 리퍼가_기한이_지난_세션을_만료시키고_보관_기간_후_제거한다() throws Exception {
        // given
        SessionId sessionId = SessionId.random();
        transport.deliver(intentDeclaration(sessionId), 0);
        pumpAll();
        SessionReaper reaper = new SessionReaper(engine, new SessionReaperConfig());

        // when
        clock.advance(Duration.ofMinutes(16));
        SessionReaper.ScanResult first = reaper.scan();

        // then
        assertThat(first.expired()).isEqualTo(1);
        assertThat(first.evicted()).isZero();
        assertThat(engine.snapshot(sessionId)).hasValueSatisfying(snapshot ->
            assertThat(snapshot.phase()).isEqualTo(SessionPhase.EXPIRED));

        // when
        clock.advance(Duration.ofHours(1));
        SessionReaper.ScanResult second = reaper.scan();

        // then
        assertThat(second.expired()).isZero();
        assertThat(second.evicted()).isEqualTo(1);
        assertThat(engine.snapshot(sessionId)).isEmpty();
    }

    // ===== test doubles =====

    private static final class SteppingClock extends Clock {

        private volatile Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private static final class ThrowingEngine implements NegotiationEngine {

        private final NegotiationEngine delegate;

        ThrowingEngine(NegotiationEngine delegate) {
            this.delegate = delegate;
        }

        @Override
        public EngineResponse handle(ObjectNode rawEnvelope) {
            throw new IllegalStateException("engine offline");
        }

        @Override
        public Optional<SessionSnapshot> snapshot(SessionId sessionId) {
            return delegate.snapshot(sessionId);
        }

        @Override
        public boolean completeSession(SessionId sessionId) {
            return delegate.completeSession(sessionId);
        }

        @Override
        public boolean abortSession(SessionId sessionId, String reason) {
            return delegate.abortSession(sessionId, reason);
        }

        @Override
        public boolean revokeToken(SessionId sessionId, String reason) {
            return delegate.revokeToken(sessionId, reason);
        }

        @Override
        public int expireOverdue(int batchSize) {
            return delegate.expireOverdue(batchSize);
        }

        @Override
        public int evictTerminal(Duration retention) {
            return delegate.evictTerminal(retention);
        }
    }
}
