package com.ryuqq.icnp.testkit.contract;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.application.engine.EngineResponse;
import com.ryuqq.icnp.application.session.SessionSnapshot;
import com.ryuqq.icnp.core.message.MessageType;
import com.ryuqq.icnp.core.message.PayloadCodec;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import com.ryuqq.icnp.core.token.ExecutionToken;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.AGENT_A;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.INITIATOR;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.agreed;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.capability;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.envelope;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.executionRequest;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.simpleIntent;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: at-least-once delivery.
 *
 * <p>Delivering the same envelope twice must leave the session exactly as one delivery would,
 * and must not write a second set of audit events.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class RedeliveryContractTest extends AbstractProtocolContractTest {

    @Test
    void testRedeliveredIntent_Duplicate_NoStateChange() {
        // Given
        ObjectNode raw = envelope(MessageType.INTENT_DECLARATION, sessionId, INITIATOR, clock.instant(),
            PayloadCodec.writeIntent(simpleIntent("read")));
        assertProcessed(engine.handle(raw));
        SessionSnapshot before = snapshot();
        int auditBefore = auditSink.size();

        // When
        EngineResponse second = engine.handle(raw.deepCopy());

        // Then
        assertTrue(second.isDuplicate());
        assertTrue(second.getOutbound().isEmpty());
        assertEquals(auditBefore, auditSink.size());
        assertEquals(before, snapshot());
        assertEquals(1, snapshot().seenMessageCount());
    }

    @Test
    void testRedeliveredDisclosure_CapabilityRecordedOnce() {
        // Given
        declareIntent(simpleIntent("read"));
        ObjectNode raw = envelope(MessageType.CAPABILITY_DISCLOSURE, sessionId, AGENT_A, clock.instant(),
            PayloadCodec.writeCapabilities(List.of(capability("cap-read", AGENT_A, "read", "reports"))));

        // When
        EngineResponse first = engine.handle(raw);
        EngineResponse second = engine.handle(raw);

        // Then
        assertProcessed(first);
        assertTrue(second.isDuplicate());
        assertEquals(List.of("cap-read"), snapshot().capabilityIds());
        assertPhase(SessionPhase.CAPABILITY);
    }

    @Test
    void testRedeliveredExecutionRequest_ActionRunsOnce() {
        // Given
        declareIntent(simpleIntent("read"));
        disclose(AGENT_A, capability("cap-read", AGENT_A, "read", "reports"));
        ExecutionToken token = negotiate(draft(List.of(agreed("cap-read", AGENT_A, "read", null)), List.of()));
        ObjectNode raw = envelope(MessageType.EXECUTION_REQUEST, sessionId, AGENT_A, clock.instant(),
            PayloadCodec.writeExecutionRequest(executionRequest(token, AGENT_A, "read", "reports", clock.instant())));

        // When
        EngineResponse first = engine.handle(raw);
        EngineResponse second = engine.handle(raw);

        // Then
        assertExecuted(first);
        assertTrue(second.isDuplicate());
        assertEquals(1, actionExecutor.performed().size());
        assertEquals(1, snapshot().invocations().size());
    }
}
