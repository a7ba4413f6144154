package com.ryuqq.icnp.testkit.contract;

import com.ryuqq.icnp.application.engine.EngineResponse;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.contract.Contract;
import com.ryuqq.icnp.core.contract.Enforcement;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import com.ryuqq.icnp.core.token.ExecutionToken;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.AGENT_A;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.START;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.agreed;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.approval;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.capabilityWithEffects;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.executionRequest;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.intent;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: human approval gate.
 *
 * <p>An intent that requires human approval must never yield a token for a contract
 * without a recorded approval.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>approval required, none recorded → unauthorised_action, no token</li>
 *   <li>approval required and recorded → token issued and usable</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class ApprovalContractTest extends AbstractProtocolContractTest {

    private void setUpWriteSession() {
        declareIntent(intent(true, true, "write"));
        disclose(AGENT_A, capabilityWithEffects("cap-write", AGENT_A, "write", "writes production data", "production"));
    }

    @Test
    void testApprovalRequired_NoneRecorded_NoTokenIssued() {
        // Given
        setUpWriteSession();
        Contract draft = draft(List.of(agreed("cap-write", AGENT_A, "write", "production")), List.of(),
            Enforcement.strictDefault(), List.of());

        // When
        EngineResponse response = proposeAndAccept(draft);

        // Then
        assertRejectedWith(response, IcnpErrorCode.UNAUTHORISED_ACTION);
        assertTrue(auditEvents(AuditEventKind.TOKEN_ISSUED).isEmpty(), "no token may be issued");
        assertNull(snapshot().tokenId());
        assertFalse(snapshot().contractAccepted());
        assertPhase(SessionPhase.CONTRACT);
        assertTrue(actionExecutor.performed().isEmpty());
    }

    @Test
    void testApprovalRequired_ApprovalRecorded_TokenIssued() {
        // Given
        setUpWriteSession();
        Contract draft = draft(List.of(agreed("cap-write", AGENT_A, "write", "production")), List.of(),
            Enforcement.strictDefault(), List.of(approval(START)));

        // When
        ExecutionToken token = negotiate(draft);
        EngineResponse executed = execute(executionRequest(token, AGENT_A, "write", "production", clock.instant()));

        // Then
        assertEquals(1, auditEvents(AuditEventKind.TOKEN_ISSUED).size());
        assertEquals(token.tokenId(), snapshot().tokenId());
        assertExecuted(executed);
        assertEquals(List.of("write"), actionExecutor.performedActions());
    }
}
