package com.ryuqq.icnp.testkit.contract;

import com.ryuqq.icnp.application.engine.EngineResponse;
import com.ryuqq.icnp.core.audit.AuditEvent;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.contract.EnforcementMode;
import com.ryuqq.icnp.core.contract.ViolationAction;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.execution.ExecutionRequest;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.token.ExecutionToken;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.AGENT_A;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.agreed;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.capability;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.enforcement;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.executionRequest;
import static com.ryuqq.icnp.testkit.contract.EnvelopeFixtures.simpleIntent;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: token-to-contract binding under strict enforcement.
 *
 * <p>A request that presents a token issued for another contract is denied with
 * token_invalid, audited as a violation, and rolled back when the contract asks for it.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class TokenBindingContractTest extends AbstractProtocolContractTest {

    private ExecutionToken negotiateSession(ViolationAction violationAction) {
        declareIntent(simpleIntent("read"));
        disclose(AGENT_A, capability("cap-read", AGENT_A, "read", "reports"));
        return negotiate(draft(List.of(agreed("cap-read", AGENT_A, "read", null)), List.of(),
            enforcement(EnforcementMode.STRICT, violationAction), List.of()));
    }

    @Test
    void testForeignContractToken_Denied_ViolationAudited_RolledBack() {
        // Given: two sessions, each with its own accepted contract and token
        SessionId first = sessionId;
        ExecutionToken ownToken = negotiateSession(ViolationAction.ABORT_AND_ROLLBACK);
        sessionId = SessionId.random();
        ExecutionToken foreignToken = negotiateSession(ViolationAction.ABORT_AND_ROLLBACK);
        sessionId = first;
        assertNotEquals(ownToken.contractId(), foreignToken.contractId());

        // When: session one receives a request carrying the other session's token
        ExecutionRequest request = executionRequest(foreignToken, AGENT_A, "read", "reports", clock.instant());
        EngineResponse response = execute(request);

        // Then
        assertRejectedWith(response, IcnpErrorCode.TOKEN_INVALID);
        List<AuditEvent> violations = auditEvents(AuditEventKind.VIOLATION);
        assertEquals(1, violations.size());
        assertEquals("ICNP-005", violations.get(0).detail("code"));
        assertEquals(List.of(request.invocationId()), rollbacks.rolledBack());
        List<AuditEvent> rollbackEvents = auditEvents(AuditEventKind.ROLLBACK);
        assertEquals(1, rollbackEvents.size());
        assertEquals("ok", rollbackEvents.get(0).detail("status"));
        assertTrue(actionExecutor.performed().isEmpty());
    }

    @Test
    void testOwnTokenWithForeignContractId_Denied() {
        // Given
        ExecutionToken token = negotiateSession(ViolationAction.ABORT);
        ExecutionRequest honest = executionRequest(token, AGENT_A, "read", "reports", clock.instant());
        ExecutionRequest mismatched = new ExecutionRequest(honest.invocationId(), honest.tokenId(),
            "contract-elsewhere", honest.action(), honest.scope(), honest.executor(), honest.requestedAt(),
            honest.nonce(), null);

        // When
        EngineResponse response = execute(mismatched);

        // Then
        assertRejectedWith(response, IcnpErrorCode.TOKEN_INVALID);
        assertTrue(rollbacks.rolledBack().isEmpty(), "abort without rollback must not roll back");
        assertTrue(auditEvents(AuditEventKind.ROLLBACK).isEmpty());
    }

    @Test
    void testMatchingToken_Executes() {
        // Given
        ExecutionToken token = negotiateSession(ViolationAction.ABORT_AND_ROLLBACK);

        // When
        EngineResponse response = execute(executionRequest(token, AGENT_A, "read", "reports", clock.instant()));

        // Then
        assertExecuted(response);
        assertTrue(auditEvents(AuditEventKind.VIOLATION).isEmpty());
        assertTrue(rollbacks.rolledBack().isEmpty());
    }
}
