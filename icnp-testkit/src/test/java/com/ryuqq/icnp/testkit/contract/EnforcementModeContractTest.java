package com.ryuqq.icnp.testkit.contract;

import com.ryuqq.icnp.application.engine.EngineResponse;
import com.ryuqq.icnp.core.audit.AuditEvent;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.contract.EnforcementMode;
import com.ryuqq.icnp.core.contract.ViolationAction;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.execution.ExecutionRequest;
import com.ryuqq.icnp.core.execution.ExecutionResult;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
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
 * Contract Test: enforcement modes.
 *
 * <p>The same unauthorized request (an action that was never agreed, or a token that does not
 * match the contract) is denied under strict, and executed with a recorded violation under
 * permissive and audit_only. A session that has ended denies in every mode.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class EnforcementModeContractTest extends AbstractProtocolContractTest {

    private ExecutionToken negotiateReadOnly(EnforcementMode mode, ViolationAction violationAction) {
        declareIntent(simpleIntent("read", "archive"));
        disclose(AGENT_A, capability("cap-read", AGENT_A, "read", "reports"));
        return negotiate(draft(List.of(agreed("cap-read", AGENT_A, "read", null)), List.of(),
            enforcement(mode, violationAction), List.of()));
    }

    @Test
    void testAuditOnly_UnauthorizedAction_ExecutedWithViolation() {
        // Given
        ExecutionToken token = negotiateReadOnly(EnforcementMode.AUDIT_ONLY, ViolationAction.LOG_ONLY);

        // When
        EngineResponse response = execute(executionRequest(token, AGENT_A, "archive", "reports", clock.instant()));

        // Then
        assertProcessed(response);
        ExecutionResult result = resultFrom(response);
        assertTrue(result.isSuccess(), "audit_only must report the execution as successful");
        assertEquals(List.of("archive"), actionExecutor.performedActions());

        List<AuditEvent> violations = auditEvents(AuditEventKind.VIOLATION);
        assertEquals(1, violations.size());
        assertEquals("info", violations.get(0).detail("severity"));
        assertEquals("executed", violations.get(0).detail("outcome"));
        assertEquals("audit_only", violations.get(0).detail("mode"));
        assertEquals(1, auditEvents(AuditEventKind.EXECUTION_COMPLETED).size());
    }

    @Test
    void testPermissive_UnauthorizedAction_ExecutedWithWarning() {
        // Given
        ExecutionToken token = negotiateReadOnly(EnforcementMode.PERMISSIVE, ViolationAction.LOG_ONLY);

        // When
        EngineResponse response = execute(executionRequest(token, AGENT_A, "archive", "reports", clock.instant()));

        // Then
        assertExecuted(response);
        List<AuditEvent> violations = auditEvents(AuditEventKind.VIOLATION);
        assertEquals(1, violations.size());
        assertEquals("warning", violations.get(0).detail("severity"));
    }

    @Test
    void testStrict_UnauthorizedAction_Denied() {
        // Given
        ExecutionToken token = negotiateReadOnly(EnforcementMode.STRICT, ViolationAction.ABORT);

        // When
        EngineResponse response = execute(executionRequest(token, AGENT_A, "archive", "reports", clock.instant()));

        // Then
        assertRejectedWith(response, IcnpErrorCode.UNAUTHORISED_ACTION);
        assertTrue(actionExecutor.performed().isEmpty());
        assertEquals("error", auditEvents(AuditEventKind.VIOLATION).get(0).detail("severity"));
    }

    @Test
    void testAuditOnly_AuthorizedAction_NoViolation() {
        // Given
        ExecutionToken token = negotiateReadOnly(EnforcementMode.AUDIT_ONLY, ViolationAction.LOG_ONLY);

        // When
        EngineResponse response = execute(executionRequest(token, AGENT_A, "read", "reports", clock.instant()));

        // Then
        assertExecuted(response);
        assertTrue(auditEvents(AuditEventKind.VIOLATION).isEmpty());
    }

    @Test
    void testAuditOnly_ForeignContractId_ExecutedWithTokenViolation() {
        // Given
        ExecutionToken token = negotiateReadOnly(EnforcementMode.AUDIT_ONLY, ViolationAction.LOG_ONLY);
        ExecutionRequest honest = executionRequest(token, AGENT_A, "read", "reports", clock.instant());
        ExecutionRequest foreign = new ExecutionRequest(honest.invocationId(), honest.tokenId(), "other-contract",
            honest.action(), honest.scope(), honest.executor(), honest.requestedAt(), honest.nonce(), null);

        // When
        EngineResponse response = execute(foreign);

        // Then
        assertExecuted(response);
        assertEquals(List.of("read"), actionExecutor.performedActions());
        List<AuditEvent> violations = auditEvents(AuditEventKind.VIOLATION);
        assertEquals(1, violations.size());
        assertEquals("ICNP-005", violations.get(0).detail("code"));
        assertEquals("info", violations.get(0).detail("severity"));
        assertEquals("executed", violations.get(0).detail("outcome"));
    }

    @Test
    void testPermissive_RevokedToken_ExecutedWithWarning() {
        // Given
        ExecutionToken token = negotiateReadOnly(EnforcementMode.PERMISSIVE, ViolationAction.LOG_ONLY);
        assertTrue(engine.revokeToken(sessionId, "rotated"));

        // When
        EngineResponse response = execute(executionRequest(token, AGENT_A, "read", "reports", clock.instant()));

        // Then
        assertExecuted(response);
        List<AuditEvent> violations = auditEvents(AuditEventKind.VIOLATION);
        assertEquals(1, violations.size());
        assertEquals("ICNP-005", violations.get(0).detail("code"));
        assertEquals("warning", violations.get(0).detail("severity"));
    }

    @Test
    void testAuditOnly_ExpiredTokenEndsSession_Denied() {
        // Given: the session deadline was extended to the token's not_after
        ExecutionToken token = negotiateReadOnly(EnforcementMode.AUDIT_ONLY, ViolationAction.LOG_ONLY);
        clock.set(token.validity().notAfter());

        // When
        EngineResponse response = execute(executionRequest(token, AGENT_A, "read", "reports", clock.instant()));

        // Then
        assertRejectedWith(response, IcnpErrorCode.TOKEN_INVALID);
        assertPhase(SessionPhase.EXPIRED);
        assertTrue(actionExecutor.performed().isEmpty());
    }
}
