package com.ryuqq.icnp.testkit.contract;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.audit.AuditLevel;
import com.ryuqq.icnp.core.capability.Capability;
import com.ryuqq.icnp.core.capability.CapabilityAction;
import com.ryuqq.icnp.core.contract.AgreedAction;
import com.ryuqq.icnp.core.contract.Approval;
import com.ryuqq.icnp.core.contract.ApprovalDecision;
import com.ryuqq.icnp.core.contract.Enforcement;
import com.ryuqq.icnp.core.contract.EnforcementMode;
import com.ryuqq.icnp.core.contract.ForbiddenAction;
import com.ryuqq.icnp.core.contract.ViolationAction;
import com.ryuqq.icnp.core.execution.ExecutionRequest;
import com.ryuqq.icnp.core.intent.DataPolicy;
import com.ryuqq.icnp.core.intent.Intent;
import com.ryuqq.icnp.core.intent.IntentConstraints;
import com.ryuqq.icnp.core.intent.RequestedAction;
import com.ryuqq.icnp.core.intent.RiskTolerance;
import com.ryuqq.icnp.core.message.EnvelopeCodec;
import com.ryuqq.icnp.core.message.MessageEnvelope;
import com.ryuqq.icnp.core.message.MessageType;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.ActorRole;
import com.ryuqq.icnp.core.model.MessageId;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.token.ExecutionToken;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Builders for protocol artifacts and raw envelopes used by contract tests.
 *
 * <p>Every participant has an HMAC key registered by {@link AbstractProtocolContractTest}:
 * {@code <id>-key} signs as {@code <id>}, and {@code engine-key} signs as the engine.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class EnvelopeFixtures {

    public static final String VERSION = "1.0.0";
    public static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    public static final Actor ENGINE = Actor.of("icnp-engine", ActorRole.ORCHESTRATOR);
    public static final Actor INITIATOR = Actor.of("orchestrator-1", ActorRole.ORCHESTRATOR);
    public static final Actor AGENT_A = Actor.of("agent-a", ActorRole.AGENT);
    public static final Actor AGENT_B = Actor.of("agent-b", ActorRole.AGENT);

    private EnvelopeFixtures() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * HMAC secret for a participant, derived from its id.
     */
    public static byte[] secretFor(String ownerId) {
        return ("contract-test-secret-" + ownerId).getBytes(StandardCharsets.UTF_8);
    }

    public static String keyRefFor(Actor actor) {
        return actor.id() + "-key";
    }

    // ========== intents ==========

    public static Intent intent(boolean humanApprovalRequired, boolean sideEffectsAllowed, String... actions) {
        return new Intent(
            "compile weekly incident report",
            Arrays.stream(actions).map(action -> new RequestedAction(action, null)).toList(),
            List.of("report"),
            new IntentConstraints(RiskTolerance.LOW, humanApprovalRequired, DataPolicy.none(),
                sideEffectsAllowed, AuditLevel.STANDARD));
    }

    public static Intent simpleIntent(String... actions) {
        return intent(false, false, actions);
    }

    // ========== capabilities ==========

    public static Capability capability(String capabilityId, Actor owner, String action, String... scopes) {
        return new Capability(capabilityId, owner.id(), capabilityId, null,
            List.of(new CapabilityAction(action, List.of(scopes), false, 0.9, null)));
    }

    public static Capability capabilityWithEffects(String capabilityId, Actor owner, String action,
                                                   String effects, String... scopes) {
        return new Capability(capabilityId, owner.id(), capabilityId, null,
            List.of(new CapabilityAction(action, List.of(scopes), false, 0.9, effects)));
    }

    // ========== contract parts ==========

    public static AgreedAction agreed(String capabilityId, Actor executor, String action, String scope) {
        return new AgreedAction("aa-" + UUID.randomUUID(), capabilityId, executor.id(), action, scope, null);
    }

    public static AgreedAction agreedLimited(String capabilityId, Actor executor, String action, String scope,
                                             int maxInvocations) {
        return new AgreedAction("aa-" + UUID.randomUUID(), capabilityId, executor.id(), action, scope, maxInvocations);
    }

    public static ForbiddenAction forbidden(String action, String scope) {
        return new ForbiddenAction(action, scope, "forbidden in contract test");
    }

    public static Enforcement enforcement(EnforcementMode mode, ViolationAction violationAction) {
        return new Enforcement(mode, violationAction, AuditLevel.STANDARD, true,
            violationAction == ViolationAction.ABORT_AND_ROLLBACK);
    }

    public static Approval approval(Instant decidedAt) {
        return new Approval("reviewer-1", ApprovalDecision.APPROVE, decidedAt, "approved for contract test");
    }

    // ========== requests ==========

    public static ExecutionRequest executionRequest(ExecutionToken token, Actor executor, String action,
                                                    String scope, Instant requestedAt) {
        return new ExecutionRequest("inv-" + UUID.randomUUID(), token.tokenId(), token.contractId(), action, scope,
            executor, requestedAt, UUID.randomUUID().toString(), null);
    }

    // ========== envelopes ==========

    /**
     * Encodes a version 1.0.0 envelope with a fresh message id.
     */
    public static ObjectNode envelope(MessageType type, SessionId sessionId, Actor sender, Instant timestamp,
                                      ObjectNode payload) {
        return EnvelopeCodec.encode(new MessageEnvelope(VERSION, type, null, MessageId.random(), sessionId,
            timestamp, sender, null, null, null, payload, null));
    }

    public static MessageId messageIdOf(ObjectNode rawEnvelope) {
        return MessageId.of(rawEnvelope.get("message_id").asText());
    }

    public static String typeOf(ObjectNode rawEnvelope) {
        return rawEnvelope.get("type").asText();
    }

    /**
     * Error code ({@code ICNP-00x}) of an error envelope.
     */
    public static String errorCodeOf(ObjectNode errorEnvelope) {
        return errorEnvelope.get("payload").get("error").get("code").asText();
    }
}
