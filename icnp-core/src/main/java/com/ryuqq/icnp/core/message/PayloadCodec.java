package com.ryuqq.icnp.core.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.audit.AuditLevel;
import com.ryuqq.icnp.core.capability.Capability;
import com.ryuqq.icnp.core.capability.CapabilityAction;
import com.ryuqq.icnp.core.contract.AcceptanceDecision;
import com.ryuqq.icnp.core.contract.AgreedAction;
import com.ryuqq.icnp.core.contract.Approval;
import com.ryuqq.icnp.core.contract.ApprovalDecision;
import com.ryuqq.icnp.core.contract.Contract;
import com.ryuqq.icnp.core.contract.ContractAcceptance;
import com.ryuqq.icnp.core.contract.Enforcement;
import com.ryuqq.icnp.core.contract.EnforcementMode;
import com.ryuqq.icnp.core.contract.ForbiddenAction;
import com.ryuqq.icnp.core.contract.ViolationAction;
import com.ryuqq.icnp.core.error.ErrorReport;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.execution.ExecutionRequest;
import com.ryuqq.icnp.core.execution.ExecutionResult;
import com.ryuqq.icnp.core.execution.ExecutionStatus;
import com.ryuqq.icnp.core.intent.DataPolicy;
import com.ryuqq.icnp.core.intent.Intent;
import com.ryuqq.icnp.core.intent.IntentConstraints;
import com.ryuqq.icnp.core.intent.RequestedAction;
import com.ryuqq.icnp.core.intent.RiskTolerance;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.HashValue;
import com.ryuqq.icnp.core.model.SessionId;
import com.ryuqq.icnp.core.model.Signature;
import com.ryuqq.icnp.core.token.BindingHashes;
import com.ryuqq.icnp.core.token.ExecutionToken;
import com.ryuqq.icnp.core.token.InvocationLimits;
import com.ryuqq.icnp.core.token.TokenValidity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 메시지 payload ↔ 도메인 모델 변환.
 *
 * <p><strong>payload 형태:</strong></p>
 * <ul>
 *   <li>intent_declaration: {@code {"intent": {...}, "constraints": {...}}}</li>
 *   <li>capability_disclosure: {@code {"capabilities": [...]}}</li>
 *   <li>contract_proposal, contract_counter_proposal: {@code {"contract": {...}}}</li>
 *   <li>contract_acceptance: {@code {"contract_id", "decision", "signature", "reason"}}</li>
 *   <li>execution_token: {@code {"token": {...}}}</li>
 *   <li>execution_request: {@code {"request": {...}}}</li>
 *   <li>execution_result: {@code {"result": {...}}}</li>
 *   <li>error: {@code {"error": {...}}}</li>
 * </ul>
 *
 * <p>읽기 실패는 {@link IcnpErrorCode#INVALID_INTENT}로 보고됩니다. 쓰기 결과는
 * 바인딩 해시와 서명의 입력이 되므로 필드 구성이 안정적이어야 합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class PayloadCodec {

    private PayloadCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    // ===== intent =====

    public static Intent readIntent(ObjectNode payload) {
        return read("intent", () -> {
            ObjectNode intentNode = JsonFields.requireObject(payload, "intent");
            List<RequestedAction> requested = new ArrayList<>();
            ArrayNode actions = JsonFields.optionalArray(intentNode, "requested_actions");
            if (actions != null) {
                for (JsonNode element : actions) {
                    if (element.isTextual()) {
                        requested.add(new RequestedAction(element.textValue(), null));
                    } else if (element.isObject()) {
                        requested.add(new RequestedAction(
                            JsonFields.requireText(element, "action"),
                            JsonFields.optionalText(element, "description")));
                    } else {
                        throw new IllegalArgumentException("requested_actions entries must be objects");
                    }
                }
            }
            ObjectNode constraintsNode = JsonFields.optionalObject(payload, "constraints");
            if (constraintsNode == null) {
                constraintsNode = JsonFields.optionalObject(intentNode, "constraints");
            }
            return new Intent(
                JsonFields.optionalText(intentNode, "goal"),
                requested,
                JsonFields.optionalTextList(intentNode, "expected_outputs"),
                constraintsNode == null ? IntentConstraints.defaults() : readConstraints(constraintsNode));
        });
    }

    private static IntentConstraints readConstraints(ObjectNode node) {
        String risk = JsonFields.optionalText(node, "risk_tolerance");
        RiskTolerance riskTolerance = risk == null
            ? RiskTolerance.LOW
            : RiskTolerance.fromWire(risk).orElseThrow(() -> new IllegalArgumentException("unknown risk_tolerance: " + risk));
        String audit = JsonFields.optionalText(node, "audit_level");
        AuditLevel auditLevel = audit == null
            ? AuditLevel.STANDARD
            : AuditLevel.fromWire(audit).orElseThrow(() -> new IllegalArgumentException("unknown audit_level: " + audit));
        ObjectNode policyNode = JsonFields.optionalObject(node, "data_policy");
        DataPolicy dataPolicy = DataPolicy.none();
        if (policyNode != null) {
            Integer retention = JsonFields.optionalInt(policyNode, "retention_days");
            dataPolicy = new DataPolicy(
                JsonFields.optionalTextList(policyNode, "allowed_data_classes"),
                retention == null ? 0 : retention);
        }
        return new IntentConstraints(
            riskTolerance,
            JsonFields.optionalBoolean(node, "human_approval_required", false),
            dataPolicy,
            JsonFields.optionalBoolean(node, "external_side_effects_allowed", false),
            auditLevel);
    }

    public static ObjectNode writeIntent(Intent intent) {
        ObjectNode payload = ProtocolJson.objectNode();
        ObjectNode intentNode = payload.putObject("intent");
        JsonFields.putIfNotNull(intentNode, "goal", intent.goal());
        ArrayNode actions = intentNode.putArray("requested_actions");
        for (RequestedAction requested : intent.requestedActions()) {
            ObjectNode actionNode = actions.addObject();
            actionNode.put("action", requested.action());
            JsonFields.putIfNotNull(actionNode, "description", requested.description());
        }
        ArrayNode outputs = intentNode.putArray("expected_outputs");
        intent.expectedOutputs().forEach(outputs::add);

        IntentConstraints constraints = intent.constraints();
        ObjectNode constraintsNode = payload.putObject("constraints");
        constraintsNode.put("risk_tolerance", constraints.riskTolerance().wireName());
        constraintsNode.put("human_approval_required", constraints.humanApprovalRequired());
        ObjectNode policy = constraintsNode.putObject("data_policy");
        ArrayNode classes = policy.putArray("allowed_data_classes");
        constraints.dataPolicy().allowedDataClasses().forEach(classes::add);
        policy.put("retention_days", constraints.dataPolicy().retentionDays());
        constraintsNode.put("external_side_effects_allowed", constraints.externalSideEffectsAllowed());
        constraintsNode.put("audit_level", constraints.auditLevel().wireName());
        return payload;
    }

    // ===== capabilities =====

    public static List<Capability> readCapabilities(ObjectNode payload, String ownerId) {
        return read("capabilities", () -> {
            ArrayNode array = JsonFields.optionalArray(payload, "capabilities");
            if (array == null || array.isEmpty()) {
                throw new IllegalArgumentException("field 'capabilities' must be a non-empty array");
            }
            List<Capability> capabilities = new ArrayList<>();
            for (JsonNode element : array) {
                if (!element.isObject()) {
                    throw new IllegalArgumentException("capabilities entries must be objects");
                }
                ArrayNode actionsNode = JsonFields.optionalArray(element, "actions");
                List<CapabilityAction> actions = new ArrayList<>();
                if (actionsNode != null) {
                    for (JsonNode actionNode : actionsNode) {
                        Double confidence = JsonFields.optionalDouble(actionNode, "confidence");
                        actions.add(new CapabilityAction(
                            JsonFields.requireText(actionNode, "action"),
                            JsonFields.optionalTextList(actionNode, "scopes"),
                            JsonFields.optionalBoolean(actionNode, "requires_approval", false),
                            confidence == null ? 0.0 : confidence,
                            JsonFields.optionalText(actionNode, "effects")));
                    }
                }
                capabilities.add(new Capability(
                    JsonFields.requireText(element, "capability_id"),
                    ownerId,
                    JsonFields.optionalText(element, "name"),
                    JsonFields.optionalText(element, "description"),
                    actions));
            }
            return capabilities;
        });
    }

    public static ObjectNode writeCapabilities(List<Capability> capabilities) {
        ObjectNode payload = ProtocolJson.objectNode();
        ArrayNode array = payload.putArray("capabilities");
        for (Capability capability : capabilities) {
            ObjectNode node = array.addObject();
            node.put("capability_id", capability.capabilityId());
            JsonFields.putIfNotNull(node, "name", capability.name());
            JsonFields.putIfNotNull(node, "description", capability.description());
            ArrayNode actions = node.putArray("actions");
            for (CapabilityAction action : capability.actions()) {
                ObjectNode actionNode = actions.addObject();
                actionNode.put("action", action.action());
                ArrayNode scopes = actionNode.putArray("scopes");
                action.scopes().forEach(scopes::add);
                actionNode.put("requires_approval", action.requiresApproval());
                actionNode.put("confidence", action.confidence());
                actionNode.put("effects", action.effects());
            }
        }
        return payload;
    }

    // ===== contract =====

    public static Contract readContract(ObjectNode payload) {
        return read("contract", () -> readContractBody(JsonFields.requireObject(payload, "contract")));
    }

    private static Contract readContractBody(ObjectNode node) {
        List<Actor> parties = readList(node, "parties", element -> JsonFields.readActor(element, "parties"));
        List<AgreedAction> agreed = readList(node, "agreed_actions", element -> new AgreedAction(
            JsonFields.requireText(element, "action_id"),
            JsonFields.requireText(element, "capability_id"),
            JsonFields.requireText(element, "executor_id"),
            JsonFields.requireText(element, "action"),
            JsonFields.optionalText(element, "scope"),
            JsonFields.optionalInt(element, "max_invocations")));
        List<ForbiddenAction> forbidden = readList(node, "forbidden_actions", element -> new ForbiddenAction(
            JsonFields.requireText(element, "action"),
            JsonFields.optionalText(element, "scope"),
            JsonFields.optionalText(element, "reason")));
        List<Approval> approvals = readList(node, "approvals", element -> {
            String decision = JsonFields.requireText(element, "decision");
            return new Approval(
                JsonFields.requireText(element, "approver_id"),
                ApprovalDecision.fromWire(decision)
                    .orElseThrow(() -> new IllegalArgumentException("unknown approval decision: " + decision)),
                JsonFields.requireTimestamp(element, "decided_at"),
                JsonFields.optionalText(element, "comment"));
        });

        Map<String, Signature> signatures = new LinkedHashMap<>();
        JsonNode signaturesNode = node.get("signatures");
        if (signaturesNode != null && signaturesNode.isObject()) {
            signaturesNode.fields().forEachRemaining(entry -> signatures.put(entry.getKey(), readSignature(entry.getValue())));
        } else if (signaturesNode != null && signaturesNode.isArray()) {
            for (JsonNode element : signaturesNode) {
                Signature signature = readSignature(element);
                signatures.put(signature.signedBy(), signature);
            }
        } else if (signaturesNode != null && !signaturesNode.isNull()) {
            throw new IllegalArgumentException("field 'signatures' must be an object or an array");
        }

        ObjectNode enforcementNode = JsonFields.optionalObject(node, "enforcement");
        return new Contract(
            JsonFields.requireText(node, "contract_id"),
            SessionId.of(JsonFields.requireText(node, "session_id")),
            JsonFields.requireTimestamp(node, "issued_at"),
            parties,
            agreed,
            forbidden,
            JsonFields.optionalObject(node, "constraints"),
            enforcementNode == null ? Enforcement.strictDefault() : readEnforcement(enforcementNode),
            approvals,
            signatures);
    }

    private static Enforcement readEnforcement(ObjectNode node) {
        String mode = JsonFields.optionalText(node, "mode");
        String violation = JsonFields.optionalText(node, "violation_action");
        String audit = JsonFields.optionalText(node, "audit_level");
        return new Enforcement(
            mode == null ? EnforcementMode.STRICT
                : EnforcementMode.fromWire(mode).orElseThrow(() -> new IllegalArgumentException("unknown enforcement mode: " + mode)),
            violation == null ? ViolationAction.ABORT
                : ViolationAction.fromWire(violation).orElseThrow(() -> new IllegalArgumentException("unknown violation_action: " + violation)),
            audit == null ? AuditLevel.STANDARD
                : AuditLevel.fromWire(audit).orElseThrow(() -> new IllegalArgumentException("unknown audit_level: " + audit)),
            JsonFields.optionalBoolean(node, "logging_required", true),
            JsonFields.optionalBoolean(node, "rollback_required", false));
    }

    /**
     * 계약을 {@code {"contract": {...}}} payload로 변환.
     */
    public static ObjectNode writeContract(Contract contract) {
        ObjectNode payload = ProtocolJson.objectNode();
        payload.set("contract", contractTree(contract));
        return payload;
    }

    /**
     * 계약 본문 JSON (서명/해시 대상).
     *
     * @param contract 계약
     * @return 계약 객체 JSON
     */
    public static ObjectNode contractTree(Contract contract) {
        ObjectNode node = ProtocolJson.objectNode();
        node.put("contract_id", contract.contractId());
        node.put("session_id", contract.sessionId().getValue());
        JsonFields.putTimestamp(node, "issued_at", contract.issuedAt());
        ArrayNode parties = node.putArray("parties");
        contract.parties().forEach(party -> parties.add(JsonFields.writeActor(party)));
        ArrayNode agreed = node.putArray("agreed_actions");
        for (AgreedAction action : contract.agreedActions()) {
            ObjectNode actionNode = agreed.addObject();
            actionNode.put("action_id", action.actionId());
            actionNode.put("capability_id", action.capabilityId());
            actionNode.put("executor_id", action.executorId());
            actionNode.put("action", action.action());
            JsonFields.putIfNotNull(actionNode, "scope", action.scope());
            if (action.maxInvocations() != null) {
                actionNode.put("max_invocations", action.maxInvocations());
            }
        }
        ArrayNode forbidden = node.putArray("forbidden_actions");
        for (ForbiddenAction action : contract.forbiddenActions()) {
            ObjectNode actionNode = forbidden.addObject();
            actionNode.put("action", action.action());
            JsonFields.putIfNotNull(actionNode, "scope", action.scope());
            actionNode.put("reason", action.reason());
        }
        node.set("constraints", contract.constraints());
        Enforcement enforcement = contract.enforcement();
        ObjectNode enforcementNode = node.putObject("enforcement");
        enforcementNode.put("mode", enforcement.mode().wireName());
        enforcementNode.put("violation_action", enforcement.violationAction().wireName());
        enforcementNode.put("audit_level", enforcement.auditLevel().wireName());
        enforcementNode.put("logging_required", enforcement.loggingRequired());
        enforcementNode.put("rollback_required", enforcement.rollbackRequired());
        ArrayNode approvals = node.putArray("approvals");
        for (Approval approval : contract.approvals()) {
            ObjectNode approvalNode = approvals.addObject();
            approvalNode.put("approver_id", approval.approverId());
            approvalNode.put("decision", approval.decision().wireName());
            JsonFields.putTimestamp(approvalNode, "decided_at", approval.decidedAt());
            JsonFields.putIfNotNull(approvalNode, "comment", approval.comment());
        }
        ObjectNode signatures = node.putObject("signatures");
        contract.signatures().forEach((participant, signature) -> signatures.set(participant, writeSignature(signature)));
        return node;
    }

    // ===== acceptance =====

    public static ContractAcceptance readAcceptance(ObjectNode payload) {
        return read("contract_acceptance", () -> {
            String contractId = JsonFields.optionalText(payload, "contract_id");
            if (contractId == null) {
                ObjectNode contractNode = JsonFields.optionalObject(payload, "contract");
                if (contractNode != null) {
                    contractId = JsonFields.requireText(contractNode, "contract_id");
                }
            }
            if (contractId == null) {
                throw new IllegalArgumentException("field 'contract_id' is required");
            }
            String decision = JsonFields.optionalText(payload, "decision");
            AcceptanceDecision acceptanceDecision = decision == null
                ? AcceptanceDecision.ACCEPT
                : AcceptanceDecision.fromWire(decision).orElseThrow(() -> new IllegalArgumentException("unknown decision: " + decision));
            JsonNode signatureNode = payload.get("signature");
            Signature signature = signatureNode == null || signatureNode.isNull() ? null : readSignature(signatureNode);
            return new ContractAcceptance(contractId, acceptanceDecision, signature, JsonFields.optionalText(payload, "reason"));
        });
    }

    public static ObjectNode writeAcceptance(ContractAcceptance acceptance) {
        ObjectNode payload = ProtocolJson.objectNode();
        payload.put("contract_id", acceptance.contractId());
        payload.put("decision", acceptance.decision().wireName());
        if (acceptance.signature() != null) {
            payload.set("signature", writeSignature(acceptance.signature()));
        }
        JsonFields.putIfNotNull(payload, "reason", acceptance.reason());
        return payload;
    }

    // ===== token =====

    public static ExecutionToken readToken(ObjectNode payload) {
        return read("token", () -> {
            ObjectNode node = JsonFields.requireObject(payload, "token");
            ObjectNode limits = JsonFields.requireObject(node, "limits");
            Integer perActor = JsonFields.optionalInt(limits, "max_invocations_per_actor");
            if (perActor == null) {
                throw new IllegalArgumentException("field 'max_invocations_per_actor' is required");
            }
            ObjectNode binding = JsonFields.requireObject(node, "binding");
            JsonNode signatureNode = node.get("signature");
            return new ExecutionToken(
                JsonFields.requireText(node, "token_id"),
                SessionId.of(JsonFields.requireText(node, "session_id")),
                JsonFields.requireText(node, "contract_id"),
                JsonFields.readActor(node.get("issuer"), "issuer"),
                readList(node, "audience", element -> JsonFields.readActor(element, "audience")),
                JsonFields.requireTimestamp(node, "issued_at"),
                new TokenValidity(
                    JsonFields.requireTimestamp(node, "not_before"),
                    JsonFields.requireTimestamp(node, "not_after")),
                new InvocationLimits(JsonFields.optionalInt(limits, "max_invocations_total"), perActor),
                new BindingHashes(
                    readHash(binding, "intent_hash"),
                    readHash(binding, "contract_hash"),
                    readHash(binding, "capabilities_hash")),
                signatureNode == null || signatureNode.isNull() ? null : readSignature(signatureNode));
        });
    }

    public static ObjectNode writeToken(ExecutionToken token) {
        ObjectNode payload = ProtocolJson.objectNode();
        payload.set("token", tokenTree(token));
        return payload;
    }

    /**
     * 토큰 본문 JSON. 서명이 null이면 signature 필드를 생략하므로 서명 대상 본문으로 쓸 수 있습니다.
     *
     * @param token 토큰
     * @return 토큰 객체 JSON
     */
    public static ObjectNode tokenTree(ExecutionToken token) {
        ObjectNode node = ProtocolJson.objectNode();
        node.put("token_id", token.tokenId());
        node.put("session_id", token.sessionId().getValue());
        node.put("contract_id", token.contractId());
        node.set("issuer", JsonFields.writeActor(token.issuer()));
        ArrayNode audience = node.putArray("audience");
        token.audience().forEach(member -> audience.add(JsonFields.writeActor(member)));
        JsonFields.putTimestamp(node, "issued_at", token.issuedAt());
        JsonFields.putTimestamp(node, "not_before", token.validity().notBefore());
        JsonFields.putTimestamp(node, "not_after", token.validity().notAfter());
        ObjectNode limits = node.putObject("limits");
        limits.put("max_invocations_per_actor", token.limits().maxInvocationsPerActor());
        if (token.limits().maxInvocationsTotal() != null) {
            limits.put("max_invocations_total", token.limits().maxInvocationsTotal());
        }
        ObjectNode binding = node.putObject("binding");
        binding.set("intent_hash", writeHash(token.binding().intentHash()));
        binding.set("contract_hash", writeHash(token.binding().contractHash()));
        binding.set("capabilities_hash", writeHash(token.binding().capabilitiesHash()));
        node.putObject("revocation").put("method", "revocation_list");
        if (token.signature() != null) {
            node.set("signature", writeSignature(token.signature()));
        }
        return node;
    }

    // ===== execution =====

    public static ExecutionRequest readExecutionRequest(ObjectNode payload) {
        return read("execution_request", () -> {
            ObjectNode node = JsonFields.requireObject(payload, "request");
            return new ExecutionRequest(
                JsonFields.requireText(node, "invocation_id"),
                JsonFields.requireText(node, "token_id"),
                JsonFields.requireText(node, "contract_id"),
                JsonFields.requireText(node, "action"),
                JsonFields.optionalText(node, "scope"),
                JsonFields.readActor(node.get("executor"), "executor"),
                JsonFields.optionalTimestamp(node, "requested_at"),
                JsonFields.optionalText(node, "nonce"),
                JsonFields.optionalObject(node, "parameters"));
        });
    }

    public static ObjectNode writeExecutionRequest(ExecutionRequest request) {
        ObjectNode payload = ProtocolJson.objectNode();
        ObjectNode node = payload.putObject("request");
        node.put("invocation_id", request.invocationId());
        node.put("token_id", request.tokenId());
        node.put("contract_id", request.contractId());
        node.put("action", request.action());
        JsonFields.putIfNotNull(node, "scope", request.scope());
        node.set("executor", JsonFields.writeActor(request.executor()));
        JsonFields.putTimestamp(node, "requested_at", request.requestedAt());
        JsonFields.putIfNotNull(node, "nonce", request.nonce());
        node.set("parameters", request.parameters());
        return payload;
    }

    public static ExecutionResult readExecutionResult(ObjectNode payload) {
        return read("execution_result", () -> {
            ObjectNode node = JsonFields.requireObject(payload, "result");
            String status = JsonFields.requireText(node, "status");
            return new ExecutionResult(
                JsonFields.requireText(node, "invocation_id"),
                JsonFields.optionalText(node, "token_id"),
                JsonFields.optionalText(node, "contract_id"),
                ExecutionStatus.fromWire(status).orElseThrow(() -> new IllegalArgumentException("unknown status: " + status)),
                JsonFields.requireTimestamp(node, "started_at"),
                JsonFields.requireTimestamp(node, "ended_at"),
                JsonFields.optionalObject(node, "output"));
        });
    }

    public static ObjectNode writeExecutionResult(ExecutionResult result) {
        ObjectNode payload = ProtocolJson.objectNode();
        ObjectNode node = payload.putObject("result");
        node.put("invocation_id", result.invocationId());
        JsonFields.putIfNotNull(node, "token_id", result.tokenId());
        JsonFields.putIfNotNull(node, "contract_id", result.contractId());
        node.put("status", result.status().wireName());
        JsonFields.putTimestamp(node, "started_at", result.startedAt());
        JsonFields.putTimestamp(node, "ended_at", result.endedAt());
        node.set("output", result.output());
        return payload;
    }

    // ===== error =====

    public static ObjectNode writeError(ErrorReport report) {
        ObjectNode payload = ProtocolJson.objectNode();
        ObjectNode node = payload.putObject("error");
        node.put("error_id", report.errorId());
        node.put("code", report.code().code());
        node.put("name", report.code().wireName());
        node.put("message", report.message());
        node.put("retryable", report.retryable());
        if (report.relatedMessageId() != null) {
            node.put("related_message_id", report.relatedMessageId().getValue());
        } else {
            node.putNull("related_message_id");
        }
        JsonFields.putTimestamp(node, "timestamp", report.timestamp());
        if (report.details() != null) {
            node.set("details", report.details());
        }
        return payload;
    }

    /**
     * 수신한 error payload에서 오류 코드 추출.
     *
     * @param payload error payload
     * @return 알려진 코드면 해당 코드, 아니면 INTERNAL_ERROR
     */
    public static IcnpErrorCode readErrorCode(ObjectNode payload) {
        String code = payload.path("error").path("code").asText("");
        return IcnpErrorCode.fromCode(code).orElse(IcnpErrorCode.INTERNAL_ERROR);
    }

    // ===== shared =====

    public static Signature readSignature(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("signature must be an object");
        }
        return new Signature(
            JsonFields.requireText(node, "alg"),
            JsonFields.requireText(node, "value"),
            JsonFields.requireText(node, "key_id"),
            JsonFields.requireText(node, "signed_by"),
            JsonFields.requireTimestamp(node, "signed_at"));
    }

    public static ObjectNode writeSignature(Signature signature) {
        ObjectNode node = ProtocolJson.objectNode();
        node.put("alg", signature.alg());
        node.put("value", signature.value());
        node.put("key_id", signature.keyId());
        node.put("signed_by", signature.signedBy());
        JsonFields.putTimestamp(node, "signed_at", signature.signedAt());
        return node;
    }

    private static HashValue readHash(ObjectNode binding, String field) {
        ObjectNode node = JsonFields.requireObject(binding, field);
        return new HashValue(JsonFields.requireText(node, "alg"), JsonFields.requireText(node, "value"));
    }

    private static ObjectNode writeHash(HashValue hash) {
        ObjectNode node = ProtocolJson.objectNode();
        node.put("alg", hash.alg());
        node.put("value", hash.value());
        return node;
    }

    private static <T> List<T> readList(JsonNode parent, String field, Function<JsonNode, T> reader) {
        ArrayNode array = JsonFields.optionalArray(parent, field);
        List<T> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        for (JsonNode element : array) {
            if (!element.isObject()) {
                throw new IllegalArgumentException("field '" + field + "' must contain only objects");
            }
            values.add(reader.apply(element));
        }
        return values;
    }

    private static <T> T read(String what, Supplier<T> reader) {
        try {
            return reader.get();
        } catch (IllegalArgumentException e) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT, "malformed " + what + " payload: " + e.getMessage(), false, null, e);
        }
    }
}
