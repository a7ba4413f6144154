package com.ryuqq.icnp.core.contract;

import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.ActorRole;
import com.ryuqq.icnp.core.model.SessionId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EffectiveAuthorization 테스트.
 *
 * <p>금지 목록은 합의 목록보다 항상 우선합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class EffectiveAuthorizationTest {

    private static final SessionId SESSION = SessionId.of("3f2b8c1e-9a4d-4c7b-8e21-5d6f7a8b9c0d");

    private static Contract contract(List<AgreedAction> agreed, List<ForbiddenAction> forbidden) {
        return new Contract(
            "contract-1",
            SESSION,
            Instant.parse("2026-01-01T00:00:00Z"),
            List.of(Actor.of("tool-1", ActorRole.TOOL)),
            agreed,
            forbidden,
            null,
            Enforcement.strictDefault(),
            List.of(),
            null
        );
    }

    private static AgreedAction agreed(String action, String scope) {
        return new AgreedAction("aa-" + action, "cap-1", "tool-1", action, scope, null);
    }

    // ========== 허용 ==========

    @Test
    void authorize_AgreedActionAndScope_Permits() {
        // Given
        Contract contract = contract(List.of(agreed("read_file", "workspace")), List.of());

        // When
        Authorization authorization = EffectiveAuthorization.authorize(contract, "tool-1", "read_file", "workspace");

        // Then
        assertTrue(authorization.permitted());
        assertEquals("aa-read_file", authorization.agreedAction().actionId());
    }

    @Test
    void authorize_UnscopedAgreedAction_PermitsAnyScope() {
        Contract contract = contract(List.of(agreed("read_file", null)), List.of());

        assertTrue(EffectiveAuthorization.authorize(contract, "tool-1", "read_file", "logs").permitted());
    }

    // ========== 거절 ==========

    @Test
    void authorize_ActionNotAgreed_Denies() {
        Contract contract = contract(List.of(agreed("read_file", "workspace")), List.of());

        Authorization authorization = EffectiveAuthorization.authorize(contract, "tool-1", "delete_file", "workspace");

        assertFalse(authorization.permitted());
        assertTrue(authorization.reason().contains("not agreed"));
    }

    @Test
    void authorize_DifferentExecutor_Denies() {
        Contract contract = contract(List.of(agreed("read_file", "workspace")), List.of());

        assertFalse(EffectiveAuthorization.authorize(contract, "tool-2", "read_file", "workspace").permitted());
    }

    @Test
    void authorize_ScopeMismatch_Denies() {
        Contract contract = contract(List.of(agreed("read_file", "workspace")), List.of());

        assertFalse(EffectiveAuthorization.authorize(contract, "tool-1", "read_file", "system").permitted());
    }

    // ========== 금지 우선 ==========

    @Test
    void authorize_ActionBothAgreedAndForbidden_ForbiddenWins() {
        // Given
        Contract contract = contract(
            List.of(agreed("delete_file", "workspace")),
            List.of(new ForbiddenAction("delete_file", "workspace", "destructive"))
        );

        // When
        Authorization authorization = EffectiveAuthorization.authorize(contract, "tool-1", "delete_file", "workspace");

        // Then
        assertFalse(authorization.permitted());
        assertTrue(authorization.reason().contains("forbidden"));
    }

    @Test
    void authorize_ForbiddenWithAnyScope_CoversEveryScope() {
        Contract contract = contract(
            List.of(agreed("delete_file", null)),
            List.of(new ForbiddenAction("delete_file", "any", "destructive"))
        );

        assertFalse(EffectiveAuthorization.authorize(contract, "tool-1", "delete_file", "tmp").permitted());
        assertFalse(EffectiveAuthorization.authorize(contract, "tool-1", "delete_file", null).permitted());
    }

    @Test
    void authorize_UnscopedRequestAgainstScopedForbidden_Denies() {
        Contract contract = contract(
            List.of(agreed("write_file", null)),
            List.of(new ForbiddenAction("write_file", "system", "protected"))
        );

        assertFalse(EffectiveAuthorization.authorize(contract, "tool-1", "write_file", null).permitted());
        assertTrue(EffectiveAuthorization.authorize(contract, "tool-1", "write_file", "workspace").permitted());
    }

    @Test
    void isForbidden_UnrelatedAction_ReturnsFalse() {
        Contract contract = contract(List.of(), List.of(new ForbiddenAction("delete_file", null, "destructive")));

        assertFalse(EffectiveAuthorization.isForbidden(contract, "read_file", "workspace"));
        assertTrue(EffectiveAuthorization.isForbidden(contract, "delete_file", "workspace"));
    }

    @Test
    void authorize_NullContract_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> EffectiveAuthorization.authorize(null, "tool-1", "read_file", null));
    }
}
