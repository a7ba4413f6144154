package com.ryuqq.icnp.application.engine;

import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.ActorRole;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EngineConfigTest {

    // ========== defaults ==========

    @Test
    void 기본값() {
        // When
        EngineConfig config = EngineConfig.defaults();

        // Then
        assertEquals("1.0.0", config.icnpVersion());
        assertEquals(1, config.supportedMajorVersion());
        assertEquals(Duration.ofMinutes(15), config.negotiationTtl());
        assertEquals(Duration.ofMinutes(10), config.tokenTtl());
        assertEquals(3, config.invocationLimits().maxInvocationsPerActor());
        assertEquals(20, config.invocationLimits().maxInvocationsTotal());
        assertEquals("engine-key", config.signingKeyRef());
    }

    // ========== withX ==========

    @Test
    void withX는_해당_값만_바꾼_사본을_만든다() {
        // Given
        EngineConfig defaults = EngineConfig.defaults();

        // When
        EngineConfig changed = defaults
            .withTokenTtl(Duration.ofSeconds(30))
            .withMaxInvocationsTotal(null)
            .withEngineActor(Actor.of("engine-2", ActorRole.ORCHESTRATOR));

        // Then
        assertEquals(Duration.ofSeconds(30), changed.tokenTtl());
        assertNull(changed.invocationLimits().maxInvocationsTotal());
        assertEquals("engine-2", changed.engineActor().id());
        assertEquals(defaults.negotiationTtl(), changed.negotiationTtl());
        assertEquals(Duration.ofMinutes(10), defaults.tokenTtl());
    }

    // ========== validation ==========

    @Test
    void 버전_형식이_틀리면_예외() {
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig("1.0", Actor.of("e", ActorRole.ORCHESTRATOR),
            Duration.ofMinutes(1), Duration.ofMinutes(1), 1, null, "k", 0.0));
    }

    @Test
    void 실행자별_한도가_0이면_예외() {
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfig.defaults().withMaxInvocationsPerActor(0));
    }

    @Test
    void 토큰_TTL이_음수면_예외() {
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfig.defaults().withTokenTtl(Duration.ofSeconds(-1)));
    }

    @Test
    void 최소_점수가_범위를_벗어나면_예외() {
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfig.defaults().withMinimumMatchScore(1.5));
    }
}
