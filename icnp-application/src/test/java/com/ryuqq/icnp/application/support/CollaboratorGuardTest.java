package com.ryuqq.icnp.application.support;

import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.protection.Collaborator;
import com.ryuqq.icnp.core.protection.FixedCollaboratorTimeoutPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollaboratorGuardTest {

    private final FixedCollaboratorTimeoutPolicy policy =
        new FixedCollaboratorTimeoutPolicy(0, Map.of(Collaborator.SIGNER, 50L, Collaborator.VERIFIER, 50L));
    private final CollaboratorGuard guard = new CollaboratorGuard(policy);
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() throws InterruptedException {
        release.countDown();
        guard.shutdown();
    }

    // ============================================================
    // 1. 정상 호출
    // ============================================================

    @Test
    void 타임아웃이_0이면_호출_스레드에서_직접_실행한다() {
        // given
        Thread caller = Thread.currentThread();

        // when
        Thread executed = guard.call(Collaborator.CANONICALIZER, Thread::currentThread);

        // then
        assertThat(executed).isSameAs(caller);
    }

    @Test
    void 타임아웃_안에_끝나면_결과를_반환한다() {
        // when
        String result = guard.call(Collaborator.SIGNER, () -> "signed");

        // then
        assertThat(result).isEqualTo("signed");
        assertThat(policy.timeoutCount(Collaborator.SIGNER)).isZero();
    }

    // ============================================================
    // 2. 타임아웃
    // ============================================================

    @Test
    void call_타임아웃이면_재시도_가능한_INTERNAL_ERROR() {
        assertThatThrownBy(() -> guard.call(Collaborator.SIGNER, this::blockUntilReleased))
            .isInstanceOf(IcnpException.class)
            .satisfies(e -> {
                IcnpException icnp = (IcnpException) e;
                assertThat(icnp.getCode()).isEqualTo(IcnpErrorCode.INTERNAL_ERROR);
                assertThat(icnp.isRetryable()).isTrue();
                assertThat(icnp.getMessage()).contains("signer timed out");
            });
        assertThat(policy.timeoutCount(Collaborator.SIGNER)).isEqualTo(1);
    }

    @Test
    void callOrElse_타임아웃이면_대체값을_반환한다() {
        // when
        Boolean verified = guard.callOrElse(Collaborator.VERIFIER, () -> {
            blockUntilReleased();
            return true;
        }, false);

        // then
        assertThat(verified).isFalse();
        assertThat(policy.timeoutCount(Collaborator.VERIFIER)).isEqualTo(1);
    }

    // ============================================================
    // 3. 예외 전파
    // ============================================================

    @Test
    void 협력자의_RuntimeException은_그대로_전파된다() {
        assertThatThrownBy(() -> guard.call(Collaborator.SIGNER, () -> {
            throw new IllegalArgumentException("unknown keyRef: nope");
        }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("unknown keyRef: nope");
    }

    @Test
    void 정책이_null이면_예외() {
        assertThatThrownBy(() -> new CollaboratorGuard(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private String blockUntilReleased() {
        try {
            release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "late";
    }
}
