package com.ryuqq.icnp.application.token;

import com.ryuqq.icnp.application.ApplicationFixture;
import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.core.audit.AuditEvent;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.contract.Contract;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.intent.RiskTolerance;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.ActorRole;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import com.ryuqq.icnp.core.token.ExecutionToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.ryuqq.icnp.application.ApplicationFixture.AGENT_A;
import static com.ryuqq.icnp.application.ApplicationFixture.INITIATOR;
import static com.ryuqq.icnp.application.ApplicationFixture.START;
import static com.ryuqq.icnp.application.ApplicationFixture.agreed;
import static com.ryuqq.icnp.application.ApplicationFixture.capability;
import static com.ryuqq.icnp.application.ApplicationFixture.simpleIntent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenIssuerTest {

    private final ApplicationFixture fixture = new ApplicationFixture();

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.shutdown();
    }

    private TokenIssuer issuer() {
        return fixture.components.tokenIssuer();
    }

    private Session negotiatedSession() {
        Session session = fixture.newSession(simpleIntent("read"));
        fixture.disclose(session, AGENT_A, capability("cap-a", AGENT_A, "read", List.of("any"), false, null));
        return session;
    }

    private Contract readContract(Session session) {
        return fixture.draft(session, List.of(agreed("cap-a", AGENT_A, "read", null)), List.of(), null, List.of());
    }

    // ============================================================
    // 1. 발급
    // ============================================================

    @Test
    void 확정된_계약으로_토큰을_발급하면_TOKEN_단계가_된다() {
        // given
        Session session = negotiatedSession();

        // when
        ExecutionToken token = fixture.negotiate(session, readContract(session));

        // then
        assertThat(session.phase()).isEqualTo(SessionPhase.TOKEN);
        assertThat(session.token()).isEqualTo(token);
        assertThat(token.issuer().id()).isEqualTo("icnp-engine");
        assertThat(token.audience()).extracting(Actor::id).containsExactly(AGENT_A.id());
        assertThat(token.audience().get(0).role()).isEqualTo(ActorRole.AGENT);
        assertThat(token.validity().notBefore()).isEqualTo(START);
        assertThat(token.validity().notAfter()).isEqualTo(START.plus(Duration.ofMinutes(10)));
        assertThat(token.limits().maxInvocationsPerActor()).isEqualTo(3);
        assertThat(token.signature().keyId()).isEqualTo("engine-key");

        AuditEvent issued = fixture.auditSink.eventsFor(session.id(), AuditEventKind.TOKEN_ISSUED).get(0);
        assertThat(issued.detail("token_id")).isEqualTo(token.tokenId());
    }

    @Test
    void 바인딩_해시는_세션_산출물에서_다시_계산한_값과_같다() {
        // given
        Session session = negotiatedSession();

        // when
        ExecutionToken token = fixture.negotiate(session, readContract(session));

        // then
        BindingHasher hasher = new BindingHasher(fixture.canonicalizer, fixture.components.guard());
        assertThat(hasher.compute(session, session.acceptedContract())).isEqualTo(token.binding());
        assertThat(token.binding().intentHash().value()).hasSize(64);
    }

    @Test
    void 확정되지_않은_계약으로는_발급할_수_없다() {
        // given
        Session session = negotiatedSession();
        Contract draft = readContract(session);
        fixture.locked(session, s -> fixture.components.negotiator().propose(s, INITIATOR, draft));

        // when & then
        assertThatThrownBy(() -> fixture.locked(session, s -> issuer().issue(s, draft)))
            .isInstanceOf(IcnpException.class)
            .satisfies(e -> assertThat(((IcnpException) e).getCode()).isEqualTo(IcnpErrorCode.TOKEN_INVALID));
        assertThat(session.token()).isNull();
    }

    @Test
    void 승인이_필요한_계약은_승인_없이_발급할_수_없다() {
        // given
        Session session = fixture.newSession(ApplicationFixture.intent(true, RiskTolerance.LOW, false, "read"));
        fixture.disclose(session, AGENT_A, capability("cap-a", AGENT_A, "read", List.of("any"), false, null));
        Contract draft = readContract(session);
        fixture.locked(session, s -> fixture.components.negotiator().propose(s, INITIATOR, draft));

        // when & then
        assertThatThrownBy(() -> fixture.locked(session, s -> issuer().issue(s, draft)))
            .isInstanceOf(IcnpException.class)
            .satisfies(e -> assertThat(((IcnpException) e).getCode()).isEqualTo(IcnpErrorCode.UNAUTHORISED_ACTION));
    }

    @Test
    void CONTRACT_단계가_아니면_token_invalid() {
        // given
        Session session = negotiatedSession();

        // when & then
        assertThatThrownBy(() -> fixture.locked(session, s -> issuer().issue(s, readContract(s))))
            .isInstanceOf(IcnpException.class)
            .satisfies(e -> assertThat(((IcnpException) e).getCode()).isEqualTo(IcnpErrorCode.TOKEN_INVALID));
    }

    // ============================================================
    // 2. 유효 구간 경계
    // ============================================================

    @Test
    void not_before는_포함하고_not_after는_포함하지_않는다() {
        // given
        Session session = negotiatedSession();
        ExecutionToken token = fixture.negotiate(session, readContract(session));

        // when & then
        assertThat(issuer().validate(token, token.validity().notBefore().minusMillis(1))).isFalse();
        assertThat(issuer().validate(token, token.validity().notBefore())).isTrue();
        assertThat(issuer().validate(token, token.validity().notAfter().minusMillis(1))).isTrue();
        assertThat(issuer().validate(token, token.validity().notAfter())).isFalse();
    }

    @Test
    void 본문이_바뀐_토큰은_서명_검증에_실패한다() {
        // given
        Session session = negotiatedSession();
        ExecutionToken token = fixture.negotiate(session, readContract(session));
        ExecutionToken widened = new ExecutionToken(token.tokenId(), token.sessionId(), token.contractId(),
            token.issuer(), List.of(AGENT_A, ApplicationFixture.AGENT_B), token.issuedAt(), token.validity(),
            token.limits(), token.binding(), token.signature());

        // when & then
        assertThat(issuer().validate(widened, START)).isFalse();
        assertThat(issuer().validate(token.unsignedBody(), START)).isFalse();
    }

    // ============================================================
    // 3. 폐기
    // ============================================================

    @Test
    void 폐기된_토큰은_유효하지_않고_폐기는_한_번만_기록된다() {
        // given
        Session session = negotiatedSession();
        ExecutionToken token = fixture.negotiate(session, readContract(session));

        // when
        boolean first = issuer().revoke(session, "operator request");
        boolean second = issuer().revoke(token.tokenId(), "again");

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(issuer().validate(token, START)).isFalse();
        List<AuditEvent> revoked = fixture.auditSink.eventsFor(session.id(), AuditEventKind.TOKEN_REVOKED);
        assertThat(revoked).hasSize(1);
        assertThat(revoked.get(0).detail("reason")).isEqualTo("operator request");
        assertThat(fixture.revocations.reasonFor(token.tokenId())).contains("operator request");
    }

    @Test
    void 토큰이_없는_세션을_폐기하면_false() {
        Session session = negotiatedSession();
        assertThat(issuer().revoke(session, null)).isFalse();
    }
}
