package com.ryuqq.icnp.application.intent;

import com.ryuqq.icnp.application.ApplicationFixture;
import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.core.audit.AuditEvent;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.intent.Intent;
import com.ryuqq.icnp.core.intent.RiskTolerance;
import com.ryuqq.icnp.core.model.SessionId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ryuqq.icnp.application.ApplicationFixture.INITIATOR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentRegistryTest {

    private final ApplicationFixture fixture = new ApplicationFixture();

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.shutdown();
    }

    private Session emptySession() {
        return fixture.components.sessionStore().createSession(SessionId.random(), INITIATOR).orElseThrow();
    }

    private void expectInvalid(Session session, Intent intent) {
        assertThatThrownBy(() -> fixture.locked(session, s -> {
            fixture.intentRegistry.recordIntent(s, intent);
            return null;
        }))
            .isInstanceOf(IcnpException.class)
            .satisfies(e -> assertThat(((IcnpException) e).getCode()).isEqualTo(IcnpErrorCode.INVALID_INTENT));
    }

    @Test
    void 의도를_기록하면_정규_payload와_감사_기록이_남는다() {
        // given
        Session session = emptySession();

        // when
        fixture.locked(session, s -> {
            fixture.intentRegistry.recordIntent(s, ApplicationFixture.simpleIntent("read", "summarize"));
            return null;
        });

        // then
        assertThat(session.intent().requests("summarize")).isTrue();
        assertThat(session.intentPayload().get("constraints").get("risk_tolerance").asText()).isEqualTo("low");
        AuditEvent recorded = fixture.auditSink.eventsFor(session.id(), AuditEventKind.INTENT_RECORDED).get(0);
        assertThat(recorded.detail("requested_actions")).isEqualTo("2");
    }

    @Test
    void 요청_행위가_없으면_invalid_intent() {
        expectInvalid(emptySession(), ApplicationFixture.simpleIntent());
    }

    @Test
    void goal이_비어_있으면_invalid_intent() {
        Intent blankGoal = new Intent(" ", ApplicationFixture.simpleIntent("read").requestedActions(), List.of(), null);
        expectInvalid(emptySession(), blankGoal);
    }

    @Test
    void 위험_허용도_NONE인데_승인이_없으면_invalid_intent() {
        expectInvalid(emptySession(), ApplicationFixture.intent(false, RiskTolerance.NONE, false, "read"));
    }

    @Test
    void 의도는_한_번만_기록할_수_있다() {
        Session session = fixture.newSession(ApplicationFixture.simpleIntent("read"));
        expectInvalid(session, ApplicationFixture.simpleIntent("write"));
    }
}
