package com.ryuqq.icnp.adapter.inmemory.transport;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.spi.Delivery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryTransport 테스트.
 *
 * <ul>
 *   <li>deliver → receive → ack</li>
 *   <li>nack 시 attempt 증가 후 재전달</li>
 *   <li>visibility timeout 만료 시 재전달</li>
 *   <li>DLQ, outbox</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class InMemoryTransportTest {

    private InMemoryTransport transport;

    @BeforeEach
    void setUp() {
        transport = new InMemoryTransport();
    }

    private static ObjectNode envelope(String sessionId) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("session_id", sessionId);
        node.put("type", "intent_declaration");
        return node;
    }

    // ============================================================
    // 1. 기본 흐름
    // ============================================================

    @Test
    void receive_전달된_envelope을_attempt_1로_반환() {
        // given
        transport.deliver(envelope("s-1"), 0);

        // when
        List<Delivery> batch = transport.receive(10);

        // then
        assertThat(batch).hasSize(1);
        assertThat(batch.get(0).attempt()).isEqualTo(1);
        assertThat(batch.get(0).sessionKey()).isEqualTo("s-1");
        assertThat(transport.queueSize()).isZero();
        assertThat(transport.inFlightSize()).isEqualTo(1);
    }

    @Test
    void ack_후_inFlight에서_제거() {
        transport.deliver(envelope("s-1"), 0);
        Delivery delivery = transport.receive(1).get(0);

        transport.ack(delivery);

        assertThat(transport.inFlightSize()).isZero();
        assertThat(transport.receive(10)).isEmpty();
    }

    @Test
    void receive_batchSize만큼만_반환() {
        for (int i = 0; i < 5; i++) {
            transport.deliver(envelope("s-" + i), 0);
        }

        assertThat(transport.receive(3)).hasSize(3);
        assertThat(transport.queueSize()).isEqualTo(2);
    }

    @Test
    void receive_지연된_envelope은_즉시_반환되지_않음() {
        transport.deliver(envelope("s-1"), 60_000);

        assertThat(transport.receive(10)).isEmpty();
        assertThat(transport.queueSize()).isEqualTo(1);
    }

    // ============================================================
    // 2. 재전달
    // ============================================================

    @Test
    void nack_후_attempt가_증가한_새_delivery로_재전달() {
        // given
        transport.deliver(envelope("s-1"), 0);
        Delivery first = transport.receive(1).get(0);

        // when
        transport.nack(first);
        Delivery second = transport.receive(1).get(0);

        // then
        assertThat(second.attempt()).isEqualTo(2);
        assertThat(second.deliveryId()).isNotEqualTo(first.deliveryId());
        assertThat(second.envelope()).isEqualTo(first.envelope());
    }

    @Test
    void nack_이미_ack된_delivery는_무시() {
        transport.deliver(envelope("s-1"), 0);
        Delivery delivery = transport.receive(1).get(0);
        transport.ack(delivery);

        transport.nack(delivery);

        assertThat(transport.queueSize()).isZero();
    }

    @Test
    void processVisibilityTimeouts_만료된_delivery를_재전달() throws InterruptedException {
        // given
        InMemoryTransport shortTimeout = new InMemoryTransport(10);
        shortTimeout.deliver(envelope("s-1"), 0);
        shortTimeout.receive(1);

        // when
        Thread.sleep(30);
        int requeued = shortTimeout.processVisibilityTimeouts();

        // then
        assertThat(requeued).isEqualTo(1);
        assertThat(shortTimeout.receive(1).get(0).attempt()).isEqualTo(2);
    }

    // ============================================================
    // 3. DLQ, outbox
    // ============================================================

    @Test
    void deadLetter_사유와_함께_DLQ에_보관() {
        transport.deliver(envelope("s-1"), 0);
        Delivery delivery = transport.receive(1).get(0);

        transport.deadLetter(delivery, "max attempts exceeded");

        assertThat(transport.dlqSize()).isEqualTo(1);
        assertThat(transport.inFlightSize()).isZero();
        assertThat(transport.getDeadLetters().get(0).getReason()).isEqualTo("max attempts exceeded");
    }

    @Test
    void send_outbox에_사본으로_보관() {
        ObjectNode outbound = envelope("s-1");

        transport.send(outbound);
        outbound.put("type", "mutated");

        assertThat(transport.sent()).singleElement()
            .satisfies(sent -> assertThat(sent.get("type").asText()).isEqualTo("intent_declaration"));
    }

    @Test
    void deliver_음수_delay는_예외() {
        assertThatThrownBy(() -> transport.deliver(envelope("s-1"), -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
