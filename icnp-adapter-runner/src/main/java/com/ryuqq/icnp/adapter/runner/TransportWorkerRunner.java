package com.ryuqq.icnp.adapter.runner;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.application.engine.EngineResponse;
import com.ryuqq.icnp.application.engine.NegotiationEngine;
import com.ryuqq.icnp.core.spi.Delivery;
import com.ryuqq.icnp.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Transport에서 엔벨로프를 꺼내 엔진에 전달하는 워커 러너.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. transport.receive(batchSize) → [Delivery1, Delivery2, ...]
 * 2. 각 Delivery를 session_id 해시로 고른 레인에 제출
 * 3. 레인 스레드에서:
 *    a. engine.handle(envelope) → EngineResponse
 *    b. 응답의 outbound 엔벨로프를 transport.send()
 *    c. transport.ack(delivery)
 * 4. 예외 발생 시:
 *    - attempt &lt; maxDeliveryAttempts: nack (재전달)
 *    - attempt &gt;= maxDeliveryAttempts: deadLetter
 * </pre>
 *
 * <p><strong>순서 보장:</strong> 레인은 단일 스레드 executor이므로 같은 세션의
 * delivery는 receive 순서대로 처리됩니다. 세션 간에는 순서를 보장하지 않습니다.</p>
 *
 * <p>프로토콜 오류(REJECTED 응답)는 정상 처리로 간주하여 error 엔벨로프를 송신하고 ack 합니다.
 * 재전달 대상은 엔진이나 transport가 예외를 던진 경우뿐입니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class TransportWorkerRunner {

    private static final Logger log = LoggerFactory.getLogger(TransportWorkerRunner.class);

    private final Transport transport;
    private final NegotiationEngine engine;
    private final TransportWorkerConfig config;
    private final ExecutorService[] lanes;

    private final AtomicLong acknowledged = new AtomicLong();
    private final AtomicLong redelivered = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    /**
     * 생성자.
     *
     * @param transport 메시지 전송 계층
     * @param engine 협상 엔진
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TransportWorkerRunner(Transport transport, NegotiationEngine engine, TransportWorkerConfig config) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.transport = transport;
        this.engine = engine;
        this.config = config;
        this.lanes = new ExecutorService[config.lanes()];
        for (int i = 0; i < lanes.length; i++) {
            String name = "icnp-lane-" + i;
            lanes[i] = Executors.newSingleThreadExecutor(r -> {
                Thread thread = new Thread(r, name);
                thread.setDaemon(true);
                return thread;
            });
        }
    }

    /**
     * 한 배치를 receive하여 레인에 제출.
     *
     * <p>반환된 future는 이번 배치의 모든 delivery가 ack, nack 또는 DLQ 처리되면 완료됩니다.</p>
     *
     * @return 배치 처리 완료 future
     */
    public CompletableFuture<Void> pump() {
        List<Delivery> batch = transport.receive(config.batchSize());
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        List<CompletableFuture<Void>> submitted = new ArrayList<>(batch.size());
        for (Delivery delivery : batch) {
            submitted.add(CompletableFuture.runAsync(() -> processDelivery(delivery), laneFor(delivery)));
        }
        log.debug("Pumped {} deliveries", batch.size());
        return CompletableFuture.allOf(submitted.toArray(new CompletableFuture[0]));
    }

    /**
     * Runner 종료.
     *
     * <p>각 레인을 graceful shutdown하고, shutdownTimeoutMs 안에 끝나지 않으면 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        for (ExecutorService lane : lanes) {
            lane.shutdown();
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.shutdownTimeoutMs());
        for (ExecutorService lane : lanes) {
            long remaining = deadline - System.nanoTime();
            if (!lane.awaitTermination(Math.max(remaining, 0), TimeUnit.NANOSECONDS)) {
                lane.shutdownNow();
            }
        }
    }

    public long getAcknowledgedCount() {
        return acknowledged.get();
    }

    public long getRedeliveredCount() {
        return redelivered.get();
    }

    public long getDeadLetteredCount() {
        return deadLettered.get();
    }

    private ExecutorService laneFor(Delivery delivery) {
        return lanes[Math.floorMod(delivery.sessionKey().hashCode(), lanes.length)];
    }

    private void processDelivery(Delivery delivery) {
        try {
            EngineResponse response = engine.handle(delivery.envelope());
            for (ObjectNode outbound : response.getOutbound()) {
                transport.send(outbound);
            }
            transport.ack(delivery);
            acknowledged.incrementAndGet();
            if (response.isRejected()) {
                log.debug("Delivery {} rejected with {}", delivery.deliveryId(), response.getErrorCodeOrNull());
            }
        } catch (RuntimeException e) {
            handleFailure(delivery, e);
        }
    }

    private void handleFailure(Delivery delivery, RuntimeException cause) {
        if (delivery.attempt() >= config.maxDeliveryAttempts()) {
            log.error("Delivery {} failed on attempt {}, moving to DLQ",
                delivery.deliveryId(), delivery.attempt(), cause);
            transport.deadLetter(delivery, describe(cause));
            deadLettered.incrementAndGet();
            return;
        }
        log.warn("Delivery {} failed on attempt {}, returning for redelivery: {}",
            delivery.deliveryId(), delivery.attempt(), cause.getMessage());
        transport.nack(delivery);
        redelivered.incrementAndGet();
    }

    private static String describe(RuntimeException cause) {
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
