/**
 * Runner Adapter Layer - 엔진 운영 컴포넌트.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.icnp.adapter.runner.TransportWorkerRunner} - Transport → 엔진 → Transport 펌프 (세션별 레인)</li>
 *   <li>{@link com.ryuqq.icnp.adapter.runner.SessionReaper} - 세션 만료 및 종료 세션 정리</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (TransportWorkerRunner, SessionReaper)
 *   ↓ depends on
 * application (NegotiationEngine)
 *   ↓ depends on
 * core (Transport, Delivery SPI)
 * </pre>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
package com.ryuqq.icnp.adapter.runner;
