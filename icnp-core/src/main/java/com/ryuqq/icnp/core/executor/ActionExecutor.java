package com.ryuqq.icnp.core.executor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.execution.ExecutionRequest;

/**
 * 허가된 실행 요청을 실제로 수행하는 외부 행위 SPI.
 *
 * <p>Enforcement Gate가 요청을 통과시킨 뒤에만 호출됩니다. 예외를 던지면
 * 실행 결과는 {@code failed} 상태로 보고됩니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public interface ActionExecutor {

    /**
     * 행위 수행.
     *
     * @param request 실행 요청
     * @return 산출물 JSON (null이면 빈 객체로 보고)
     */
    ObjectNode perform(ExecutionRequest request);
}
