package com.ryuqq.icnp.core.protection;

/**
 * Collaborator Timeout Policy SPI.
 *
 * <p>외부 협력자 호출의 최대 허용 시간을 정하여 세션 락을 쥔 채 무한 대기하는 것을 막습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * long timeout = policy.timeoutMs(Collaborator.SIGNER);
 * if (timeout > 0) {
 *     Future<Signature> future = executor.submit(() -> signer.sign(bytes, keyRef));
 *     try {
 *         return future.get(timeout, TimeUnit.MILLISECONDS);
 *     } catch (TimeoutException e) {
 *         policy.recordTimeout(Collaborator.SIGNER, timeout);
 *         throw new IcnpException(IcnpErrorCode.INTERNAL_ERROR, "signer timed out", true);
 *     }
 * }
 * }</pre>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public interface CollaboratorTimeoutPolicy {

    /**
     * 협력자별 호출 타임아웃 조회.
     *
     * @param collaborator 협력자 종류
     * @return 타임아웃 (밀리초), 0은 타임아웃 없이 호출 스레드에서 직접 실행
     */
    long timeoutMs(Collaborator collaborator);

    /**
     * 타임아웃 발생 기록.
     *
     * @param collaborator 협력자 종류
     * @param elapsedMs 경과 시간 (밀리초)
     */
    void recordTimeout(Collaborator collaborator, long elapsedMs);
}
