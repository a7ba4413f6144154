package com.ryuqq.icnp.application.support;

import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.protection.Collaborator;
import com.ryuqq.icnp.core.protection.CollaboratorTimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 협력자 호출에 타임아웃을 적용하는 실행기.
 *
 * <p>타임아웃이 0이면 호출 스레드에서 직접 실행합니다. 그 외에는 전용 daemon 스레드
 * 풀에 제출하고 지정한 시간만큼만 기다립니다.</p>
 *
 * <p><strong>예외 처리:</strong></p>
 * <ul>
 *   <li>타임아웃: {@link #call}은 retryable internal_error, {@link #callOrElse}는 대체 값</li>
 *   <li>협력자가 던진 RuntimeException/Error: 그대로 전파</li>
 *   <li>인터럽트: 인터럽트 플래그 복원 후 retryable internal_error</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class CollaboratorGuard {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorGuard.class);

    private final CollaboratorTimeoutPolicy policy;
    private final ExecutorService executor;

    public CollaboratorGuard(CollaboratorTimeoutPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.policy = policy;
        this.executor = Executors.newCachedThreadPool(new CollaboratorThreadFactory());
    }

    /**
     * 타임아웃을 적용하여 호출.
     *
     * @param collaborator 협력자 종류
     * @param action 호출 내용
     * @return 호출 결과
     * @throws IcnpException 타임아웃 또는 인터럽트 (INTERNAL_ERROR, retryable)
     */
    public <T> T call(Collaborator collaborator, Supplier<T> action) {
        return invoke(collaborator, action, null, false);
    }

    /**
     * 타임아웃을 음성 결과로 취급하는 호출.
     *
     * @param collaborator 협력자 종류
     * @param action 호출 내용
     * @param onTimeout 타임아웃 시 반환할 값
     * @return 호출 결과 또는 onTimeout
     */
    public <T> T callOrElse(Collaborator collaborator, Supplier<T> action, T onTimeout) {
        return invoke(collaborator, action, onTimeout, true);
    }

    private <T> T invoke(Collaborator collaborator, Supplier<T> action, T onTimeout, boolean fallback) {
        long timeoutMs = policy.timeoutMs(collaborator);
        if (timeoutMs <= 0) {
            return action.get();
        }

        Future<T> future = executor.submit(action::get);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            policy.recordTimeout(collaborator, timeoutMs);
            log.warn("Collaborator {} timed out after {}ms", collaborator, timeoutMs);
            if (fallback) {
                return onTimeout;
            }
            throw new IcnpException(IcnpErrorCode.INTERNAL_ERROR,
                collaborator.name().toLowerCase(Locale.ROOT) + " timed out after " + timeoutMs + "ms", true, null, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IcnpException(IcnpErrorCode.INTERNAL_ERROR,
                collaborator.name().toLowerCase(Locale.ROOT) + " failed: " + cause, true, null, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IcnpException(IcnpErrorCode.INTERNAL_ERROR,
                "interrupted while waiting for " + collaborator.name().toLowerCase(Locale.ROOT), true, null, e);
        }
    }

    /**
     * 스레드 풀 종료.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }

    private static final class CollaboratorThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "icnp-collaborator-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
