package com.starksync.common.retry;

import com.starksync.common.exception.StarkSyncException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Factory for the bounded exponential-backoff retries used around L1, feeder
 * and storage calls. Each retry logs its attempts so failures stay visible
 * even when a later attempt succeeds.
 *
 * <p>Only exceptions of the listed types are retried, and a
 * {@link StarkSyncException} flagged as not retryable never is.
 */
@Slf4j
public final class RetryPolicies {

    private RetryPolicies() {
    }

    @SafeVarargs
    public static Retry exponentialBackoff(String name,
                                           int maxAttempts,
                                           Duration initialBackoff,
                                           double multiplier,
                                           Class<? extends Throwable>... retryOn) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1L, initialBackoff.toMillis()), multiplier))
                .retryOnException(error -> shouldRetry(error, retryOn))
                .build();

        Retry retry = Retry.of(name, config);
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Retrying operation={}, attempt={}, wait={}ms, error={}",
                        name, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null))
                .onError(event -> log.error("Retries exhausted: operation={}, attempts={}, error={}",
                        name, event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null));
        return retry;
    }

    private static boolean shouldRetry(Throwable error, Class<? extends Throwable>[] retryOn) {
        if (error instanceof StarkSyncException syncError && !syncError.isRetryable()) {
            return false;
        }
        for (Class<? extends Throwable> type : retryOn) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }
}
