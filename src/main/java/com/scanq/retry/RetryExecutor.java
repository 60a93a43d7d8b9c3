package com.scanq.retry;

import com.scanq.config.ScanQProperties;
import com.scanq.error.ClassifiedError;
import com.scanq.error.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Re-invokes an operation with exponential backoff until it succeeds, fails with a
 * non-retryable error, or runs out of attempts. The last observed error is rethrown unchanged.
 */
@Component
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ErrorClassifier errorClassifier;
    private final RetryPolicy defaultPolicy;
    private final Sleeper sleeper;

    @Autowired
    public RetryExecutor(ErrorClassifier errorClassifier, ScanQProperties properties) {
        this(errorClassifier, toPolicy(properties.getRetry()), Sleeper.THREAD);
    }

    public RetryExecutor(ErrorClassifier errorClassifier, RetryPolicy defaultPolicy, Sleeper sleeper) {
        this.errorClassifier = errorClassifier;
        this.defaultPolicy = defaultPolicy;
        this.sleeper = sleeper;
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public <T> T retry(Callable<T> operation, String context) throws Exception {
        return retry(operation, defaultPolicy, context);
    }

    public <T> T retry(Callable<T> operation, RetryPolicy policy, String context) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        RetryPolicy effective = policy == null ? defaultPolicy : policy;

        for (int attempt = 1; ; attempt++) {
            try {
                T result = operation.call();
                if (attempt > 1) {
                    log.info("Retry succeeded on attempt {} [{}]", attempt, context);
                }
                return result;
            } catch (Exception e) {
                ClassifiedError classified = errorClassifier.classify(e);
                if (!classified.retryable()) {
                    log.warn("Non-retryable {} encountered on attempt {} [{}]: {}", classified.kind(), attempt,
                            context, classified.message());
                    throw e;
                }
                if (attempt >= effective.maxAttempts()) {
                    log.error("All {} retry attempts failed [{}]", effective.maxAttempts(), context, e);
                    throw e;
                }

                Duration delay = effective.delayForAttempt(attempt);
                log.warn("Attempt {}/{} failed with {}, retrying in {} ms [{}]: {}", attempt,
                        effective.maxAttempts(), classified.kind(), delay.toMillis(), context, classified.message());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(interrupted);
                    log.warn("Retry backoff interrupted after attempt {} [{}]", attempt, context);
                    throw e;
                }
            }
        }
    }

    public <T> T retryQuery(Callable<T> query, String queryName) throws Exception {
        return retry(query, defaultPolicy, "Query: " + queryName);
    }

    public <T> T retryConnection(Callable<T> connect) throws Exception {
        return retry(connect, defaultPolicy, "Warehouse connection");
    }

    private static RetryPolicy toPolicy(ScanQProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialDelay(), retry.getMaxDelay(),
                retry.getBackoffMultiplier());
    }
}
