package dao.sol.bundler.scheduler;

import dao.sol.bundler.config.VolumeProperties;
import dao.sol.bundler.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;

/**
 * Retries transient network failures with exponential backoff.
 * The delay before attempt k+1 is min(baseDelayMs * 2^(k-1), maxDelayMs).
 */
@Slf4j
@Component
public class RetryExecutor {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int defaultMaxAttempts;
    private final Sleeper sleeper;

    @Autowired
    public RetryExecutor(VolumeProperties props, Sleeper sleeper) {
        this(props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs(), props.getRetry().getMaxAttempts(), sleeper);
    }

    public RetryExecutor(long baseDelayMs, long maxDelayMs, int defaultMaxAttempts, Sleeper sleeper) {
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.sleeper = sleeper;
    }

    public <T> T withRetry(Callable<T> operation) throws Exception {
        return withRetry(operation, defaultMaxAttempts);
    }

    /**
     * @throws Exception the last failure, after {@code maxAttempts} transient failures or on the first other one
     */
    public <T> T withRetry(Callable<T> operation, int maxAttempts) throws Exception {
        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (attempt >= attempts || !TransientFailureClassifier.isTransient(e)) {
                    throw e;
                }
                long delay = delayBefore(attempt + 1);
                log.warn("Attempt {}/{} failed ({}), retrying in {} ms", attempt, attempts, e.getMessage(), delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }

    /**
     * Backoff before the given attempt (2 = first retry).
     */
    long delayBefore(int attempt) {
        int k = attempt - 1;
        long delay = baseDelayMs << Math.min(k - 1, 30);
        return Math.min(delay, maxDelayMs);
    }
}
