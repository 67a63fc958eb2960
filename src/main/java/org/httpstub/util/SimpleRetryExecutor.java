package org.httpstub.util;

import org.httpstub.interfaces.RetryExecutor;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * SimpleRetryExecutor re-runs an operation while it fails with a retryable exception,
 * with exponential backoff and optional jitter between attempts.
 * <p>
 * Failures of any other type propagate on the first occurrence. A zero base delay
 * retries immediately, which is what port binding needs.
 * </p>
 */
public final class SimpleRetryExecutor implements RetryExecutor {

    /** Maximum number of attempts (inclusive of first try). */
    private final int maxAttempts;

    /** Initial delay before retrying, in milliseconds. */
    private final long baseDelayMs;

    /** Maximum allowed delay between retries, in milliseconds. */
    private final long maxDelayMs;

    /** Maximum random jitter applied to each delay, in milliseconds. */
    private final long jitterMs;

    /** Only failures assignable to this type are retried. */
    private final Class<? extends Exception> retryOn;

    public SimpleRetryExecutor(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs) {
        this(maxAttempts, baseDelayMs, maxDelayMs, jitterMs, Exception.class);
    }

    /**
     * @param maxAttempts maximum number of attempts (minimum 1)
     * @param baseDelayMs base delay in milliseconds before first retry
     * @param maxDelayMs maximum delay cap for exponential backoff
     * @param jitterMs random jitter range in milliseconds (adds up to this amount)
     * @param retryOn failure type that triggers another attempt
     */
    public SimpleRetryExecutor(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs,
                               Class<? extends Exception> retryOn) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs  = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterMs    = Math.max(0, jitterMs);
        this.retryOn     = retryOn;
    }

    /** Retries immediately, only on {@code retryOn}. */
    public static SimpleRetryExecutor immediate(int maxAttempts, Class<? extends Exception> retryOn) {
        return new SimpleRetryExecutor(maxAttempts, 0L, 0L, 0L, retryOn);
    }

    /**
     * Executes the provided operation with retry semantics.
     * <p>
     * Delay before attempt n+1 is {@code baseDelayMs * 2^(n-1)}, capped by {@code maxDelayMs},
     * plus up to {@code jitterMs} of random jitter.
     * </p>
     */
    @Override
    public <T> T execute(Callable<T> op) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return op.call();
            } catch (Exception e) {
                if (!retryOn.isInstance(e) || attempt >= maxAttempts) {
                    throw e;
                }

                long delay = backoffDelay(baseDelayMs, maxDelayMs, attempt);
                long sleep = delay + (jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs) : 0L);

                System.out.println("[Retry] attempt " + (attempt + 1) + "/" + maxAttempts + " in " + sleep +
                        "ms (error: " + e.getMessage() + ")");

                if (sleep > 0) {
                    try {
                        Thread.sleep(sleep);
                    } catch (InterruptedException ie) {
                        // Restore interrupt flag before rethrowing
                        Thread.currentThread().interrupt();
                        throw e;
                    }
                }
            }
        }
    }

    /**
     * Exponential delay after the given failed attempt (1-based):
     * {@code baseDelayMs * 2^(attempt-1)}, capped by {@code maxDelayMs}.
     */
    public static long backoffDelay(long baseDelayMs, long maxDelayMs, int attempt) {
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = Math.max(0L, baseDelayMs) << shift;
        return Math.min(delay, Math.max(0L, maxDelayMs));
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }
}
