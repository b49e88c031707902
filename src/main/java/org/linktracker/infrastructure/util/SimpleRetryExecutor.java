package org.linktracker.infrastructure.util;

import org.linktracker.infrastructure.interfaces.RetryExecutor;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * SimpleRetryExecutor retries a failing operation a bounded number of times,
 * sleeping between attempts.
 * <p>
 * The delay doubles from {@code baseDelayMs} up to {@code maxDelayMs}, plus up
 * to {@code jitterMs} of random jitter. Passing the same value for base and max
 * with zero jitter gives a fixed backoff, which is how the coordinator uses it
 * (3 attempts, 100 ms apart).
 * <p>
 * <b>SonarQube notes:</b>
 * <ul>
 *   <li>Attempt count and delays are bounded; the caller's thread sleeps between attempts.</li>
 *   <li>Constructor arguments are clamped so no delay is negative and at least one attempt runs.</li>
 *   <li>Immutable after construction and safe to share between writer threads.</li>
 * </ul>
 */
public final class SimpleRetryExecutor implements RetryExecutor {

    /** Maximum number of attempts (inclusive of first try). */
    private final int maxAttempts;      // e.g., 3

    /** Initial delay before retrying, in milliseconds. */
    private final long baseDelayMs;     // e.g., 100

    /** Maximum allowed delay between retries, in milliseconds. */
    private final long maxDelayMs;      // e.g., 100 for a fixed backoff

    /** Maximum random jitter applied to each delay, in milliseconds. */
    private final long jitterMs;        // e.g., 0

    /** Prefix for the retry log line, e.g. "file save". */
    private final String label;

    /**
     * Constructs a retry executor whose log lines use the generic label {@code "op"}.
     *
     * @param maxAttempts maximum number of attempts (minimum 1)
     * @param baseDelayMs base delay in milliseconds before first retry
     * @param maxDelayMs  maximum delay cap for exponential backoff
     * @param jitterMs    random jitter range in milliseconds (adds up to this amount)
     */
    public SimpleRetryExecutor(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs) {
        this(maxAttempts, baseDelayMs, maxDelayMs, jitterMs, "op");
    }

    /**
     * Constructs a retry executor with configurable attempt and delay settings.
     *
     * @param maxAttempts maximum number of attempts (minimum 1)
     * @param baseDelayMs base delay in milliseconds before first retry
     * @param maxDelayMs  maximum delay cap for exponential backoff
     * @param jitterMs    random jitter range in milliseconds (adds up to this amount)
     * @param label       operation name used in log lines
     */
    public SimpleRetryExecutor(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs, String label) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs  = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterMs    = Math.max(0, jitterMs);
        this.label       = label;
    }

    /**
     * Fixed backoff: every retry waits exactly {@code delayMs}, without jitter.
     *
     * @param maxAttempts maximum number of attempts (minimum 1)
     * @param delayMs     pause between two attempts, in milliseconds
     * @param label       operation name used in log lines
     * @return an executor with equal base and max delay
     */
    public static SimpleRetryExecutor fixed(int maxAttempts, long delayMs, String label) {
        return new SimpleRetryExecutor(maxAttempts, delayMs, delayMs, 0, label);
    }

    /**
     * Returns the attempt budget after clamping.
     *
     * @return maximum number of attempts, first try included
     */
    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Executes {@code op} with retry semantics.
     * <p>
     * A failure that {@code retryable} rejects is rethrown at once; the failure of
     * the last attempt is rethrown unchanged. Between attempts the delay follows
     * {@code baseDelayMs * 2^(attempt-1)}, capped by {@code maxDelayMs}, plus jitter.
     * </p>
     *
     * @param op        the operation to execute; throws on failure
     * @param retryable decides whether a failure is worth another attempt
     * @param <T>       return type of the callable
     * @return result of {@code op.call()} once it succeeds
     * @throws Exception the non-retryable failure, or the last one when the budget is spent
     */
    @Override
    public <T> T execute(Callable<T> op, Predicate<Exception> retryable) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return op.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }

                // baseDelay * 2^(attempt-1), capped by maxDelayMs
                long delay = baseDelayMs << Math.max(0, attempt - 1);
                if (delay > maxDelayMs || delay < 0) delay = maxDelayMs;

                long sleep = delay + (jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs) : 0L);

                System.out.println("[Retry] " + label + " attempt " + (attempt + 1) + "/" + maxAttempts
                        + " in " + sleep + "ms (error: " + e.getMessage() + ")");

                try {
                    Thread.sleep(sleep);
                } catch (InterruptedException ie) {
                    // restore the flag, then surface the real failure
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
