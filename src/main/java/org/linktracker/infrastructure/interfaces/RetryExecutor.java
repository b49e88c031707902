package org.linktracker.infrastructure.interfaces;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

public interface RetryExecutor {
    /**
     * Executes the given operation, retrying every failure.
     * @param op  A Callable whose call() may throw Exception. Returns a result or null.
     * @param <T> Result type (use Void for no result)
     * @return the result from the operation
     * @throws Exception the last failure once all attempts are used
     */
    default <T> T execute(Callable<T> op) throws Exception {
        return execute(op, e -> true);
    }

    /**
     * Executes the given operation, retrying only failures accepted by {@code retryable}.
     * Any other failure is rethrown immediately.
     */
    <T> T execute(Callable<T> op, Predicate<Exception> retryable) throws Exception;

    /** Maximum number of attempts, first try included. */
    int maxAttempts();
}
