package com.inventory.anomaly.engine;

import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;

/**
 * Runs a unit of work under a {@link RetryPolicy}: up to {@code maxAttempts} tries,
 * sleeping the fixed delay between a failed attempt and the next one. No delay
 * follows the final attempt.
 */
@Component
public class RetryPolicyEngine {

    private final Sleeper sleeper;

    public RetryPolicyEngine(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T> T executeWithRetry(Callable<T> work, RetryPolicy policy) {
        return executeWithRetry(work, policy, AttemptListener.NONE);
    }

    /**
     * @return the result of the first successful attempt
     * @throws RetryExhaustedException when all attempts failed, when the work raised a
     *         {@link ValidationException}, or when the thread was interrupted while waiting
     */
    public <T> T executeWithRetry(Callable<T> work, RetryPolicy policy, AttemptListener listener) {
        Exception lastError = null;

        for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
            if (attempt > 1) {
                try {
                    sleeper.sleep(policy.getDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(attempt - 1, lastError);
                }
            }

            try {
                T result = work.call();
                listener.onAttempt(TaskAttempt.succeeded(attempt));
                return result;
            } catch (ValidationException e) {
                listener.onAttempt(TaskAttempt.failed(attempt, e));
                throw new RetryExhaustedException(attempt, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                listener.onAttempt(TaskAttempt.failed(attempt, e));
                throw new RetryExhaustedException(attempt, e);
            } catch (Exception e) {
                lastError = e;
                listener.onAttempt(TaskAttempt.failed(attempt, e));
            }
        }

        throw new RetryExhaustedException(policy.getMaxAttempts(), lastError);
    }
}
