package org.tarik.autoheal.error;

/**
 * Configuration for adapter-level retries of idempotent external calls.
 *
 * @param maxRetries         Maximum number of retry attempts.
 * @param initialDelayMillis Initial delay before the first retry in
 *                           milliseconds.
 * @param maxDelayMillis     Maximum delay between retries in milliseconds.
 * @param backoffMultiplier  Multiplier for exponential backoff.
 * @param timeoutMillis      Total timeout for the operation including retries.
 */
public record RetryPolicy(
        int maxRetries,
        long initialDelayMillis,
        long maxDelayMillis,
        double backoffMultiplier,
        long timeoutMillis) {

    public static RetryPolicy noRetries() {
        return new RetryPolicy(0, 0, 0, 1.0, 0);
    }

    public long delayBeforeRetry(int attempt) {
        long delayMillis = (long) (initialDelayMillis * Math.pow(backoffMultiplier, attempt - 1));
        return Math.min(delayMillis, maxDelayMillis);
    }
}
