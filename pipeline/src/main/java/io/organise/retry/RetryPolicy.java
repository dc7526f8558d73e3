package io.organise.retry;

/**
 * Decides whether a failed attempt is tried again and how long to wait first.
 * Attempts are numbered from 1.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);

    static RetryPolicy none() {
        return new RetryPolicy() {
            @Override public boolean shouldRetry(int attempt, Exception e) { return false; }
            @Override public long backoffMillis(int attempt) { return 0; }
        };
    }
}
