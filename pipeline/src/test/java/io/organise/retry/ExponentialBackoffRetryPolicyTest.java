package io.organise.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

    @Test
    void retriesIoFailuresUntilAttemptsAreUsed() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(3, 10, 1_000);
        IOException e = new IOException("timeout");
        assertTrue(policy.shouldRetry(1, e));
        assertTrue(policy.shouldRetry(2, e));
        assertFalse(policy.shouldRetry(3, e));
    }

    @Test
    void otherFailuresArePermanent() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(5, 10, 1_000);
        assertFalse(policy.shouldRetry(1, new IllegalArgumentException("bad url")));
    }

    @Test
    void backoffDoublesUpToTheCap() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(10, 50, 300);
        assertEquals(50, policy.backoffMillis(1));
        assertEquals(100, policy.backoffMillis(2));
        assertEquals(200, policy.backoffMillis(3));
        assertEquals(300, policy.backoffMillis(4));
        assertEquals(300, policy.backoffMillis(40));
    }

    @Test
    void noneNeverRetries() {
        assertFalse(RetryPolicy.none().shouldRetry(1, new IOException()));
    }
}
