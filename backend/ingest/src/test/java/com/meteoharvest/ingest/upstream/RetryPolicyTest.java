package com.meteoharvest.ingest.upstream;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {
    @Test
    void defaultBackoffGrowsGeometricallyFromTwoHundredMillis() {
        RetryPolicy policy = RetryPolicy.DEFAULT;

        assertEquals(5, policy.maxAttempts());
        assertEquals(Duration.ofMillis(200), policy.delayAfterAttempt(1));
        assertEquals(Duration.ofMillis(400), policy.delayAfterAttempt(2));
        assertEquals(Duration.ofMillis(800), policy.delayAfterAttempt(3));
        assertEquals(Duration.ofMillis(1600), policy.delayAfterAttempt(4));
    }

    @Test
    void onlyThrottlingAndServerErrorsAreRetryable() {
        RetryPolicy policy = RetryPolicy.DEFAULT;

        assertTrue(policy.isRetryableStatus(429));
        assertTrue(policy.isRetryableStatus(500));
        assertTrue(policy.isRetryableStatus(503));
        assertFalse(policy.isRetryableStatus(400));
        assertFalse(policy.isRetryableStatus(401));
        assertFalse(policy.isRetryableStatus(404));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, Duration.ofMillis(-1), 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, Duration.ZERO, 0.5));
    }
}
