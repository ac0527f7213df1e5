package com.eyelevel.docpipeline.service.queue;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowRateLimiterTest {

    @Test
    void allowsUpToMaxWithinWindow() {
        WindowRateLimiter limiter = new WindowRateLimiter(2, 60_000);

        assertTrue(limiter.tryAcquire(0));
        assertTrue(limiter.tryAcquire(10));
        assertFalse(limiter.tryAcquire(20));
    }

    @Test
    void nextSlotOpensWhenOldestGrantLeavesWindow() {
        WindowRateLimiter limiter = new WindowRateLimiter(2, 60_000);
        limiter.tryAcquire(1_000);
        limiter.tryAcquire(5_000);

        assertEquals(61_000, limiter.nextAvailableAt(30_000));
        assertFalse(limiter.tryAcquire(60_999));
        assertTrue(limiter.tryAcquire(61_000));
        assertEquals(65_000, limiter.nextAvailableAt(61_000));
    }

    @Test
    void nextAvailableIsNowWhenCapacityLeft() {
        WindowRateLimiter limiter = new WindowRateLimiter(3, 1_000);
        limiter.tryAcquire(0);

        assertEquals(500, limiter.nextAvailableAt(500));
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new WindowRateLimiter(0, 1_000));
        assertThrows(IllegalArgumentException.class, () -> new WindowRateLimiter(1, 0));
    }
}
