package com.eyelevel.docpipeline.service.queue;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window limiter allowing at most {@code max} acquisitions per {@code durationMs}.
 * Not thread-safe; callers synchronize.
 */
public class WindowRateLimiter {

    private final int max;
    private final long durationMs;
    private final Deque<Long> grants = new ArrayDeque<>();

    public WindowRateLimiter(int max, long durationMs) {
        if (max < 1 || durationMs < 1) {
            throw new IllegalArgumentException("Rate limit must allow at least one job per positive duration");
        }
        this.max = max;
        this.durationMs = durationMs;
    }

    public boolean tryAcquire(long nowMs) {
        evict(nowMs);
        if (grants.size() < max) {
            grants.addLast(nowMs);
            return true;
        }
        return false;
    }

    /**
     * @return the earliest time at which {@link #tryAcquire(long)} can succeed again.
     */
    public long nextAvailableAt(long nowMs) {
        evict(nowMs);
        if (grants.size() < max) {
            return nowMs;
        }
        return grants.peekFirst() + durationMs;
    }

    private void evict(long nowMs) {
        while (!grants.isEmpty() && grants.peekFirst() + durationMs <= nowMs) {
            grants.removeFirst();
        }
    }
}
