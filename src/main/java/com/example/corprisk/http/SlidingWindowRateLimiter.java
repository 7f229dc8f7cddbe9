package com.example.corprisk.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * At most {@code maxRequests} permits in any trailing {@code window}. Shared by every
 * concurrent caller; prune-check-append runs under one lock so no window can ever hold
 * more than the budget.
 */
public class SlidingWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final int maxRequests;
    private final long windowNanos;
    private final LongSupplier nanoClock;

    private final Deque<Long> issued = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();

    public SlidingWindowRateLimiter(int maxRequests, Duration window) {
        this(maxRequests, window, System::nanoTime);
    }

    SlidingWindowRateLimiter(int maxRequests, Duration window, LongSupplier nanoClock) {
        if (maxRequests < 1) throw new IllegalArgumentException("maxRequests must be positive");
        if (window.isZero() || window.isNegative()) throw new IllegalArgumentException("window must be positive");
        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
        this.nanoClock = nanoClock;
    }

    /**
     * Blocks until a permit is available and records it.
     *
     * @return the nano timestamp the permit was recorded under
     */
    public long acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                long now = nanoClock.getAsLong();
                prune(now);
                if (issued.size() < maxRequests) {
                    issued.addLast(now);
                    return now;
                }
                long waitNanos = issued.peekFirst() + windowNanos - now;
                log.warn("Rate limit reached ({} requests in window), waiting {} ms",
                        maxRequests, TimeUnit.NANOSECONDS.toMillis(waitNanos));
                // re-checked on wake: another caller may have taken the freed slot
                slotFreed.awaitNanos(waitNanos);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Permits still available in the current window. */
    public int remaining() {
        lock.lock();
        try {
            prune(nanoClock.getAsLong());
            return maxRequests - issued.size();
        } finally {
            lock.unlock();
        }
    }

    private void prune(long now) {
        boolean freed = false;
        while (!issued.isEmpty() && now - issued.peekFirst() >= windowNanos) {
            issued.pollFirst();
            freed = true;
        }
        if (freed) slotFreed.signalAll();
    }
}
