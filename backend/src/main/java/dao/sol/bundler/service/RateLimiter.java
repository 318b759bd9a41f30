package dao.sol.bundler.service;

import dao.sol.bundler.util.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Caps bundle submissions at a fixed number per 1-second window, shared by every dispatch path.
 *
 * The first call after a window has elapsed resets the counter. When the window's budget is spent the caller
 * sleeps out the remainder of the window while holding the lock, so waiters are served in arrival order.
 */
@Slf4j
public class RateLimiter {

    private static final long WINDOW_MS = 1000;

    private final int maxPerWindow;
    private final LongSupplier clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock(true);

    private int count;
    private long windowStart;

    public RateLimiter(int maxPerWindow, LongSupplier clock, Sleeper sleeper) {
        if (maxPerWindow <= 0) {
            throw new IllegalArgumentException("maxPerWindow must be positive: " + maxPerWindow);
        }
        this.maxPerWindow = maxPerWindow;
        this.clock = clock;
        this.sleeper = sleeper;
        this.windowStart = clock.getAsLong();
    }

    /**
     * Block until a slot is available in the current window, then consume it.
     *
     * @throws IllegalStateException if interrupted while waiting
     */
    public void acquire() {
        lock.lock();
        try {
            long now = clock.getAsLong();
            if (now - windowStart >= WINDOW_MS) {
                count = 0;
                windowStart = now;
            }
            if (count >= maxPerWindow) {
                long wait = WINDOW_MS - (now - windowStart);
                log.debug("Rate limit reached ({} per second), waiting {} ms", maxPerWindow, wait);
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for rate limit slot", ie);
                }
                count = 0;
                windowStart = clock.getAsLong();
            }
            count++;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxPerWindow() {
        return maxPerWindow;
    }
}
