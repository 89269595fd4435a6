package com.timeseries.dsem.util;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.Logger;

/**
 * Throttles error logging from evaluation loops.
 *
 * <p>
 * An optimizer or bootstrap driver that wanders into a degenerate region can
 * fail thousands of evaluations per second. At most one error is logged per
 * interval; the rest are counted and the count is reported with the next
 * logged error.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** Logs {@code message} at error level unless another error was logged within the interval. */
    public void log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if ((last == Long.MIN_VALUE || now - last > minIntervalNanos) && lastLogTime.compareAndSet(last, now)) {
            long skipped = suppressed.getAndSet(0);
            if (skipped > 0)
                logger.error("{} ({} similar errors suppressed)", message, skipped, t);
            else
                logger.error(message, t);
        } else {
            suppressed.incrementAndGet();
        }
    }

    /** Errors dropped since the last logged one. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
