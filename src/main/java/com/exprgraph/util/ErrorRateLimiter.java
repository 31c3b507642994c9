package com.exprgraph.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often a repeating failure is logged. A formula that keeps
 * failing on every drag-coalesced move would otherwise flood the log.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong(0);

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs at WARN unless something was logged within the interval.
     *
     * @return true if the message was written.
     */
    public boolean warn(String message, Throwable t) {
        return log(false, message, t);
    }

    /**
     * Logs at ERROR unless something was logged within the interval.
     *
     * @return true if the message was written.
     */
    public boolean error(String message, Throwable t) {
        return log(true, message, t);
    }

    public long suppressedCount() {
        return suppressed.get();
    }

    private boolean log(boolean error, String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == 0 || now - last > minIntervalNanos) {
            // Only one thread wins the slot per interval
            if (lastLogTime.compareAndSet(last, now)) {
                long dropped = suppressed.getAndSet(0);
                String text = dropped > 0 ? message + " (" + dropped + " similar suppressed)" : message;
                if (error)
                    logger.error(text, t);
                else
                    logger.warn(text, t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }
}
