package com.nodeflow.dfg.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging.
 * Keeps a graph that fails on every run from flooding the log.
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

    /**
     * Logs the error unless another one was logged less than the minimum
     * interval ago.
     *
     * @return true if the message was logged.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // Only one thread logs per interval
            if (lastLogTime.compareAndSet(last, now)) {
                long dropped = suppressed.getAndSet(0);
                if (dropped > 0)
                    logger.error("{} ({} similar errors suppressed)", message, dropped, t);
                else
                    logger.error(message, t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }
}
