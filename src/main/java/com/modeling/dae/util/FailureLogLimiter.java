package com.modeling.dae.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits failure logging to one line per key and interval. Repeated
 * compilation of the same broken model otherwise floods the log.
 */
public class FailureLogLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final ConcurrentHashMap<String, AtomicLong> lastLogTime = new ConcurrentHashMap<>();

    public FailureLogLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs at error level unless {@code key} was logged within the interval.
     *
     * @return true if the line was written
     */
    public boolean log(String key, String message, Throwable t) {
        long now = System.nanoTime();
        AtomicLong last = lastLogTime.computeIfAbsent(key, k -> new AtomicLong(now - minIntervalNanos - 1));
        long prev = last.get();
        if (now - prev > minIntervalNanos && last.compareAndSet(prev, now)) {
            logger.error(message + " (Throttled)", t);
            return true;
        }
        return false;
    }
}
