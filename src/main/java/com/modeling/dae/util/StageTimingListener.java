package com.modeling.dae.util;

import com.modeling.dae.CompilationResult;
import com.modeling.dae.api.CompilationListener;
import com.modeling.dae.api.Stage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tracks min, max and average wall time per pipeline stage, plus compiled and
 * failed model counts.
 *
 * <p>
 * Safe to share between worker threads; updates are synchronized per
 * listener.
 */
public final class StageTimingListener implements CompilationListener {
    private static final Logger log = LogManager.getLogger(StageTimingListener.class);

    private final FailureLogLimiter failureLimiter = new FailureLogLimiter(log, 1000);
    private final Map<Stage, Stats> stats = new EnumMap<>(Stage.class);
    private long compiled, failed;

    private static final class Stats {
        long count, totalNanos;
        long minNanos = Long.MAX_VALUE, maxNanos = Long.MIN_VALUE;
    }

    @Override
    public synchronized void onStageComplete(String model, Stage stage, long durationNanos) {
        Stats s = stats.computeIfAbsent(stage, k -> new Stats());
        s.count++;
        s.totalNanos += durationNanos;
        if (durationNanos < s.minNanos)
            s.minNanos = durationNanos;
        if (durationNanos > s.maxNanos)
            s.maxNanos = durationNanos;
    }

    @Override
    public synchronized void onCompiled(String model, CompilationResult result) {
        compiled++;
    }

    @Override
    public void onFailed(String model, Stage stage, Throwable error) {
        synchronized (this) {
            failed++;
        }
        failureLimiter.log(model, String.format("Compilation of '%s' failed in %s: %s", model, stage,
                error.getMessage()), null);
    }

    public synchronized long count(Stage stage) {
        Stats s = stats.get(stage);
        return s == null ? 0 : s.count;
    }

    public synchronized double avgNanos(Stage stage) {
        Stats s = stats.get(stage);
        return s == null || s.count == 0 ? 0 : (double) s.totalNanos / s.count;
    }

    public synchronized long minNanos(Stage stage) {
        Stats s = stats.get(stage);
        return s == null ? 0 : s.minNanos;
    }

    public synchronized long maxNanos(Stage stage) {
        Stats s = stats.get(stage);
        return s == null ? 0 : s.maxNanos;
    }

    public synchronized long compiledCount() {
        return compiled;
    }

    public synchronized long failedCount() {
        return failed;
    }

    public synchronized void reset() {
        stats.clear();
        compiled = 0;
        failed = 0;
    }

    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-10s | %8s | %10s | %10s | %10s%n", "Stage", "Count", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------\n");
        for (Stage stage : Stage.values()) {
            Stats s = stats.get(stage);
            if (s == null)
                continue;
            sb.append(String.format("%-10s | %8d | %10.2f | %10.2f | %10.2f%n", stage, s.count,
                    (double) s.totalNanos / s.count / 1000.0, s.minNanos / 1000.0, s.maxNanos / 1000.0));
        }
        sb.append(String.format("compiled=%d failed=%d%n", compiled, failed));
        return sb.toString();
    }
}
