package com.nodeflow.dfg.util;

import com.nodeflow.dfg.api.CalculationResult;
import com.nodeflow.dfg.api.EngineListener;

/**
 * Tracks run counts and latencies of an engine.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> last, min, max and average duration of a run.</li>
 * <li><b>Throughput:</b> completed and failed runs.</li>
 * <li><b>Workload:</b> nodes reported in the last result.</li>
 * </ul>
 *
 * <p>
 * Callbacks arrive from whichever thread runs the engine; runs never
 * overlap, so plain fields suffice for writing. Readers on other threads may
 * observe slightly stale values.
 */
public final class RunStatsListener implements EngineListener {
    private long runStartNanos;
    private volatile long lastLatencyNanos;
    private volatile long totalRuns, failedRuns;
    private long totalLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private volatile int lastNodesReported;

    @Override
    public void onRunStart(long runId) {
        runStartNanos = System.nanoTime();
    }

    @Override
    public void onRunEnd(long runId, CalculationResult result) {
        long latency = System.nanoTime() - runStartNanos;
        lastLatencyNanos = latency;
        lastNodesReported = result.size();
        totalRuns++;
        totalLatencyNanos += latency;
        if (latency < minLatencyNanos)
            minLatencyNanos = latency;
        if (latency > maxLatencyNanos)
            maxLatencyNanos = latency;
    }

    @Override
    public void onRunError(long runId, Throwable error) {
        // Counted only; the engine reports the failure itself.
        failedRuns++;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public int lastNodesReported() {
        return lastNodesReported;
    }

    public long totalRuns() {
        return totalRuns;
    }

    public long failedRuns() {
        return failedRuns;
    }

    public double avgLatencyNanos() {
        return totalRuns > 0 ? (double) totalLatencyNanos / totalRuns : 0;
    }

    public long minLatencyNanos() {
        return totalRuns > 0 ? minLatencyNanos : 0;
    }

    public long maxLatencyNanos() {
        return totalRuns > 0 ? maxLatencyNanos : 0;
    }

    public void reset() {
        totalRuns = failedRuns = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
        lastLatencyNanos = 0;
        lastNodesReported = 0;
    }

    /** One-line summary, e.g. for periodic logging. */
    public String summary() {
        return String.format("runs=%d failed=%d avg=%.1fus min=%.1fus max=%.1fus lastNodes=%d",
                totalRuns, failedRuns, avgLatencyNanos() / 1000.0, minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0, lastNodesReported);
    }
}
