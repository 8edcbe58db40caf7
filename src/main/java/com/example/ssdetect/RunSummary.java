package com.example.ssdetect;

import java.time.Duration;

/**
 * Final account of a run. A cancelled run still reports what was processed before it stopped.
 */
public record RunSummary(
        long enumerated,
        int requestedWorkers,
        int activeWorkers,
        int lostWorkers,
        boolean cancelled,
        Duration elapsed,
        RunStatisticsSnapshot statistics
) {
    public ExitCode exitCode() {
        // Lost workers cancel the run themselves, so they take precedence over cancellation.
        if (lostWorkers > 0) {
            return ExitCode.FAILURE;
        }
        if (cancelled) {
            return ExitCode.CANCELLED;
        }
        return statistics.hasFailures() ? ExitCode.FAILURE : ExitCode.SUCCESS;
    }

    public boolean degraded() {
        return activeWorkers < requestedWorkers || lostWorkers > 0;
    }
}
