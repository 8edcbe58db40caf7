package com.example.ssdetect;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Running totals for a detection run. Every update and every read takes the same monitor, held
 * only for the increment, so a snapshot is always internally consistent.
 */
public final class RunStatistics {
    private long total;
    private long screenshots;
    private long regular;
    private long errors;
    private long relocated;
    private long relocationFailures;
    private long sidecarFailures;
    private final Map<DetectionMethod, Long> byMethod = new EnumMap<>(DetectionMethod.class);
    private Duration cumulative = Duration.ZERO;

    public synchronized void record(ClassificationResult result) {
        total++;
        switch (result.verdict()) {
            case SCREENSHOT:
                screenshots++;
                break;
            case REGULAR:
                regular++;
                break;
            default:
                errors++;
                break;
        }
        byMethod.merge(result.method(), 1L, Long::sum);
        if (result.elapsed() != null) {
            cumulative = cumulative.plus(result.elapsed());
        }
    }

    public synchronized void recordRelocation(RelocationOutcome outcome) {
        relocated++;
        sidecarFailures += outcome.sidecarFailures().size();
    }

    public synchronized void recordRelocationFailure() {
        relocationFailures++;
    }

    public synchronized RunStatisticsSnapshot snapshot() {
        return new RunStatisticsSnapshot(
                total,
                screenshots,
                regular,
                errors,
                relocated,
                relocationFailures,
                sidecarFailures,
                Map.copyOf(byMethod),
                cumulative
        );
    }
}
