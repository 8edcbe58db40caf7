package com.example.ssdetect;

import java.time.Duration;
import java.util.Map;

public record RunStatisticsSnapshot(
        long total,
        long screenshots,
        long regular,
        long errors,
        long relocated,
        long relocationFailures,
        long sidecarFailures,
        Map<DetectionMethod, Long> byMethod,
        Duration cumulativeDuration
) {
    public static RunStatisticsSnapshot empty() {
        return new RunStatisticsSnapshot(0, 0, 0, 0, 0, 0, 0, Map.of(), Duration.ZERO);
    }

    public long countFor(DetectionMethod method) {
        return byMethod.getOrDefault(method, 0L);
    }

    public boolean hasFailures() {
        return errors > 0 || relocationFailures > 0;
    }
}
