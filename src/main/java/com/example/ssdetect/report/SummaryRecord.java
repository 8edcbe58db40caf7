package com.example.ssdetect.report;

import com.example.ssdetect.DetectionMethod;
import com.example.ssdetect.DetectorConfig;
import com.example.ssdetect.RunStatisticsSnapshot;
import com.example.ssdetect.RunSummary;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SummaryRecord(
        long enumerated,
        long totalFiles,
        long screenshots,
        long regularImages,
        long errors,
        Map<String, Long> byMethod,
        long relocated,
        long relocationFailures,
        long sidecarFailures,
        String action,
        String destination,
        int requestedWorkers,
        int activeWorkers,
        int lostWorkers,
        boolean cancelled,
        long elapsedMs,
        int exitCode
) {
    public static SummaryRecord of(RunSummary summary, DetectorConfig config) {
        RunStatisticsSnapshot stats = summary.statistics();
        Map<String, Long> byMethod = new LinkedHashMap<>();
        for (DetectionMethod method : DetectionMethod.values()) {
            byMethod.put(method.name().toLowerCase(Locale.ROOT), stats.countFor(method));
        }
        String action = config.relocation().active() ? config.relocation().name().toLowerCase(Locale.ROOT) : null;
        String destination = config.relocation().active()
                ? config.relocationTarget().map(Object::toString).orElse(null)
                : null;
        return new SummaryRecord(
                summary.enumerated(),
                stats.total(),
                stats.screenshots(),
                stats.regular(),
                stats.errors(),
                byMethod,
                stats.relocated(),
                stats.relocationFailures(),
                stats.sidecarFailures(),
                action,
                destination,
                summary.requestedWorkers(),
                summary.activeWorkers(),
                summary.lostWorkers(),
                summary.cancelled(),
                summary.elapsed().toMillis(),
                summary.exitCode().code()
        );
    }
}
