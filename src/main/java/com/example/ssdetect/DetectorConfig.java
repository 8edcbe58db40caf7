package com.example.ssdetect;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, fully resolved settings for one detection run. Workers read this snapshot
 * and nothing writes to it after startup.
 */
public record DetectorConfig(
        Path inputDirectory,
        DetectionMode mode,
        int workerCount,
        int ocrMinChars,
        double ocrMinConfidence,
        double ocrResizeFactor,
        boolean extraHeuristics,
        boolean gpuEnabled,
        RelocationMode relocation,
        Optional<Path> relocationTarget,
        int queueCapacityFactor,
        long pollTimeoutMillis,
        boolean followLinks,
        List<String> excludeDirectoryPatterns,
        List<String> sidecarExtensions,
        int maxConflictAttempts,
        OutputFormat outputFormat,
        Optional<Path> reportDirectory,
        int reportBatchSize,
        Optional<Path> tessdataPath,
        String ocrLanguage
) {
    public int queueCapacity() {
        return workerCount * queueCapacityFactor;
    }

    public int resultCapacity() {
        return workerCount * 2;
    }

    /**
     * Returns a copy that scans another directory, used when the command line overrides the file.
     */
    public DetectorConfig withInputDirectory(Path directory) {
        return new DetectorConfig(
                directory,
                mode,
                workerCount,
                ocrMinChars,
                ocrMinConfidence,
                ocrResizeFactor,
                extraHeuristics,
                gpuEnabled,
                relocation,
                relocationTarget,
                queueCapacityFactor,
                pollTimeoutMillis,
                followLinks,
                excludeDirectoryPatterns,
                sidecarExtensions,
                maxConflictAttempts,
                outputFormat,
                reportDirectory,
                reportBatchSize,
                tessdataPath,
                ocrLanguage
        );
    }
}
