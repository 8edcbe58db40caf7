package com.example.ssdetect.report;

import com.example.ssdetect.ClassificationResult;
import com.example.ssdetect.RelocationMode;
import com.example.ssdetect.RelocationOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Serialized form of one classified image as the sinks see it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultRecord(
        String file,
        String classification,
        String method,
        double metric,
        long durationMs,
        String action,
        String destination,
        List<String> sidecarFailures,
        String error,
        Instant processedAt
) {
    public static final String ACTION_NONE = "none";
    public static final String ACTION_FAILED = "failed";

    /**
     * Builds the record for a result; pass the relocation outcome when the file was relocated,
     * or the failure message when relocation was attempted and failed.
     */
    public static ResultRecord of(ClassificationResult result, RelocationOutcome relocation, String relocationError) {
        String action = ACTION_NONE;
        String destination = null;
        List<String> sidecarFailures = null;
        String error = result.error();
        if (relocation != null) {
            action = relocation.mode() == RelocationMode.MOVE ? "moved" : "copied";
            destination = relocation.plan().resolvedDestination().toString();
            if (!relocation.complete()) {
                sidecarFailures = relocation.sidecarFailures().stream()
                        .map(failure -> failure.sidecar() + ": " + failure.reason())
                        .toList();
            }
        } else if (relocationError != null) {
            action = ACTION_FAILED;
            error = relocationError;
        }
        return new ResultRecord(
                pathString(result.path()),
                result.verdict().name().toLowerCase(Locale.ROOT),
                result.method().name().toLowerCase(Locale.ROOT),
                result.metric(),
                result.elapsed() == null ? 0L : result.elapsed().toMillis(),
                action,
                destination,
                sidecarFailures,
                error,
                Instant.now()
        );
    }

    private static String pathString(Path path) {
        return path == null ? null : path.toString();
    }
}
