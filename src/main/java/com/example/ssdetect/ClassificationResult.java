package com.example.ssdetect;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of classifying one image. {@code metric} is the horizontal line count or the OCR
 * character count, depending on {@code method}; {@code error} is set only for {@link Verdict#ERROR}.
 */
public record ClassificationResult(
        Path path,
        Verdict verdict,
        DetectionMethod method,
        double metric,
        Duration elapsed,
        String error
) {
    public static ClassificationResult classified(Path path, boolean screenshot, DetectionMethod method,
                                                  double metric, Duration elapsed) {
        return new ClassificationResult(path, screenshot ? Verdict.SCREENSHOT : Verdict.REGULAR,
                method, metric, elapsed, null);
    }

    public static ClassificationResult failed(Path path, DetectionMethod method, Duration elapsed, String error) {
        return new ClassificationResult(path, Verdict.ERROR, method, 0.0, elapsed, error);
    }

    public boolean isScreenshot() {
        return verdict == Verdict.SCREENSHOT;
    }

    public boolean isError() {
        return verdict == Verdict.ERROR;
    }
}
