package com.example.ssdetect.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented output through SLF4J, one key=value line per image.
 */
public final class LogResultSink implements ResultSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogResultSink.class);

    @Override
    public void accept(ResultRecord record) {
        if (record.error() != null) {
            LOGGER.warn("Failed to process image file={} classification={} action={} error={}",
                    record.file(), record.classification(), record.action(), record.error());
            return;
        }
        if (record.destination() != null) {
            LOGGER.info("Processed image file={} classification={} method={} action={} destination={} durationMs={}",
                    record.file(), record.classification(), record.method(), record.action(),
                    record.destination(), record.durationMs());
        } else {
            LOGGER.info("Processed image file={} classification={} method={} action={} durationMs={}",
                    record.file(), record.classification(), record.method(), record.action(), record.durationMs());
        }
        if (record.sidecarFailures() != null) {
            LOGGER.warn("Sidecars left behind for {}: {}", record.file(), record.sidecarFailures());
        }
    }

    @Override
    public void complete(SummaryRecord summary) {
        LOGGER.info("Classification complete total_files={} screenshots={} other_images={} errors={} "
                        + "horizontal={} ocr={} relocated={} relocation_failures={} workers={}/{} lost_workers={} cancelled={} elapsedMs={}",
                summary.totalFiles(), summary.screenshots(), summary.regularImages(), summary.errors(),
                summary.byMethod().get("horizontal"), summary.byMethod().get("ocr"),
                summary.relocated(), summary.relocationFailures(),
                summary.activeWorkers(), summary.requestedWorkers(), summary.lostWorkers(), summary.cancelled(), summary.elapsedMs());
    }
}
