package com.example.ssdetect;

import com.example.ssdetect.report.ResultRecord;
import com.example.ssdetect.report.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;

/**
 * Drains worker results on its own thread: updates statistics, relocates screenshots when asked
 * to, and forwards one record per result to the sink in the order received.
 *
 * <p>It stops only on {@link #END_OF_RESULTS}, which the engine posts after every worker has
 * terminated, so results of images still in flight at cancellation are counted too.
 */
final class ResultCollector implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultCollector.class);

    static final ClassificationResult END_OF_RESULTS = new ClassificationResult(
            null, Verdict.ERROR, DetectionMethod.NONE, 0.0, Duration.ZERO, "end-of-results");

    private final DetectorConfig config;
    private final BlockingQueue<ClassificationResult> results;
    private final RunStatistics statistics;
    private final FileRelocator relocator;
    private final ResultSink sink;
    private final CancellationToken cancellation;
    private volatile RuntimeException failure;
    private boolean sinkFailed;

    ResultCollector(DetectorConfig config,
                    BlockingQueue<ClassificationResult> results,
                    RunStatistics statistics,
                    FileRelocator relocator,
                    ResultSink sink,
                    CancellationToken cancellation) {
        this.config = config;
        this.results = results;
        this.statistics = statistics;
        this.relocator = relocator;
        this.sink = sink;
        this.cancellation = cancellation;
    }

    @Override
    public void run() {
        try {
            while (true) {
                ClassificationResult result = results.take();
                if (result == END_OF_RESULTS) {
                    return;
                }
                try {
                    handle(result);
                } catch (RuntimeException ex) {
                    // Keep draining so workers never block on a full channel.
                    if (failure == null) {
                        failure = ex;
                    }
                    cancellation.cancel();
                    LOGGER.error("Failed to handle result for {}", result.path(), ex);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Result collector interrupted; stopping.");
        }
    }

    RuntimeException failure() {
        return failure;
    }

    private void handle(ClassificationResult result) {
        statistics.record(result);
        RelocationOutcome relocation = null;
        String relocationError = null;
        if (result.isScreenshot() && config.relocation().active()) {
            if (cancellation.isCancelled()) {
                LOGGER.info("Run cancelled; not relocating {}", result.path());
            } else {
                try {
                    relocation = relocate(result.path());
                    statistics.recordRelocation(relocation);
                } catch (FilesystemException ex) {
                    statistics.recordRelocationFailure();
                    relocationError = "Failed to " + config.relocation().name().toLowerCase(Locale.ROOT)
                            + ": " + ex.getMessage();
                    LOGGER.warn("Relocation failed for {}", result.path(), ex);
                }
            }
        }
        emit(ResultRecord.of(result, relocation, relocationError));
    }

    private RelocationOutcome relocate(Path path) throws FilesystemException {
        Path target = config.relocationTarget()
                .orElseThrow(() -> new IllegalStateException("Relocation target missing for " + config.relocation()));
        return relocator.relocate(path, target, config.relocation());
    }

    private void emit(ResultRecord record) {
        try {
            sink.accept(record);
        } catch (IOException ex) {
            if (!sinkFailed) {
                LOGGER.error("Failed to write result output for {}", record.file(), ex);
                sinkFailed = true;
            } else {
                LOGGER.debug("Failed to write result output for {}", record.file(), ex);
            }
        }
    }
}
