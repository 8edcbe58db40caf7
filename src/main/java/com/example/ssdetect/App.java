package com.example.ssdetect;

import com.example.ssdetect.detect.ModelLoadException;
import com.example.ssdetect.report.JsonLinesResultSink;
import com.example.ssdetect.report.LogResultSink;
import com.example.ssdetect.report.ReportBuffer;
import com.example.ssdetect.report.ResultSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // CLI contract: a JSON config file, optionally followed by a directory that overrides inputDirectory.
        if (args.length < 1 || args.length > 2) {
            LOGGER.error("Usage: java -jar screenshot-detector.jar <config.json> [directory]");
            System.exit(ExitCode.FAILURE.code());
        }
        DetectorConfig config;
        try {
            config = new ConfigLoader().load(Path.of(args[0]));
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration {}: {}", args[0], ex.getMessage());
            System.exit(ExitCode.FAILURE.code());
            return;
        }
        if (args.length == 2) {
            config = config.withInputDirectory(Path.of(args[1]));
        }

        CancellationToken cancellation = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        // SIGINT: stop taking new work, let in-flight images and moves finish, keep the summary.
        Thread shutdownHook = new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            interrupted.set(true);
            LOGGER.info("Classification interrupted by user");
            cancellation.cancel();
            try {
                if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    LOGGER.warn("Workers did not stop within {} seconds", SHUTDOWN_GRACE_SECONDS);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        ExitCode exitCode = run(config, cancellation);
        finished.countDown();
        if (interrupted.get()) {
            // The JVM is already exiting on the signal and reports 130 on its own.
            return;
        }
        Runtime.getRuntime().removeShutdownHook(shutdownHook);
        System.exit(exitCode.code());
    }

    static ExitCode run(DetectorConfig config, CancellationToken cancellation) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        try (ResultSink sink = sinksFor(config, mapper)) {
            DetectionEngine engine = new DetectionEngine(config, sink, cancellation);
            return engine.run().exitCode();
        } catch (ModelLoadException ex) {
            LOGGER.error("No worker could load its detectors: {}", ex.getMessage(), ex);
            return ExitCode.FAILURE;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Run interrupted");
            return ExitCode.CANCELLED;
        } catch (IOException | RuntimeException ex) {
            LOGGER.error("Unexpected error", ex);
            return ExitCode.FAILURE;
        }
    }

    static ResultSink sinksFor(DetectorConfig config, ObjectMapper mapper) {
        List<ResultSink> sinks = new ArrayList<>();
        if (config.outputFormat() == OutputFormat.JSON) {
            sinks.add(new JsonLinesResultSink(mapper, System.out));
        } else {
            sinks.add(new LogResultSink());
        }
        config.reportDirectory().ifPresent(directory ->
                sinks.add(new ReportBuffer(mapper, directory, config.reportBatchSize())));
        return ResultSink.composite(sinks);
    }
}
