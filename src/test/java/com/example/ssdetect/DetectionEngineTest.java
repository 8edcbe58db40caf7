package com.example.ssdetect;

import com.example.ssdetect.detect.DetectionException;
import com.example.ssdetect.detect.Detector;
import com.example.ssdetect.detect.DetectorOutcome;
import com.example.ssdetect.detect.DetectorProvider;
import com.example.ssdetect.detect.HorizontalEdgeDetector;
import com.example.ssdetect.detect.ModelLoadException;
import com.example.ssdetect.report.ResultRecord;
import com.example.ssdetect.report.ResultSink;
import com.example.ssdetect.report.SummaryRecord;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DetectionEngineTest {
    private static final DetectorProvider HORIZONTAL_ONLY = new DetectorProvider() {
        @Override
        public Detector horizontal(DetectorConfig config) {
            return new HorizontalEdgeDetector();
        }

        @Override
        public Detector ocr(DetectorConfig config) throws ModelLoadException {
            throw new ModelLoadException("OCR is not available in tests");
        }
    };

    @Test
    void classifiesEveryImageExactlyOnce() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        TestImages.screenshot(root.resolve("a.png"));
        TestImages.screenshot(Files.createDirectory(root.resolve("sub")).resolve("b.png"));
        TestImages.photo(root.resolve("c.png"));
        Files.writeString(root.resolve("readme.txt"), "ignored");

        CapturingSink sink = new CapturingSink();
        DetectionEngine engine = new DetectionEngine(
                TestConfigs.config(root, DetectionMode.HORIZONTAL, 2), HORIZONTAL_ONLY, sink, new CancellationToken());
        RunSummary summary = engine.run();

        assertEquals(3, summary.enumerated());
        assertEquals(3, summary.statistics().total());
        assertEquals(2, summary.statistics().screenshots());
        assertEquals(1, summary.statistics().regular());
        assertEquals(ExitCode.SUCCESS, summary.exitCode());
        assertEquals(3, sink.records.size());
        assertEquals(3, sink.records.stream().map(ResultRecord::file).distinct().count());
        assertNotNull(sink.summary);
        assertEquals(3, sink.summary.totalFiles());
        assertEquals(2, summary.activeWorkers());
        engine.workers().forEach(worker -> assertEquals(WorkerState.TERMINATED, worker.state()));
    }

    @Test
    void decodeFailureIsReportedAndFailsTheRun() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        TestImages.photo(root.resolve("good.png"));
        Files.writeString(root.resolve("broken.jpg"), "not really a jpeg");

        CapturingSink sink = new CapturingSink();
        RunSummary summary = new DetectionEngine(
                TestConfigs.config(root, DetectionMode.HORIZONTAL, 1), HORIZONTAL_ONLY, sink, new CancellationToken()).run();

        assertEquals(2, summary.statistics().total());
        assertEquals(1, summary.statistics().errors());
        assertEquals(ExitCode.FAILURE, summary.exitCode());
        ResultRecord broken = sink.records.stream()
                .filter(record -> record.file().endsWith("broken.jpg"))
                .findFirst()
                .orElseThrow();
        assertEquals("error", broken.classification());
        assertNotNull(broken.error());
    }

    @Test
    void continuesWithSurvivingWorkers() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        for (int i = 0; i < 4; i++) {
            TestImages.photo(root.resolve("img" + i + ".png"));
        }
        AtomicInteger loads = new AtomicInteger();
        DetectorProvider flaky = new DetectorProvider() {
            @Override
            public Detector horizontal(DetectorConfig config) throws ModelLoadException {
                if (loads.incrementAndGet() == 1) {
                    throw new ModelLoadException("simulated load failure");
                }
                return new HorizontalEdgeDetector();
            }

            @Override
            public Detector ocr(DetectorConfig config) throws ModelLoadException {
                throw new ModelLoadException("unused");
            }
        };

        DetectionEngine engine = new DetectionEngine(
                TestConfigs.config(root, DetectionMode.HORIZONTAL, 3), flaky, new CapturingSink(), new CancellationToken());
        RunSummary summary = engine.run();

        assertEquals(2, summary.activeWorkers());
        assertTrue(summary.degraded());
        assertEquals(4, summary.statistics().total());
        assertEquals(1, engine.workers().stream().filter(worker -> worker.failure().isPresent()).count());
    }

    @Test
    void failsWhenNoWorkerStarts() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        TestImages.photo(root.resolve("img.png"));

        DetectionEngine engine = new DetectionEngine(
                TestConfigs.config(root, DetectionMode.OCR, 2), HORIZONTAL_ONLY, new CapturingSink(), new CancellationToken());

        ModelLoadException ex = assertThrows(ModelLoadException.class, engine::run);
        assertEquals(2, ex.getSuppressed().length);
    }

    @Test
    void cancellationStopsEarlyAndKeepsCounts() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        for (int i = 0; i < 30; i++) {
            TestImages.photo(root.resolve("img" + i + ".png"));
        }
        CancellationToken cancellation = new CancellationToken();
        CapturingSink sink = new CapturingSink() {
            @Override
            public void accept(ResultRecord record) {
                super.accept(record);
                cancellation.cancel();
            }
        };

        RunSummary summary = new DetectionEngine(
                TestConfigs.config(root, DetectionMode.HORIZONTAL, 1), HORIZONTAL_ONLY, sink, cancellation).run();

        assertTrue(summary.cancelled());
        assertEquals(ExitCode.CANCELLED, summary.exitCode());
        assertTrue(summary.statistics().total() >= 1);
        assertTrue(summary.statistics().total() <= summary.enumerated());
        assertTrue(summary.statistics().total() < 30);
        assertEquals(summary.statistics().total(), sink.records.size());
        assertNotNull(sink.summary);
    }

    @Test
    void movesScreenshotsAndRerunFindsNone() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Path target = root.resolve("screenshots");
        TestImages.screenshot(root.resolve("shot.png"));
        Files.writeString(root.resolve("shot.xmp"), "meta");
        TestImages.photo(root.resolve("photo.png"));
        DetectorConfig config = TestConfigs.config(root, DetectionMode.HORIZONTAL, 2, RelocationMode.MOVE, target);

        CapturingSink sink = new CapturingSink();
        RunSummary first = new DetectionEngine(config, HORIZONTAL_ONLY, sink, new CancellationToken()).run();

        assertEquals(1, first.statistics().relocated());
        assertFalse(Files.exists(root.resolve("shot.png")));
        assertTrue(Files.exists(target.resolve("shot.png")));
        assertTrue(Files.exists(target.resolve("shot.xmp")));
        assertTrue(Files.exists(root.resolve("photo.png")));
        ResultRecord moved = sink.records.stream()
                .filter(record -> "screenshot".equals(record.classification()))
                .findFirst()
                .orElseThrow();
        assertEquals("moved", moved.action());
        assertEquals("move", sink.summary.action());

        RunSummary second = new DetectionEngine(config, HORIZONTAL_ONLY, new CapturingSink(), new CancellationToken()).run();

        assertEquals(1, second.statistics().total());
        assertEquals(0, second.statistics().screenshots());
        assertEquals(0, second.statistics().relocated());
    }

    @Test
    void copyLeavesOriginalsInPlace() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Path target = Files.createTempDirectory("engine-target");
        TestImages.screenshot(root.resolve("shot.png"));
        DetectorConfig config = TestConfigs.config(root, DetectionMode.HORIZONTAL, 1, RelocationMode.COPY, target);

        RunSummary summary = new DetectionEngine(config, HORIZONTAL_ONLY, new CapturingSink(), new CancellationToken()).run();

        assertEquals(1, summary.statistics().relocated());
        assertTrue(Files.exists(root.resolve("shot.png")));
        assertTrue(Files.exists(target.resolve("shot.png")));
    }

    @Test
    void emptyDirectoryCompletes() throws Exception {
        Path root = Files.createTempDirectory("engine-root");

        RunSummary summary = new DetectionEngine(
                TestConfigs.config(root, DetectionMode.HORIZONTAL, 2), HORIZONTAL_ONLY, new CapturingSink(), new CancellationToken()).run();

        assertEquals(0, summary.enumerated());
        assertEquals(0, summary.statistics().total());
        assertEquals(ExitCode.SUCCESS, summary.exitCode());
    }

    @Test
    void missingInputDirectoryFails() throws Exception {
        Path root = Files.createTempDirectory("engine-root").resolve("missing");
        DetectionEngine engine = new DetectionEngine(
                TestConfigs.config(root, DetectionMode.HORIZONTAL, 1), HORIZONTAL_ONLY, new CapturingSink(), new CancellationToken());

        assertThrows(IOException.class, engine::run);
    }

    @Test
    void errorThrownByDetectorStillYieldsResult() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        for (int i = 0; i < 3; i++) {
            TestImages.photo(root.resolve("img" + i + ".png"));
        }
        DetectorProvider overflowing = horizontal(new StubDetector() {
            @Override
            public DetectorOutcome detect(BufferedImage image) {
                throw new StackOverflowError("deep recursion in native bridge");
            }
        });

        CapturingSink sink = new CapturingSink();
        DetectionEngine engine = new DetectionEngine(
                TestConfigs.config(root, DetectionMode.HORIZONTAL, 2), overflowing, sink, new CancellationToken());
        RunSummary summary = engine.run();

        assertEquals(3, summary.statistics().total());
        assertEquals(3, summary.statistics().errors());
        assertEquals(3, sink.records.size());
        assertEquals(0, summary.lostWorkers());
        assertEquals(ExitCode.FAILURE, summary.exitCode());
        sink.records.forEach(record -> assertTrue(record.error().contains("StackOverflowError")));
    }

    @Test
    void workerDyingOnErrorFailsTheRun() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        TestImages.photo(root.resolve("img.png"));
        DetectorProvider brokenClose = horizontal(new StubDetector() {
            @Override
            public void close() {
                throw new StackOverflowError("native release failed");
            }
        });

        CapturingSink sink = new CapturingSink();
        RunSummary summary = new DetectionEngine(
                TestConfigs.config(root, DetectionMode.HORIZONTAL, 2), brokenClose, sink, new CancellationToken()).run();

        assertEquals(2, summary.lostWorkers());
        assertTrue(summary.degraded());
        assertEquals(ExitCode.FAILURE, summary.exitCode());
        assertEquals(1, sink.records.size());
        assertEquals(2, sink.summary.lostWorkers());
    }

    @Test
    void cancelDuringSlowImageKeepsItsResult() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        for (int i = 0; i < 6; i++) {
            TestImages.photo(root.resolve("img" + i + ".png"));
        }
        CancellationToken cancellation = new CancellationToken();
        DetectorProvider slow = horizontal(new CancellingDetector(cancellation, false));

        CapturingSink sink = new CapturingSink();
        DetectionEngine engine = new DetectionEngine(
                TestConfigs.config(root, DetectionMode.HORIZONTAL, 2), slow, sink, cancellation);
        RunSummary summary = engine.run();

        long processed = engine.workers().stream().mapToLong(WorkerHandle::processed).sum();
        assertTrue(summary.cancelled());
        assertTrue(processed >= 1);
        assertEquals(processed, summary.statistics().total());
        assertEquals(processed, sink.records.size());
        assertEquals(processed, sink.summary.totalFiles());
    }

    @Test
    void screenshotFinishedAfterCancelIsNotMoved() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Path target = root.resolve("screenshots");
        TestImages.photo(root.resolve("shot.png"));
        CancellationToken cancellation = new CancellationToken();
        DetectorProvider cancelling = horizontal(new CancellingDetector(cancellation, true));
        DetectorConfig config = TestConfigs.config(root, DetectionMode.HORIZONTAL, 1, RelocationMode.MOVE, target);

        CapturingSink sink = new CapturingSink();
        RunSummary summary = new DetectionEngine(config, cancelling, sink, cancellation).run();

        assertTrue(summary.cancelled());
        assertEquals(1, summary.statistics().screenshots());
        assertEquals(0, summary.statistics().relocated());
        assertTrue(Files.exists(root.resolve("shot.png")));
        assertFalse(Files.exists(target.resolve("shot.png")));
        ResultRecord record = sink.records.get(0);
        assertEquals("screenshot", record.classification());
        assertEquals(ResultRecord.ACTION_NONE, record.action());
        assertNull(record.destination());
    }

    static class CapturingSink implements ResultSink {
        final List<ResultRecord> records = new CopyOnWriteArrayList<>();
        volatile SummaryRecord summary;

        @Override
        public void accept(ResultRecord record) {
            records.add(record);
        }

        @Override
        public void complete(SummaryRecord summary) {
            this.summary = summary;
        }
    }

    private static DetectorProvider horizontal(Detector detector) {
        return new DetectorProvider() {
            @Override
            public Detector horizontal(DetectorConfig config) {
                return detector;
            }

            @Override
            public Detector ocr(DetectorConfig config) throws ModelLoadException {
                throw new ModelLoadException("unused");
            }
        };
    }

    private static class StubDetector implements Detector {
        @Override
        public DetectionMethod method() {
            return DetectionMethod.HORIZONTAL;
        }

        @Override
        public DetectorOutcome detect(BufferedImage image) throws DetectionException {
            return new DetectorOutcome(false, 0);
        }
    }

    /**
     * Cancels the run as soon as it starts on an image, then keeps working on it for a while.
     */
    private static final class CancellingDetector extends StubDetector {
        private final CancellationToken cancellation;
        private final boolean screenshot;

        CancellingDetector(CancellationToken cancellation, boolean screenshot) {
            this.cancellation = cancellation;
            this.screenshot = screenshot;
        }

        @Override
        public DetectorOutcome detect(BufferedImage image) throws DetectionException {
            cancellation.cancel();
            try {
                Thread.sleep(300);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new DetectionException("interrupted", ex);
            }
            return new DetectorOutcome(screenshot, 1);
        }
    }
}
