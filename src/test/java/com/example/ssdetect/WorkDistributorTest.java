package com.example.ssdetect;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkDistributorTest {
    @Test
    void enqueuesSupportedImagesRecursively() throws Exception {
        Path root = Files.createTempDirectory("distributor-root");
        Path nested = Files.createDirectories(root.resolve("a/b"));
        Files.writeString(root.resolve("one.PNG"), "x");
        Files.writeString(nested.resolve("two.jpeg"), "x");
        Files.writeString(root.resolve("notes.txt"), "x");
        Files.writeString(root.resolve("one.xmp"), "x");

        List<Path> files = distributeAll(TestConfigs.config(root, DetectionMode.BOTH, 1));

        assertEquals(2, files.size());
        assertTrue(files.contains(root.resolve("one.PNG").toAbsolutePath().normalize()));
        assertTrue(files.contains(nested.resolve("two.jpeg").toAbsolutePath().normalize()));
    }

    @Test
    void skipsExcludedDirectoriesAndRelocationTarget() throws Exception {
        Path root = Files.createTempDirectory("distributor-root");
        Path target = Files.createDirectories(root.resolve("screenshots"));
        Path git = Files.createDirectories(root.resolve(".git"));
        Files.writeString(root.resolve("keep.png"), "x");
        Files.writeString(target.resolve("moved.png"), "x");
        Files.writeString(git.resolve("object.png"), "x");

        DetectorConfig config = TestConfigs.config(root, DetectionMode.HORIZONTAL, 1, RelocationMode.MOVE, target);
        List<Path> files = distributeAll(config);

        assertEquals(List.of(root.resolve("keep.png").toAbsolutePath().normalize()), files);
    }

    @Test
    void failsOnMissingRoot() throws Exception {
        Path root = Files.createTempDirectory("distributor-root").resolve("missing");
        WorkDistributor distributor = new WorkDistributor(
                TestConfigs.config(root, DetectionMode.BOTH, 1), new ArrayBlockingQueue<>(4), new CancellationToken());

        assertThrows(IOException.class, () -> distributor.distribute(1));
    }

    @Test
    void blocksOnFullQueueAndPostsOneEndMarkerPerWorker() throws Exception {
        Path root = Files.createTempDirectory("distributor-root");
        for (int i = 0; i < 5; i++) {
            Files.writeString(root.resolve("img" + i + ".png"), "x");
        }
        BlockingQueue<ImageTask> queue = new ArrayBlockingQueue<>(2);
        WorkDistributor distributor = new WorkDistributor(
                TestConfigs.config(root, DetectionMode.OCR, 2), queue, new CancellationToken());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Long> distribution = executor.submit(() -> distributor.distribute(2));
            List<ImageTask> received = new ArrayList<>();
            while (received.size() < 7) {
                ImageTask task = queue.poll(5, TimeUnit.SECONDS);
                assertTrue(task != null, "distributor stalled");
                assertTrue(queue.size() <= 2);
                received.add(task);
            }

            assertEquals(5L, distribution.get(5, TimeUnit.SECONDS));
            for (int i = 0; i < 5; i++) {
                assertEquals(DetectionMode.OCR, received.get(i).mode());
            }
            assertSame(WorkDistributor.END_OF_WORK, received.get(5));
            assertSame(WorkDistributor.END_OF_WORK, received.get(6));
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Runs a full distribution into a queue large enough to never block and returns the
     * enqueued paths in order, checking the trailing end marker.
     */
    private static List<Path> distributeAll(DetectorConfig config) throws Exception {
        BlockingQueue<ImageTask> queue = new ArrayBlockingQueue<>(64);
        long enqueued = new WorkDistributor(config, queue, new CancellationToken()).distribute(1);
        List<ImageTask> tasks = new ArrayList<>(queue);
        assertEquals(enqueued + 1, tasks.size());
        assertSame(WorkDistributor.END_OF_WORK, tasks.get(tasks.size() - 1));
        List<Path> files = new ArrayList<>();
        for (ImageTask task : tasks.subList(0, tasks.size() - 1)) {
            files.add(task.path());
        }
        return files;
    }

    @Test
    void stopsEnqueueingWhenCancelled() throws Exception {
        Path root = Files.createTempDirectory("distributor-root");
        for (int i = 0; i < 5; i++) {
            Files.writeString(root.resolve("img" + i + ".png"), "x");
        }
        BlockingQueue<ImageTask> queue = new ArrayBlockingQueue<>(1);
        CancellationToken cancellation = new CancellationToken();
        WorkDistributor distributor = new WorkDistributor(
                TestConfigs.config(root, DetectionMode.BOTH, 1), queue, cancellation);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Long> distribution = executor.submit(() -> distributor.distribute(1));
            Thread.sleep(100);
            cancellation.cancel();

            assertEquals(1L, distribution.get(5, TimeUnit.SECONDS));
            assertEquals(1, queue.size());
        } finally {
            executor.shutdownNow();
        }
    }
}
