package com.example.ssdetect;

import com.example.ssdetect.detect.Classification;
import com.example.ssdetect.detect.DetectorAdapter;
import com.example.ssdetect.detect.DetectorProvider;
import com.example.ssdetect.detect.ImageProcessingException;
import com.example.ssdetect.detect.ModelLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Long-lived worker: loads its detectors once, then classifies tasks from the shared queue
 * until it sees the end-of-work marker or the run is cancelled. Every task it takes produces
 * exactly one result; per-image failures become error results and never end the loop.
 */
final class Worker implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);

    private final WorkerHandle handle;
    private final DetectorConfig config;
    private final DetectorProvider provider;
    private final BlockingQueue<ImageTask> tasks;
    private final BlockingQueue<ClassificationResult> results;
    private final CancellationToken cancellation;
    private final CountDownLatch initialized;

    Worker(WorkerHandle handle,
           DetectorConfig config,
           DetectorProvider provider,
           BlockingQueue<ImageTask> tasks,
           BlockingQueue<ClassificationResult> results,
           CancellationToken cancellation,
           CountDownLatch initialized) {
        this.handle = handle;
        this.config = config;
        this.provider = provider;
        this.tasks = tasks;
        this.results = results;
        this.cancellation = cancellation;
        this.initialized = initialized;
    }

    @Override
    public void run() {
        handle.bind(Thread.currentThread());
        MDC.put("worker", handle.name());
        try {
            DetectorAdapter adapter = initialize();
            if (adapter != null) {
                try (adapter) {
                    processTasks(adapter);
                } finally {
                    handle.transition(WorkerState.TERMINATED);
                    LOGGER.debug("Worker stopped after {} images", handle.processed());
                }
            }
        } finally {
            MDC.remove("worker");
        }
    }

    private DetectorAdapter initialize() {
        handle.transition(WorkerState.INITIALIZING);
        try {
            DetectorAdapter adapter = DetectorAdapter.initialize(config, provider);
            handle.transition(WorkerState.READY);
            LOGGER.debug("Worker ready with mode {}", adapter.mode());
            return adapter;
        } catch (ModelLoadException ex) {
            handle.fail(ex);
            LOGGER.error("Worker failed to load detectors: {}", ex.getMessage(), ex);
            return null;
        } catch (LinkageError ex) {
            handle.fail(new ModelLoadException("Native detector library failed to load: " + ex.getMessage(), ex));
            LOGGER.error("Worker failed to load detectors", ex);
            return null;
        } finally {
            initialized.countDown();
        }
    }

    private void processTasks(DetectorAdapter adapter) {
        try {
            while (!cancellation.isCancelled()) {
                ImageTask task = tasks.poll(config.pollTimeoutMillis(), TimeUnit.MILLISECONDS);
                if (task == null) {
                    continue;
                }
                if (task == WorkDistributor.END_OF_WORK) {
                    break;
                }
                handle.transition(WorkerState.BUSY);
                publish(classify(adapter, task));
                handle.countProcessed();
                handle.transition(WorkerState.READY);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Worker interrupted; stopping.");
        }
        handle.transition(WorkerState.DRAINING);
    }

    private ClassificationResult classify(DetectorAdapter adapter, ImageTask task) {
        long started = System.nanoTime();
        try {
            Classification classification = adapter.classify(task);
            return ClassificationResult.classified(
                    task.path(),
                    classification.screenshot(),
                    classification.method(),
                    classification.metric(),
                    classification.elapsed()
            );
        } catch (ImageProcessingException ex) {
            LOGGER.debug("Classification failed for {}", task.path(), ex);
            return ClassificationResult.failed(task.path(), DetectionMethod.NONE, since(started), ex.getMessage());
        } catch (Throwable ex) {
            // Anything a native or misbehaving detector throws still ends in a result for this task.
            LOGGER.error("Unexpected failure classifying {}", task.path(), ex);
            return ClassificationResult.failed(task.path(), DetectionMethod.NONE, since(started),
                    "Unexpected failure: " + ex);
        }
    }

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    /**
     * Hands a result to the collector, waiting while the channel is full. The collector drains
     * until every worker has stopped, so this only gives up when the worker is interrupted.
     */
    private void publish(ClassificationResult result) throws InterruptedException {
        while (!results.offer(result, config.pollTimeoutMillis(), TimeUnit.MILLISECONDS)) {
            LOGGER.debug("Result channel full; waiting to publish {}", result.path());
        }
    }
}
