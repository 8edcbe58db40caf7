package com.example.ssdetect;

import com.example.ssdetect.detect.DetectorProvider;
import com.example.ssdetect.detect.ModelLoadException;
import com.example.ssdetect.report.ResultSink;
import com.example.ssdetect.report.SummaryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates a detection run: starts the worker pool and waits for every worker to load its
 * models, streams the input tree through the bounded task queue, drains results on a dedicated
 * collector thread, then tears the pool down and reports the final statistics.
 */
public final class DetectionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetectionEngine.class);

    private final DetectorConfig config;
    private final DetectorProvider provider;
    private final ResultSink sink;
    private final CancellationToken cancellation;
    private final List<WorkerHandle> workers = new ArrayList<>();

    public DetectionEngine(DetectorConfig config, ResultSink sink, CancellationToken cancellation) {
        this(config, DetectorProvider.defaults(), sink, cancellation);
    }

    DetectionEngine(DetectorConfig config, DetectorProvider provider, ResultSink sink, CancellationToken cancellation) {
        this.config = config;
        this.provider = provider;
        this.sink = sink;
        this.cancellation = cancellation;
    }

    /**
     * Executes one run over the configured input directory.
     *
     * @throws ModelLoadException if no worker could load its detectors
     * @throws IOException if the input directory cannot be walked
     */
    public RunSummary run() throws IOException, InterruptedException, ModelLoadException {
        long started = System.nanoTime();
        if (!Files.isDirectory(config.inputDirectory())) {
            throw new IOException("Input directory does not exist or is not a directory: " + config.inputDirectory());
        }
        LOGGER.info("Scanning directory for images directory={} workers={} mode={} ocrChars={} ocrQuality={}",
                config.inputDirectory(), config.workerCount(), config.mode().name().toLowerCase(Locale.ROOT),
                config.mode().usesOcr() ? config.ocrMinChars() : null,
                config.mode().usesOcr() ? config.ocrMinConfidence() : null);

        BlockingQueue<ImageTask> tasks = new ArrayBlockingQueue<>(config.queueCapacity());
        BlockingQueue<ClassificationResult> results = new ArrayBlockingQueue<>(config.resultCapacity());
        ExecutorService workerPool = Executors.newFixedThreadPool(config.workerCount(), namedThreads("detector-worker"));
        ExecutorService distributorExecutor = Executors.newSingleThreadExecutor(namedThreads("work-distributor"));
        Thread collectorThread = null;
        try {
            List<Future<?>> workerFutures = new ArrayList<>();
            int active = startWorkers(workerPool, tasks, results, workerFutures);

            RunStatistics statistics = new RunStatistics();
            ResultCollector collector = new ResultCollector(
                    config,
                    results,
                    statistics,
                    config.relocation().active() ? FileRelocator.from(config) : null,
                    sink,
                    cancellation
            );
            WorkDistributor distributor = new WorkDistributor(config, tasks, cancellation);
            Future<Long> distribution = distributorExecutor.submit(() -> distributor.distribute(active));
            collectorThread = new Thread(collector, "result-collector");
            collectorThread.start();

            long enumerated = awaitDistribution(distribution, tasks, workerFutures);

            // Workers leave on their end markers, or after their current image when cancelled.
            workerPool.shutdown();
            while (!workerPool.awaitTermination(1, TimeUnit.SECONDS)) {
                LOGGER.debug("Waiting for workers to finish in-flight images");
            }
            int lost = countLostWorkers(workerFutures);
            signalEndOfResults(results, collectorThread);
            collectorThread.join();
            if (collector.failure() != null) {
                throw new IllegalStateException("Result collector failed", collector.failure());
            }

            RunSummary summary = new RunSummary(
                    enumerated,
                    config.workerCount(),
                    active,
                    lost,
                    cancellation.isCancelled(),
                    Duration.ofNanos(System.nanoTime() - started),
                    statistics.snapshot()
            );
            complete(summary);
            return summary;
        } finally {
            distributorExecutor.shutdownNow();
            workerPool.shutdownNow();
            if (collectorThread != null && collectorThread.isAlive()) {
                cancellation.cancel();
                collectorThread.interrupt();
                collectorThread.join(TimeUnit.SECONDS.toMillis(5));
            }
        }
    }

    /**
     * Handles of the current run's workers, for diagnostics and tests.
     */
    public List<WorkerHandle> workers() {
        return List.copyOf(workers);
    }

    private int startWorkers(ExecutorService workerPool,
                             BlockingQueue<ImageTask> tasks,
                             BlockingQueue<ClassificationResult> results,
                             List<Future<?>> futures) throws InterruptedException, ModelLoadException {
        CountDownLatch initialized = new CountDownLatch(config.workerCount());
        workers.clear();
        for (int i = 1; i <= config.workerCount(); i++) {
            WorkerHandle handle = new WorkerHandle(i);
            workers.add(handle);
            futures.add(workerPool.submit(new Worker(handle, config, provider, tasks, results, cancellation, initialized)));
        }
        initialized.await();

        int active = (int) workers.stream().filter(WorkerHandle::started).count();
        if (active == 0) {
            ModelLoadException failure = new ModelLoadException(
                    "All " + config.workerCount() + " workers failed to load their detectors");
            workers.forEach(handle -> handle.failure().ifPresent(failure::addSuppressed));
            throw failure;
        }
        if (active < config.workerCount()) {
            LOGGER.warn("Degraded run: {} of {} workers loaded their detectors", active, config.workerCount());
        } else {
            LOGGER.info("All {} workers ready", active);
        }
        return active;
    }

    /**
     * Waits for the walk to finish. If every worker has stopped while tasks are still queued,
     * nobody will take them, so the run is cancelled to release the distributor.
     */
    private long awaitDistribution(Future<Long> distribution,
                                   BlockingQueue<ImageTask> tasks,
                                   List<Future<?>> workerFutures) throws IOException, InterruptedException {
        while (true) {
            try {
                return distribution.get(config.pollTimeoutMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException ex) {
                if (!cancellation.isCancelled() && !tasks.isEmpty()
                        && workerFutures.stream().allMatch(Future::isDone)) {
                    LOGGER.error("All workers stopped with {} images still queued; aborting", tasks.size());
                    cancellation.cancel();
                }
            } catch (ExecutionException ex) {
                cancellation.cancel();
                Throwable cause = ex.getCause();
                if (cause instanceof IOException) {
                    throw (IOException) cause;
                }
                if (cause instanceof InterruptedException) {
                    throw (InterruptedException) cause;
                }
                throw new IllegalStateException("Work distribution failed", cause);
            }
        }
    }

    /**
     * Counts workers that loaded their detectors but then died. Their thread ended on an
     * uncaught error, which the pool only reports through the future.
     */
    private int countLostWorkers(List<Future<?>> workerFutures) throws InterruptedException {
        int lost = 0;
        for (int i = 0; i < workerFutures.size(); i++) {
            WorkerHandle handle = workers.get(i);
            try {
                workerFutures.get(i).get();
            } catch (ExecutionException ex) {
                LOGGER.error("Worker {} died unexpectedly after {} images", handle.name(), handle.processed(), ex.getCause());
                if (handle.failure().isEmpty()) {
                    lost++;
                }
            }
        }
        if (lost > 0) {
            LOGGER.error("{} of {} workers were lost during the run", lost, workers.size());
        }
        return lost;
    }

    private void signalEndOfResults(BlockingQueue<ClassificationResult> results, Thread collectorThread)
            throws InterruptedException {
        while (collectorThread.isAlive()
                && !results.offer(ResultCollector.END_OF_RESULTS, config.pollTimeoutMillis(), TimeUnit.MILLISECONDS)) {
            LOGGER.debug("Result channel full; retrying end-of-results marker");
        }
    }

    private void complete(RunSummary summary) {
        if (summary.cancelled()) {
            LOGGER.warn("Classification cancelled after {} of {} enumerated images",
                    summary.statistics().total(), summary.enumerated());
        }
        try {
            sink.complete(SummaryRecord.of(summary, config));
        } catch (IOException ex) {
            LOGGER.error("Failed to write run summary", ex);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> new Thread(runnable, prefix + "-" + counter.incrementAndGet());
    }
}
