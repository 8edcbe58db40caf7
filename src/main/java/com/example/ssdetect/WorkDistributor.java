package com.example.ssdetect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Walks the input tree and feeds one {@link ImageTask} per qualifying file into the bounded
 * task queue. A full queue blocks the walk, which keeps memory flat on huge trees. When the
 * walk ends it posts one {@link #END_OF_WORK} marker per live worker.
 */
final class WorkDistributor {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkDistributor.class);

    static final ImageTask END_OF_WORK = new ImageTask(Path.of("end-of-work"), DetectionMode.BOTH);

    private final DetectorConfig config;
    private final BlockingQueue<ImageTask> queue;
    private final CancellationToken cancellation;
    private final Optional<Path> excludedTarget;

    WorkDistributor(DetectorConfig config, BlockingQueue<ImageTask> queue, CancellationToken cancellation) {
        this.config = config;
        this.queue = queue;
        this.cancellation = cancellation;
        this.excludedTarget = config.relocation().active()
                ? config.relocationTarget().map(WorkDistributor::normalize)
                : Optional.empty();
    }

    /**
     * Enqueues every qualifying file and then the end markers.
     *
     * @return the number of tasks enqueued
     */
    long distribute(int workers) throws IOException, InterruptedException {
        long[] count = {0L};
        boolean completed = walk(file -> {
            ImageTask task = new ImageTask(file, config.mode());
            while (!queue.offer(task, config.pollTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                if (cancellation.isCancelled()) {
                    return false;
                }
            }
            count[0]++;
            return true;
        });
        if (!completed) {
            LOGGER.info("Run cancelled after enqueueing {} images", count[0]);
            return count[0];
        }
        for (int i = 0; i < workers; i++) {
            while (!queue.offer(END_OF_WORK, config.pollTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                if (cancellation.isCancelled()) {
                    return count[0];
                }
            }
        }
        LOGGER.debug("Enqueued {} images for {} workers", count[0], workers);
        return count[0];
    }

    private boolean walk(FileVisitor visitor) throws IOException, InterruptedException {
        Path root = normalize(config.inputDirectory());
        if (!Files.isDirectory(root)) {
            throw new IOException("Input directory does not exist or is not a directory: " + root);
        }
        Set<Object> visited = new HashSet<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.addLast(root);
        while (!pending.isEmpty()) {
            if (cancellation.isCancelled()) {
                return false;
            }
            Path current = pending.removeFirst();
            if (!markVisited(visited, current)) {
                continue;
            }
            List<Path> entries = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                for (Path entry : stream) {
                    entries.add(entry);
                }
            } catch (IOException ex) {
                LOGGER.warn("Failed to list directory {}", current, ex);
                continue;
            }
            entries.sort(null);
            for (Path entry : entries) {
                if (shouldSkipPath(entry)) {
                    continue;
                }
                if (Files.isDirectory(entry, linkOptions())) {
                    if (!isExcludedDirectory(entry)) {
                        pending.addLast(entry);
                    }
                } else if (Files.isRegularFile(entry, linkOptions()) && ImageExtensions.isSupported(entry)) {
                    if (!visitor.visit(normalize(entry))) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    private boolean markVisited(Set<Object> visited, Path directory) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(directory, BasicFileAttributes.class, linkOptions());
            Object key = attrs.fileKey() != null ? attrs.fileKey() : directory.toRealPath();
            return visited.add(key);
        } catch (IOException ex) {
            LOGGER.warn("Failed to read attributes for {}", directory, ex);
            return false;
        }
    }

    private boolean isExcludedDirectory(Path directory) {
        if (excludedTarget.isPresent() && normalize(directory).startsWith(excludedTarget.get())) {
            return true;
        }
        String name = directory.getFileName().toString();
        return config.excludeDirectoryPatterns().contains(name);
    }

    private boolean shouldSkipPath(Path path) {
        return !config.followLinks() && Files.isSymbolicLink(path);
    }

    private LinkOption[] linkOptions() {
        return config.followLinks() ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    @FunctionalInterface
    private interface FileVisitor {
        boolean visit(Path file) throws InterruptedException;
    }
}
