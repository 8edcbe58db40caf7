package com.example.ssdetect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Moves or copies classified files into a destination directory without ever overwriting.
 * Name resolution and the file action run under one lock per destination directory, so two
 * relocations can never settle on the same suffixed name.
 */
public final class FileRelocator {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileRelocator.class);

    private final Set<String> sidecarExtensions;
    private final int maxAttempts;
    private final ConcurrentHashMap<Path, ReentrantLock> directoryLocks = new ConcurrentHashMap<>();

    public FileRelocator(List<String> sidecarExtensions, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.sidecarExtensions = sidecarExtensions.stream()
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.maxAttempts = maxAttempts;
    }

    public static FileRelocator from(DetectorConfig config) {
        return new FileRelocator(config.sidecarExtensions(), config.maxConflictAttempts());
    }

    public RelocationOutcome relocate(Path source, Path destinationDirectory, RelocationMode mode) throws FilesystemException {
        if (!mode.active()) {
            throw new IllegalArgumentException("Relocation mode must be move or copy");
        }
        if (!Files.isRegularFile(source, LinkOption.NOFOLLOW_LINKS)) {
            throw new FilesystemException(source, "Source file no longer exists: " + source);
        }
        Path directory = destinationDirectory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new FilesystemException(source, "Cannot create destination " + directory + ": " + ex.getMessage(), ex);
        }

        ReentrantLock lock = directoryLocks.computeIfAbsent(directory, ignored -> new ReentrantLock());
        lock.lock();
        try {
            RelocationPlan plan = plan(source, directory);
            transfer(source, plan.resolvedDestination(), mode);
            List<RelocationOutcome.SidecarFailure> failures = new ArrayList<>();
            for (Path sidecar : plan.sidecars()) {
                Path target = plan.sidecarDestination(sidecar);
                try {
                    transfer(sidecar, target, mode);
                } catch (IOException ex) {
                    LOGGER.warn("Failed to {} sidecar {} to {}", verb(mode), sidecar, target, ex);
                    failures.add(new RelocationOutcome.SidecarFailure(sidecar, ex.getMessage()));
                }
            }
            return new RelocationOutcome(mode, plan, failures);
        } catch (FilesystemException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new FilesystemException(source, "Failed to " + verb(mode) + " " + source + ": " + ex.getMessage(), ex);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Picks the first {@code name}, {@code stem_1.ext}, {@code stem_2.ext}... for which neither the
     * file nor any of its sidecar names are taken. Must be called with the directory lock held.
     */
    RelocationPlan plan(Path source, Path directory) throws FilesystemException {
        List<Path> sidecars = findSidecars(source);
        String name = source.getFileName().toString();
        String stem = FileNames.stem(name);
        String extension = FileNames.extension(name);
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String candidateName = attempt == 0 ? name : stem + "_" + attempt + extension;
            RelocationPlan candidate = new RelocationPlan(source, directory, directory.resolve(candidateName), sidecars);
            if (isFree(candidate)) {
                return candidate;
            }
        }
        throw new ConflictResolutionExhaustedException(source, directory, maxAttempts);
    }

    private boolean isFree(RelocationPlan plan) {
        if (Files.exists(plan.resolvedDestination(), LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        for (Path sidecar : plan.sidecars()) {
            if (Files.exists(plan.sidecarDestination(sidecar), LinkOption.NOFOLLOW_LINKS)) {
                return false;
            }
        }
        return true;
    }

    List<Path> findSidecars(Path source) throws FilesystemException {
        if (sidecarExtensions.isEmpty()) {
            return List.of();
        }
        Path parent = source.toAbsolutePath().getParent();
        String stem = FileNames.stem(source.getFileName().toString());
        List<Path> sidecars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(parent)) {
            for (Path entry : stream) {
                if (entry.getFileName().equals(source.getFileName())
                        || !Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                String entryName = entry.getFileName().toString();
                if (FileNames.stem(entryName).equals(stem)
                        && sidecarExtensions.contains(FileNames.lowerExtension(entry))) {
                    sidecars.add(entry);
                }
            }
        } catch (IOException ex) {
            throw new FilesystemException(source, "Failed to look for sidecars of " + source + ": " + ex.getMessage(), ex);
        }
        sidecars.sort(null);
        return sidecars;
    }

    private void transfer(Path source, Path target, RelocationMode mode) throws IOException {
        if (mode == RelocationMode.MOVE) {
            Files.move(source, target);
        } else {
            Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
        }
    }

    private static String verb(RelocationMode mode) {
        return mode == RelocationMode.MOVE ? "move" : "copy";
    }
}
