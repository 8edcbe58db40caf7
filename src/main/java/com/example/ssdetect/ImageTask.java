package com.example.ssdetect;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One qualifying file handed to exactly one worker.
 */
public record ImageTask(Path path, DetectionMode mode) {
    public ImageTask {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(mode, "mode");
        path = path.toAbsolutePath().normalize();
    }
}
