package com.example.ssdetect;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A relocation step failed for one file. Never fatal to the run.
 */
public class FilesystemException extends IOException {
    private final Path path;

    public FilesystemException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public FilesystemException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
