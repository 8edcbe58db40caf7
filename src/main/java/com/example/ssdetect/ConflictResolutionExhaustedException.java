package com.example.ssdetect;

import java.nio.file.Path;

public class ConflictResolutionExhaustedException extends FilesystemException {
    public ConflictResolutionExhaustedException(Path path, Path destinationDirectory, int attempts) {
        super(path, "No free name for " + path.getFileName() + " in " + destinationDirectory
                + " after " + attempts + " attempts");
    }
}
