package com.example.ssdetect;

import java.nio.file.Path;
import java.util.List;

/**
 * Where a classified file and its sidecars go. Sidecars follow the resolved name of the primary
 * file, so a conflict suffix on the image is carried over to its metadata files.
 */
public record RelocationPlan(
        Path source,
        Path destinationDirectory,
        Path resolvedDestination,
        List<Path> sidecars
) {
    public RelocationPlan {
        sidecars = List.copyOf(sidecars);
    }

    public Path sidecarDestination(Path sidecar) {
        String extension = FileNames.extension(sidecar.getFileName().toString());
        String stem = FileNames.stem(resolvedDestination.getFileName().toString());
        return resolvedDestination.resolveSibling(stem + extension);
    }
}
