package com.example.ssdetect;

import java.nio.file.Path;
import java.util.List;

/**
 * A completed relocation. The primary file always made it; sidecars listed in
 * {@code sidecarFailures} did not and were left in place.
 */
public record RelocationOutcome(RelocationMode mode, RelocationPlan plan, List<SidecarFailure> sidecarFailures) {
    public RelocationOutcome {
        sidecarFailures = List.copyOf(sidecarFailures);
    }

    public boolean complete() {
        return sidecarFailures.isEmpty();
    }

    public record SidecarFailure(Path sidecar, String reason) {
    }
}
