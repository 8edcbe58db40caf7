package com.example.ssdetect;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-wide cancellation flag. Workers check it before taking a task, the collector on every
 * poll, and the collector again before starting a relocation.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
