package com.example.ssdetect;

/**
 * Lifecycle of a worker: {@code INITIALIZING -> READY -> (BUSY <-> READY)* -> DRAINING -> TERMINATED}.
 * A worker whose models fail to load goes straight from {@code INITIALIZING} to {@code TERMINATED}.
 */
public enum WorkerState {
    INITIALIZING,
    READY,
    BUSY,
    DRAINING,
    TERMINATED
}
