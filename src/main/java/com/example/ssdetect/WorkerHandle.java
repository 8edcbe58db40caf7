package com.example.ssdetect;

import com.example.ssdetect.detect.ModelLoadException;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The coordinator's view of one worker. State is written by the worker thread only.
 */
public final class WorkerHandle {
    private final int id;
    private final AtomicLong processed = new AtomicLong();
    private volatile WorkerState state = WorkerState.INITIALIZING;
    private volatile String threadName;
    private volatile ModelLoadException failure;

    WorkerHandle(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public String name() {
        return "worker-" + id;
    }

    public WorkerState state() {
        return state;
    }

    public Optional<String> threadName() {
        return Optional.ofNullable(threadName);
    }

    public Optional<ModelLoadException> failure() {
        return Optional.ofNullable(failure);
    }

    public long processed() {
        return processed.get();
    }

    /**
     * True once the worker reached READY at least once, i.e. its models loaded.
     */
    public boolean started() {
        return failure == null && state != WorkerState.INITIALIZING;
    }

    void bind(Thread thread) {
        this.threadName = thread.getName();
    }

    void transition(WorkerState next) {
        this.state = next;
    }

    void fail(ModelLoadException cause) {
        this.failure = cause;
        this.state = WorkerState.TERMINATED;
    }

    void countProcessed() {
        processed.incrementAndGet();
    }
}
