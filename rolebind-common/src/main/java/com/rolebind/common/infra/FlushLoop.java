package com.rolebind.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Calls a flush action on a daemon thread at a fixed delay, and one last
 * time on {@link #close()} so nothing written since the previous tick is
 * left behind.
 */
@Slf4j
public class FlushLoop implements AutoCloseable {

    private final String name;
    private final long intervalMs;
    private final Runnable flush;
    private final ScheduledExecutorService scheduler;
    private boolean started;
    private boolean closed;

    public FlushLoop(String name, long intervalMs, Runnable flush) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Flush interval must be positive: " + intervalMs);
        }
        this.name = name;
        this.intervalMs = intervalMs;
        this.flush = flush;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (started || closed) {
            return;
        }
        started = true;
        scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("{}: flushing every {}ms", name, intervalMs);
    }

    /**
     * Stops the schedule, waits for a running tick and then flushes once
     * more on the calling thread.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            flush.run();
        } catch (RuntimeException e) {
            log.error("{}: final flush failed, unsaved changes are lost: {}", name, ErrorUtils.formatErrorMessage(e), e);
        }
    }

    // A throwing task would cancel every later run of scheduleWithFixedDelay
    private void tick() {
        try {
            flush.run();
        } catch (RuntimeException e) {
            log.warn("{}: flush failed, retrying in {}ms: {}", name, intervalMs, ErrorUtils.formatErrorMessage(e));
        }
    }
}
