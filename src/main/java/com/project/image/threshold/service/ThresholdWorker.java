package com.project.image.threshold.service;

import com.project.image.threshold.DTOs.ImageSnapshot;
import com.project.image.threshold.DTOs.PixelBuffer;
import com.project.image.threshold.DTOs.ProcessedResult;
import com.project.image.threshold.DTOs.ThresholdOutcome;
import com.project.image.threshold.DTOs.ThresholdValue;
import com.project.image.threshold.exceptions.NoImageException;
import com.project.image.threshold.exceptions.ShapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Background loop that turns the latest requested threshold into a rendered result.
 * <p>
 * Each pass takes the pending threshold from the channel, snapshots the current image,
 * applies the transform (or reuses a tier-1 cache hit) and hands the outcome to the sink.
 * A failing pass is reported to the sink as an error; it never ends the loop.
 * Once {@link #stop()} has raised the stop flag nothing more is delivered.
 */
public class ThresholdWorker {
    private static final Logger log = LoggerFactory.getLogger(ThresholdWorker.class);

    public enum State { NEW, RUNNING, WAITING_FOR_VALUE, COMPUTING, STOPPED }

    private final ParameterChannel<ThresholdValue> channel;
    private final ImageStore store;
    private final ThresholdTransform transform;
    private final ResultCache cache;
    private final Duration pollInterval;
    private final Duration joinTimeout;
    private final Consumer<ThresholdOutcome> sink;

    private final Object deliveryLock = new Object();
    private volatile boolean stopRequested;
    private volatile State state = State.NEW;
    private Thread thread;

    public ThresholdWorker(ParameterChannel<ThresholdValue> channel,
                           ImageStore store,
                           ThresholdTransform transform,
                           ResultCache cache,
                           Duration pollInterval,
                           Duration joinTimeout,
                           Consumer<ThresholdOutcome> sink) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
        }
        this.channel = channel;
        this.store = store;
        this.transform = transform;
        this.cache = cache;
        this.pollInterval = pollInterval;
        this.joinTimeout = joinTimeout;
        this.sink = sink;
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Worker already started");
        }
        thread = new Thread(this::runLoop, "threshold-worker");
        thread.setDaemon(true);
        state = State.RUNNING;
        thread.start();
        log.info("Threshold worker started (poll interval {} ms)", pollInterval.toMillis());
    }

    /**
     * Raises the stop flag and waits for the worker thread to exit.
     *
     * @return true if the thread exited within the join timeout
     */
    public synchronized boolean stop() {
        synchronized (deliveryLock) {
            stopRequested = true;
        }
        if (thread == null) {
            state = State.STOPPED;
            return true;
        }
        try {
            thread.join(joinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for the threshold worker to exit");
            return false;
        }
        if (thread.isAlive()) {
            log.error("Threshold worker did not exit within {} ms, interrupting it", joinTimeout.toMillis());
            thread.interrupt();
            return false;
        }
        log.info("Threshold worker stopped");
        return true;
    }

    public State getState() {
        return state;
    }

    public boolean isAlive() {
        Thread t;
        synchronized (this) {
            t = thread;
        }
        return t != null && t.isAlive();
    }

    private void runLoop() {
        try {
            while (!stopRequested) {
                state = State.WAITING_FOR_VALUE;
                Optional<ThresholdValue> next = channel.take(pollInterval);
                if (next.isEmpty()) {
                    continue;
                }
                state = State.COMPUTING;
                process(next.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Threshold worker interrupted");
        } finally {
            state = State.STOPPED;
        }
    }

    private void process(ThresholdValue threshold) {
        ImageSnapshot snapshot;
        try {
            snapshot = store.snapshot();
        } catch (NoImageException e) {
            log.debug("Threshold {} requested before any image was loaded, skipping", threshold.value());
            return;
        }

        ThresholdOutcome outcome;
        Optional<ProcessedResult> cached = cache.getResult(threshold.value(), snapshot.sourceVersion());
        if (cached.isPresent()) {
            log.debug("Reusing cached result for threshold {} (version {})",
                    threshold.value(), snapshot.sourceVersion());
            outcome = ThresholdOutcome.success(cached.get());
        } else {
            outcome = compute(snapshot, threshold);
        }
        deliver(outcome);
    }

    private ThresholdOutcome compute(ImageSnapshot snapshot, ThresholdValue threshold) {
        long start = System.nanoTime();
        try {
            PixelBuffer output = transform.apply(snapshot.buffer(), threshold);
            ProcessedResult result = new ProcessedResult(output, threshold, snapshot.sourceVersion());
            cache.putResult(result);
            log.debug("Threshold {} applied to version {} in {} ms", threshold.value(),
                    snapshot.sourceVersion(), (System.nanoTime() - start) / 1_000_000);
            return ThresholdOutcome.success(result);
        } catch (ShapeException e) {
            log.warn("Cannot threshold version {}: {}", snapshot.sourceVersion(), e.getMessage());
            return ThresholdOutcome.failure(threshold.value(), snapshot.sourceVersion(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Threshold pass failed for version {}", snapshot.sourceVersion(), e);
            return ThresholdOutcome.failure(threshold.value(), snapshot.sourceVersion(),
                    "Processing failed: " + e.getMessage());
        }
    }

    private void deliver(ThresholdOutcome outcome) {
        synchronized (deliveryLock) {
            if (stopRequested) {
                log.debug("Worker stopping, dropping outcome for threshold {}", outcome.threshold());
                return;
            }
            try {
                sink.accept(outcome);
            } catch (RuntimeException e) {
                log.error("Result sink failed for threshold {}", outcome.threshold(), e);
            }
        }
    }
}
