package com.project.image.threshold.service;

import com.project.image.threshold.DTOs.PixelBuffer;
import com.project.image.threshold.DTOs.ProcessedResult;
import com.project.image.threshold.DTOs.ThresholdOutcome;
import com.project.image.threshold.DTOs.ThresholdValue;
import com.project.image.threshold.exceptions.ShutdownException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Entry point used by the presenter: accepts images and threshold requests, runs the worker,
 * and forwards its outcomes to the registered callback on the callback's own executor.
 * <p>
 * Outcomes computed against an image that has since been replaced are dropped here.
 */
@Service
public class ThresholdPipeline {
    private static final Logger log = LoggerFactory.getLogger(ThresholdPipeline.class);

    private final ImageStore store;
    private final ResultCache cache;
    private final ParameterChannel<ThresholdValue> channel = new ParameterChannel<>();
    private final ThresholdWorker worker;

    private final Object resultLock = new Object();
    private ProcessedResult current;
    private volatile ThresholdValue lastRequested;
    private volatile Registration registration;
    private volatile boolean shutdown;

    private record Registration(Executor executor, Consumer<ThresholdOutcome> callback) {}

    public ThresholdPipeline(ImageStore store,
                             ResultCache cache,
                             ThresholdTransform transform,
                             @Value("${app.threshold.poll-interval-ms:100}") long pollIntervalMs,
                             @Value("${app.threshold.join-timeout-ms:5000}") long joinTimeoutMs) {
        this.store = store;
        this.cache = cache;
        this.worker = new ThresholdWorker(channel, store, transform, cache,
                Duration.ofMillis(pollIntervalMs), Duration.ofMillis(joinTimeoutMs), this::publish);
    }

    @PostConstruct
    public void start() {
        worker.start();
    }

    /** Replaces the source image. The last requested threshold is re-applied to it. */
    public long loadImage(PixelBuffer image) {
        long version;
        // checked under the lock so a concurrent shutdown clears whatever is stored here
        synchronized (resultLock) {
            checkOpen();
            version = store.setImage(image);
            current = null;
        }
        ThresholdValue last = lastRequested;
        if (last != null) {
            channel.post(last);
        }
        return version;
    }

    /**
     * Queues a threshold for the worker, replacing any request it has not picked up yet.
     *
     * @throws com.project.image.threshold.exceptions.ConfigurationException if outside [1,255]
     */
    public void requestThreshold(int value) {
        checkOpen();
        ThresholdValue threshold = ThresholdValue.of(value);
        ThresholdValue previous = lastRequested;
        lastRequested = threshold;
        if (previous == null || previous.value() != value) {
            cache.invalidateDisplays();
        }
        if (channel.post(threshold)) {
            log.debug("Threshold {} replaced a request not yet picked up", value);
        }
    }

    /** Registers the single result callback. Every delivery runs on {@code executor}. */
    public synchronized void onResult(Executor executor, Consumer<ThresholdOutcome> callback) {
        if (registration != null) {
            throw new IllegalStateException("A result callback is already registered");
        }
        registration = new Registration(executor, callback);
    }

    /** Newest successful result for the image currently loaded. */
    public Optional<ProcessedResult> currentResult() {
        synchronized (resultLock) {
            if (current == null || current.sourceVersion() != store.currentVersion()) {
                return Optional.empty();
            }
            return Optional.of(current);
        }
    }

    public Optional<ThresholdValue> lastRequested() {
        return Optional.ofNullable(lastRequested);
    }

    public long currentVersion() {
        return store.currentVersion();
    }

    public ThresholdWorker.State workerState() {
        return worker.getState();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Stops the worker and waits for it. No callback runs once this returns.
     * Failing to join the worker is logged and teardown carries on.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        if (!worker.stop()) {
            log.error("Threshold worker could not be joined, continuing shutdown");
        }
        synchronized (resultLock) {
            current = null;
            store.clear();
        }
        log.info("Threshold pipeline shut down");
    }

    // runs on the worker thread
    private void publish(ThresholdOutcome outcome) {
        synchronized (resultLock) {
            long version = store.currentVersion();
            if (outcome.sourceVersion() != version) {
                log.debug("Dropping outcome for threshold {}: computed on version {}, current is {}",
                        outcome.threshold(), outcome.sourceVersion(), version);
                return;
            }
            if (!outcome.isError()) {
                current = outcome.result();
            }
        }
        Registration target = registration;
        if (target == null) {
            return;
        }
        try {
            target.executor().execute(() -> {
                if (!shutdown) {
                    target.callback().accept(outcome);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Result callback executor rejected outcome for threshold {}", outcome.threshold());
        }
    }

    private void checkOpen() {
        if (shutdown) {
            throw new ShutdownException("Threshold pipeline has been shut down");
        }
    }
}
