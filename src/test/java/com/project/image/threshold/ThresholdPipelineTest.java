package com.project.image.threshold;

import com.project.image.threshold.DTOs.PixelBuffer;
import com.project.image.threshold.DTOs.ThresholdOutcome;
import com.project.image.threshold.DTOs.ThresholdValue;
import com.project.image.threshold.exceptions.ConfigurationException;
import com.project.image.threshold.exceptions.ShutdownException;
import com.project.image.threshold.service.ImageStore;
import com.project.image.threshold.service.ResultCache;
import com.project.image.threshold.service.ThresholdPipeline;
import com.project.image.threshold.service.ThresholdTransform;
import com.project.image.threshold.service.ThresholdWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThresholdPipelineTest {
    private static final Executor DIRECT = Runnable::run;

    private final ResultCache cache = new ResultCache(10);
    private final ImageStore store = new ImageStore(cache);
    private final BlockingQueue<ThresholdOutcome> outcomes = new LinkedBlockingQueue<>();
    private ThresholdPipeline pipeline = new ThresholdPipeline(store, cache, new ThresholdTransform(), 20, 2000);

    private static PixelBuffer example() {
        byte[] data = {0, 0, 0, 50, 50, 50, 100, 100, 100, (byte) 255, (byte) 255, (byte) 255};
        return new PixelBuffer(2, 2, 3, data);
    }

    @AfterEach
    void tearDown() {
        pipeline.shutdown();
    }

    @Test
    void endToEnd_exampleImage() throws Exception {
        pipeline.onResult(DIRECT, outcomes::add);
        pipeline.start();

        pipeline.loadImage(example());
        pipeline.requestThreshold(60);

        ThresholdOutcome outcome = outcomes.poll(2, TimeUnit.SECONDS);
        assertThat(outcome).isNotNull();
        assertThat(outcome.result().buffer().data())
                .containsExactly(0, 0, 0, 0, 0, 0, 100, 100, 100, 255, 255, 255);
        assertThat(pipeline.currentResult()).contains(outcome.result());
    }

    @Test
    void burstBeforeWorkerRuns_deliversOnlyLatest() throws Exception {
        pipeline.onResult(DIRECT, outcomes::add);
        pipeline.loadImage(example());
        pipeline.requestThreshold(5);
        pipeline.requestThreshold(10);
        pipeline.requestThreshold(7);

        pipeline.start();

        ThresholdOutcome outcome = outcomes.poll(2, TimeUnit.SECONDS);
        assertThat(outcome).isNotNull();
        assertThat(outcome.threshold()).isEqualTo(7);
        assertThat(outcomes.poll(200, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void requestThreshold_outOfRange_isRejected() {
        pipeline.start();

        assertThatThrownBy(() -> pipeline.requestThreshold(0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> pipeline.requestThreshold(256)).isInstanceOf(ConfigurationException.class);
        assertThat(pipeline.lastRequested()).isEmpty();
    }

    @Test
    void loadImage_reappliesLastThresholdAndHidesOldResult() throws Exception {
        pipeline.onResult(DIRECT, outcomes::add);
        pipeline.start();
        pipeline.loadImage(example());
        pipeline.requestThreshold(60);
        ThresholdOutcome first = outcomes.poll(2, TimeUnit.SECONDS);
        assertThat(first).isNotNull();

        byte[] bright = new byte[12];
        Arrays.fill(bright, (byte) 200);
        long version = pipeline.loadImage(new PixelBuffer(2, 2, 3, bright));

        pipeline.currentResult().ifPresent(r -> assertThat(r.sourceVersion()).isEqualTo(version));
        ThresholdOutcome second = outcomes.poll(2, TimeUnit.SECONDS);
        assertThat(second).isNotNull();
        assertThat(second.sourceVersion()).isEqualTo(version);
        assertThat(second.threshold()).isEqualTo(60);
        assertThat(second.result().buffer().data()).containsOnly((byte) 200);
        assertThat(cache.getResult(60, first.sourceVersion())).isEmpty();
    }

    @Test
    void outcomeForReplacedImage_isDropped() throws Exception {
        CountDownLatch computing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ThresholdTransform slow = new ThresholdTransform() {
            @Override
            public PixelBuffer apply(PixelBuffer buffer, ThresholdValue threshold) {
                computing.countDown();
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.apply(buffer, threshold);
            }
        };
        pipeline = new ThresholdPipeline(store, cache, slow, 20, 2000);
        pipeline.onResult(DIRECT, outcomes::add);
        pipeline.start();

        pipeline.loadImage(example());
        pipeline.requestThreshold(60);
        assertThat(computing.await(2, TimeUnit.SECONDS)).isTrue();
        long newVersion = pipeline.loadImage(example());
        release.countDown();

        ThresholdOutcome outcome = outcomes.poll(3, TimeUnit.SECONDS);
        assertThat(outcome).isNotNull();
        assertThat(outcome.sourceVersion()).isEqualTo(newVersion);
    }

    @Test
    void malformedImage_isDeliveredAsError() throws Exception {
        pipeline.onResult(DIRECT, outcomes::add);
        pipeline.start();

        pipeline.loadImage(new PixelBuffer(1, 1, 5, new byte[5]));
        pipeline.requestThreshold(12);

        ThresholdOutcome outcome = outcomes.poll(2, TimeUnit.SECONDS);
        assertThat(outcome).isNotNull();
        assertThat(outcome.isError()).isTrue();
        assertThat(pipeline.currentResult()).isEmpty();
        assertThat(pipeline.workerState()).isNotEqualTo(ThresholdWorker.State.STOPPED);
    }

    @Test
    void onResult_canOnlyBeRegisteredOnce() {
        pipeline.onResult(DIRECT, outcomes::add);

        assertThatThrownBy(() -> pipeline.onResult(DIRECT, outcomes::add))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void callbacksRunOnTheRegisteredExecutor() throws Exception {
        BlockingQueue<String> threads = new LinkedBlockingQueue<>();
        Executor named = task -> {
            Thread t = new Thread(task, "presenter-test");
            t.start();
        };
        pipeline.onResult(named, o -> threads.add(Thread.currentThread().getName()));
        pipeline.start();

        pipeline.loadImage(example());
        pipeline.requestThreshold(2);

        assertThat(threads.poll(2, TimeUnit.SECONDS)).isEqualTo("presenter-test");
    }

    @Test
    void shutdown_stopsWorkerAndRejectsFurtherWork() {
        pipeline.start();

        pipeline.shutdown();

        assertThat(pipeline.isShutdown()).isTrue();
        assertThat(pipeline.workerState()).isEqualTo(ThresholdWorker.State.STOPPED);
        assertThatThrownBy(() -> pipeline.requestThreshold(10)).isInstanceOf(ShutdownException.class);
        assertThatThrownBy(() -> pipeline.loadImage(example())).isInstanceOf(ShutdownException.class);
        pipeline.shutdown();
    }

    @Test
    void shutdown_suppressesCallbacksStillQueued() throws Exception {
        Queue<Runnable> queued = new ArrayDeque<>();
        CountDownLatch delivered = new CountDownLatch(1);
        Executor deferred = task -> {
            synchronized (queued) {
                queued.add(task);
            }
            delivered.countDown();
        };
        pipeline.onResult(deferred, outcomes::add);
        pipeline.start();
        pipeline.loadImage(example());
        pipeline.requestThreshold(60);
        assertThat(delivered.await(2, TimeUnit.SECONDS)).isTrue();

        pipeline.shutdown();
        synchronized (queued) {
            queued.forEach(Runnable::run);
        }

        assertThat(outcomes).isEmpty();
        assertThat(pipeline.currentResult()).isEmpty();
    }

    @Test
    void currentResult_isEmptyBeforeAnyResult() {
        pipeline.start();
        pipeline.loadImage(example());

        assertThat(pipeline.currentResult()).isEmpty();
    }

    @Test
    void loadImageRacingShutdown_leavesNoImageBehind() throws Exception {
        AtomicReference<Thread> closer = new AtomicReference<>();
        ImageStore racingStore = new ImageStore(cache) {
            @Override
            public long setImage(PixelBuffer image) {
                // shutdown begins after the load has passed its open check
                Thread t = new Thread(() -> pipeline.shutdown(), "closer");
                closer.set(t);
                t.start();
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
                while (!pipeline.isShutdown() && System.nanoTime() < deadline) {
                    Thread.onSpinWait();
                }
                return super.setImage(image);
            }
        };
        pipeline = new ThresholdPipeline(racingStore, cache, new ThresholdTransform(), 20, 2000);
        pipeline.start();

        pipeline.loadImage(example());
        closer.get().join(3000);

        assertThat(closer.get().isAlive()).isFalse();
        assertThat(pipeline.isShutdown()).isTrue();
        assertThat(racingStore.hasImage()).isFalse();
        assertThat(pipeline.currentResult()).isEmpty();
    }
}
