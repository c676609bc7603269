package com.project.image.threshold;

import com.project.image.threshold.DTOs.PixelBuffer;
import com.project.image.threshold.DTOs.ThresholdOutcome;
import com.project.image.threshold.DTOs.ThresholdValue;
import com.project.image.threshold.service.ImageStore;
import com.project.image.threshold.service.ParameterChannel;
import com.project.image.threshold.service.ResultCache;
import com.project.image.threshold.service.ThresholdTransform;
import com.project.image.threshold.service.ThresholdWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThresholdWorkerTest {
    private static final Duration POLL = Duration.ofMillis(20);

    private final ParameterChannel<ThresholdValue> channel = new ParameterChannel<>();
    private final ResultCache cache = new ResultCache(10);
    private final ImageStore store = new ImageStore(cache);
    private final BlockingQueue<ThresholdOutcome> outcomes = new LinkedBlockingQueue<>();
    private final CountingTransform transform = new CountingTransform();
    private final ThresholdWorker worker = new ThresholdWorker(
            channel, store, transform, cache, POLL, Duration.ofSeconds(2), outcomes::add);

    static class CountingTransform extends ThresholdTransform {
        final AtomicInteger passes = new AtomicInteger();

        @Override
        public PixelBuffer apply(PixelBuffer buffer, ThresholdValue threshold) {
            passes.incrementAndGet();
            return super.apply(buffer, threshold);
        }
    }

    private static PixelBuffer gradient() {
        byte[] data = new byte[4 * 4 * 3];
        for (int i = 0; i < data.length; i++) data[i] = (byte) (i * 5);
        return new PixelBuffer(4, 4, 3, data);
    }

    @AfterEach
    void tearDown() {
        worker.stop();
    }

    @Test
    void burstOfRequests_isCoalescedIntoLatest() throws Exception {
        store.setImage(gradient());
        channel.post(ThresholdValue.of(5));
        channel.post(ThresholdValue.of(10));
        channel.post(ThresholdValue.of(7));

        worker.start();

        ThresholdOutcome outcome = outcomes.poll(2, TimeUnit.SECONDS);
        assertThat(outcome).isNotNull();
        assertThat(outcome.isError()).isFalse();
        assertThat(outcome.threshold()).isEqualTo(7);
        assertThat(outcome.result().buffer()).isEqualTo(new ThresholdTransform().apply(gradient(), ThresholdValue.of(7)));
        assertThat(outcomes.poll(10 * POLL.toMillis(), TimeUnit.MILLISECONDS)).isNull();
        assertThat(transform.passes.get()).isEqualTo(1);
    }

    @Test
    void resultIsTaggedWithSourceVersion() throws Exception {
        long version = store.setImage(gradient());
        worker.start();

        channel.post(ThresholdValue.of(60));

        ThresholdOutcome outcome = outcomes.poll(2, TimeUnit.SECONDS);
        assertThat(outcome).isNotNull();
        assertThat(outcome.sourceVersion()).isEqualTo(version);
        assertThat(outcome.result().sourceVersion()).isEqualTo(version);
        assertThat(cache.getResult(60, version)).contains(outcome.result());
    }

    @Test
    void requestWithoutImage_isSkippedSilently() throws Exception {
        worker.start();

        channel.post(ThresholdValue.of(20));

        assertThat(outcomes.poll(10 * POLL.toMillis(), TimeUnit.MILLISECONDS)).isNull();
        assertThat(worker.isAlive()).isTrue();
        assertThat(worker.getState()).isNotEqualTo(ThresholdWorker.State.STOPPED);
    }

    @Test
    void malformedImage_isReportedAndLoopContinues() throws Exception {
        long badVersion = store.setImage(new PixelBuffer(2, 2, 2, new byte[8]));
        worker.start();

        channel.post(ThresholdValue.of(30));
        ThresholdOutcome error = outcomes.poll(2, TimeUnit.SECONDS);

        assertThat(error).isNotNull();
        assertThat(error.isError()).isTrue();
        assertThat(error.result()).isNull();
        assertThat(error.threshold()).isEqualTo(30);
        assertThat(error.sourceVersion()).isEqualTo(badVersion);
        assertThat(error.error()).contains("channel");

        store.setImage(gradient());
        channel.post(ThresholdValue.of(30));
        ThresholdOutcome ok = outcomes.poll(2, TimeUnit.SECONDS);

        assertThat(ok).isNotNull();
        assertThat(ok.isError()).isFalse();
    }

    @Test
    void repeatedThreshold_isServedFromCache() throws Exception {
        store.setImage(gradient());
        worker.start();

        channel.post(ThresholdValue.of(10));
        ThresholdOutcome first = outcomes.poll(2, TimeUnit.SECONDS);
        channel.post(ThresholdValue.of(20));
        assertThat(outcomes.poll(2, TimeUnit.SECONDS)).isNotNull();
        channel.post(ThresholdValue.of(10));
        ThresholdOutcome again = outcomes.poll(2, TimeUnit.SECONDS);

        assertThat(again).isNotNull();
        assertThat(again.result()).isSameAs(first.result());
        assertThat(transform.passes.get()).isEqualTo(2);
    }

    @Test
    void reloadedImage_isRecomputedAtSameThreshold() throws Exception {
        store.setImage(gradient());
        worker.start();
        channel.post(ThresholdValue.of(10));
        assertThat(outcomes.poll(2, TimeUnit.SECONDS)).isNotNull();

        long version = store.setImage(gradient());
        channel.post(ThresholdValue.of(10));
        ThresholdOutcome outcome = outcomes.poll(2, TimeUnit.SECONDS);

        assertThat(outcome).isNotNull();
        assertThat(outcome.sourceVersion()).isEqualTo(version);
        assertThat(transform.passes.get()).isEqualTo(2);
    }

    @Test
    void stop_joinsThreadAndSilencesDelivery() throws Exception {
        store.setImage(gradient());
        worker.start();
        assertThat(worker.isAlive()).isTrue();

        assertThat(worker.stop()).isTrue();

        assertThat(worker.isAlive()).isFalse();
        assertThat(worker.getState()).isEqualTo(ThresholdWorker.State.STOPPED);
        channel.post(ThresholdValue.of(40));
        assertThat(outcomes.poll(5 * POLL.toMillis(), TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void stop_beforeStart_isImmediate() {
        assertThat(worker.stop()).isTrue();
        assertThat(worker.getState()).isEqualTo(ThresholdWorker.State.STOPPED);
    }

    @Test
    void start_twice_isRejected() {
        worker.start();

        assertThatThrownBy(worker::start).isInstanceOf(IllegalStateException.class);
    }
}
