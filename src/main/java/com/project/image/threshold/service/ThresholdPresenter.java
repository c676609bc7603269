package com.project.image.threshold.service;

import com.project.image.threshold.DTOs.DisplayKey;
import com.project.image.threshold.DTOs.PixelBuffer;
import com.project.image.threshold.DTOs.ProcessedResult;
import com.project.image.threshold.DTOs.ThresholdOutcome;
import com.project.image.threshold.DTOs.ThresholdStatus;
import com.project.image.threshold.DTOs.ThresholdValue;
import com.project.image.threshold.exceptions.ImageFormatException;
import com.project.image.threshold.exceptions.NoImageException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;

/**
 * Web-facing side of the pipeline. Outcomes from the worker are received on the presenter
 * executor and kept as the state the page polls; previews and saved files are produced
 * from the pipeline's current result.
 */
@Service
public class ThresholdPresenter {
    private static final Logger log = LoggerFactory.getLogger(ThresholdPresenter.class);

    static final int MAX_IMAGE_SIDE = 8000;
    static final int MAX_PREVIEW_SIDE = 4000;

    private final ThresholdPipeline pipeline;
    private final ResultCache cache;
    private final ImageCodec codec;
    private final DisplayRenderer renderer;
    private final StorageService storage;
    private final TaskExecutor presenterExecutor;
    private final int initialThreshold;

    private volatile ThresholdOutcome latest;
    private volatile int imageWidth;
    private volatile int imageHeight;

    public ThresholdPresenter(ThresholdPipeline pipeline,
                              ResultCache cache,
                              ImageCodec codec,
                              DisplayRenderer renderer,
                              StorageService storage,
                              @Qualifier("presenterExecutor") TaskExecutor presenterExecutor,
                              @Value("${app.threshold.initial:1}") int initialThreshold) {
        this.pipeline = pipeline;
        this.cache = cache;
        this.codec = codec;
        this.renderer = renderer;
        this.storage = storage;
        this.presenterExecutor = presenterExecutor;
        this.initialThreshold = ThresholdValue.clamp(initialThreshold).value();
    }

    @PostConstruct
    void register() {
        pipeline.onResult(presenterExecutor, this::onOutcome);
    }

    // presenter executor only
    private void onOutcome(ThresholdOutcome outcome) {
        latest = outcome;
        if (outcome.isError()) {
            log.warn("Threshold {} failed on version {}: {}",
                    outcome.threshold(), outcome.sourceVersion(), outcome.error());
        } else {
            log.debug("Result ready for threshold {} (version {})", outcome.threshold(), outcome.sourceVersion());
        }
    }

    public ThresholdStatus load(InputStream in) throws IOException {
        PixelBuffer image = codec.decode(in);
        if (image.width() > MAX_IMAGE_SIDE || image.height() > MAX_IMAGE_SIDE) {
            throw new ImageFormatException("The image is too large. Maximum size: "
                    + MAX_IMAGE_SIDE + "x" + MAX_IMAGE_SIDE + " pixels");
        }
        imageWidth = image.width();
        imageHeight = image.height();
        long version = pipeline.loadImage(image);
        log.info("Loaded {}x{} image ({} channels) as version {}",
                image.width(), image.height(), image.channels(), version);
        if (pipeline.lastRequested().isEmpty()) {
            pipeline.requestThreshold(initialThreshold);
        }
        return status();
    }

    public ThresholdStatus requestThreshold(int value) {
        pipeline.requestThreshold(value);
        return status();
    }

    public ThresholdStatus status() {
        long version = pipeline.currentVersion();
        int requested = pipeline.lastRequested().map(ThresholdValue::value).orElse(0);
        ThresholdOutcome outcome = latest;
        boolean outcomeCurrent = outcome != null && outcome.sourceVersion() == version;
        int displayed = pipeline.currentResult().map(r -> r.threshold().value()).orElse(0);

        ThresholdStatus.State state;
        String error = null;
        if (imageWidth == 0 || pipeline.isShutdown()) {
            state = ThresholdStatus.State.EMPTY;
        } else if (outcomeCurrent && outcome.isError() && outcome.threshold() == requested) {
            state = ThresholdStatus.State.ERROR;
            error = outcome.error();
        } else if (displayed != 0 && displayed == requested) {
            state = ThresholdStatus.State.READY;
        } else {
            state = ThresholdStatus.State.PENDING;
        }
        return new ThresholdStatus(state, requested, displayed, version, imageWidth, imageHeight, error);
    }

    /** PNG of the current result scaled to fit {@code width x height}. */
    public byte[] renderPreview(int width, int height) {
        if (width <= 0 || height <= 0 || width > MAX_PREVIEW_SIDE || height > MAX_PREVIEW_SIDE) {
            throw new IllegalArgumentException("Preview size must be between 1 and " + MAX_PREVIEW_SIDE);
        }
        ProcessedResult result = pipeline.currentResult()
                .orElseThrow(() -> new NoImageException("No processed image to show yet"));
        DisplayKey key = new DisplayKey(width, height, result.threshold().value(), result.sourceVersion());
        BufferedImage scaled = cache.getDisplay(key).orElse(null);
        if (scaled == null) {
            scaled = renderer.render(result.buffer(), width, height);
            cache.putDisplay(key, scaled);
        } else {
            log.debug("Preview {}x{} at threshold {} served from cache", width, height, key.threshold());
        }
        return codec.encode(scaled, ImageCodec.Format.PNG);
    }

    /** Encodes the full-resolution current result and writes it to the output directory. */
    public StorageService.StoredFile save(String formatName) {
        ImageCodec.Format format = ImageCodec.Format.fromName(formatName);
        ProcessedResult result = pipeline.currentResult()
                .orElseThrow(() -> new NoImageException("No processed image to save."));
        byte[] encoded = codec.encode(result.buffer(), format);
        StorageService.StoredFile stored = storage.storeResultImage(encoded, format.extension());
        log.info("Saved threshold {} result as {}", result.threshold().value(), stored.filename());
        return stored;
    }
}
