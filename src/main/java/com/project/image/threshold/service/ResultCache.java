package com.project.image.threshold.service;

import com.project.image.threshold.DTOs.DisplayKey;
import com.project.image.threshold.DTOs.ProcessedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Two-tier cache of rendered output.
 * <ul>
 *     <li>tier 1: full-resolution results keyed by threshold, valid for one source image version</li>
 *     <li>tier 2: display-scaled images keyed by target size, threshold and source image version</li>
 * </ul>
 * Tier 1 is dropped when the image is replaced; tier 2 also whenever the threshold changes.
 */
@Component
public class ResultCache {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final ClearAllCache<Integer, ProcessedResult> results;
    private final ClearAllCache<DisplayKey, BufferedImage> displays;

    public ResultCache(@Value("${app.threshold.cache-capacity:10}") int capacity) {
        this.results = new ClearAllCache<>(capacity);
        this.displays = new ClearAllCache<>(capacity);
        log.debug("Result cache capacity per tier: {}", capacity);
    }

    /** Cached result for {@code threshold}, only if it was computed against {@code sourceVersion}. */
    public Optional<ProcessedResult> getResult(int threshold, long sourceVersion) {
        ProcessedResult cached = results.get(threshold);
        if (cached == null || cached.sourceVersion() != sourceVersion) {
            return Optional.empty();
        }
        return Optional.of(cached);
    }

    public void putResult(ProcessedResult result) {
        results.put(result.threshold().value(), result);
    }

    public Optional<BufferedImage> getDisplay(DisplayKey key) {
        return Optional.ofNullable(displays.get(key));
    }

    public void putDisplay(DisplayKey key, BufferedImage image) {
        displays.put(key, image);
    }

    /** Image replaced: nothing cached so far is valid any more. */
    public void invalidateAll() {
        results.clear();
        displays.clear();
        log.debug("Result cache cleared");
    }

    public void invalidateDisplays() {
        displays.clear();
    }

    public int resultCount() {
        return results.size();
    }

    public int displayCount() {
        return displays.size();
    }
}
