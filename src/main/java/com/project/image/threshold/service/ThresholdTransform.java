package com.project.image.threshold.service;

import com.project.image.threshold.DTOs.PixelBuffer;
import com.project.image.threshold.DTOs.ThresholdValue;
import com.project.image.threshold.exceptions.ShapeException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.stream.IntStream;

/**
 * Blackens every pixel whose darkest colour channel is strictly below the threshold.
 * Colour channels are the first three bytes of a pixel; alpha, when present, is never touched.
 * The input buffer is left as it is.
 */
@Component
public class ThresholdTransform {
    static final int DEFAULT_PARALLEL_MIN_PIXELS = 1 << 16;

    private final int parallelMinPixels;

    public ThresholdTransform() {
        this(DEFAULT_PARALLEL_MIN_PIXELS);
    }

    @Autowired
    public ThresholdTransform(@Value("${app.threshold.parallel-min-pixels:65536}") int parallelMinPixels) {
        this.parallelMinPixels = parallelMinPixels;
    }

    public PixelBuffer apply(PixelBuffer buffer, ThresholdValue threshold) {
        final int c = buffer.channels();
        if (c != 3 && c != 4) {
            throw new ShapeException("Unsupported channel count " + c + ", expected 3 (RGB) or 4 (RGBA)");
        }
        final int h = buffer.height();
        final int rowLength = buffer.width() * c;
        final int t = threshold.value();
        final byte[] out = buffer.data();

        IntStream rows = IntStream.range(0, h);
        if (buffer.pixelCount() >= parallelMinPixels) {
            rows = rows.parallel();
        }
        rows.forEach(row -> blackenRow(out, row * rowLength, rowLength, c, t));

        return PixelBuffer.wrap(h, buffer.width(), c, out);
    }

    private static void blackenRow(byte[] px, int start, int length, int channels, int threshold) {
        int end = start + length;
        for (int i = start; i < end; i += channels) {
            int r = px[i] & 0xFF, g = px[i + 1] & 0xFF, b = px[i + 2] & 0xFF;
            if (Math.min(r, Math.min(g, b)) < threshold) {
                px[i] = 0;
                px[i + 1] = 0;
                px[i + 2] = 0;
            }
        }
    }
}
