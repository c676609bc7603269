package com.project.image.threshold.service;

import com.project.image.threshold.DTOs.PixelBuffer;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Scales a result to fit a display box while keeping its aspect ratio.
 */
@Component
public class DisplayRenderer {
    private static final Logger log = LoggerFactory.getLogger(DisplayRenderer.class);

    static {
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
        } catch (Exception e) {
            log.error("Failed to load OpenCV", e);
        }
    }

    private final ImageCodec codec;

    public DisplayRenderer(ImageCodec codec) {
        this.codec = codec;
    }

    public BufferedImage render(PixelBuffer buffer, int boxWidth, int boxHeight) {
        int[] size = fitWithin(buffer.width(), buffer.height(), boxWidth, boxHeight);
        if (size[0] == buffer.width() && size[1] == buffer.height()) {
            return codec.toBufferedImage(buffer);
        }
        int c = buffer.channels();
        Mat src = new Mat(buffer.height(), buffer.width(), CvType.CV_8UC(c));
        Mat dst = new Mat();
        try {
            src.put(0, 0, buffer.data());
            boolean shrinking = size[0] < buffer.width();
            Imgproc.resize(src, dst, new Size(size[0], size[1]), 0, 0,
                    shrinking ? Imgproc.INTER_AREA : Imgproc.INTER_LINEAR);

            byte[] scaled = new byte[size[0] * size[1] * c];
            dst.get(0, 0, scaled);
            log.debug("Scaled {}x{} to {}x{}", buffer.width(), buffer.height(), size[0], size[1]);
            return codec.toBufferedImage(PixelBuffer.wrap(size[1], size[0], c, scaled));
        } finally {
            src.release();
            dst.release();
        }
    }

    /**
     * Largest size with the image's aspect ratio that fits the box, never below 1x1.
     *
     * @return {width, height}
     */
    public static int[] fitWithin(int width, int height, int boxWidth, int boxHeight) {
        if (boxWidth <= 0 || boxHeight <= 0) {
            throw new IllegalArgumentException("Display size must be positive: " + boxWidth + "x" + boxHeight);
        }
        double scale = Math.min((double) boxWidth / width, (double) boxHeight / height);
        int w = Math.max(1, Math.min(boxWidth, (int) Math.round(width * scale)));
        int h = Math.max(1, Math.min(boxHeight, (int) Math.round(height * scale)));
        return new int[]{w, h};
    }
}
