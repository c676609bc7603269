package com.project.image.threshold.service;

import com.project.image.threshold.DTOs.PixelBuffer;
import com.project.image.threshold.exceptions.ImageFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import javax.imageio.ImageIO;

/**
 * Converts between encoded image files and {@link PixelBuffer}s.
 * Images with an alpha channel become RGBA buffers, everything else RGB.
 */
@Component
public class ImageCodec {
    private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

    public enum Format {
        PNG("png", "png", true),
        JPEG("jpeg", "jpg", false),
        BMP("bmp", "bmp", false),
        TIFF("tiff", "tiff", true);

        private final String writerName;
        private final String extension;
        private final boolean supportsAlpha;

        Format(String writerName, String extension, boolean supportsAlpha) {
            this.writerName = writerName;
            this.extension = extension;
            this.supportsAlpha = supportsAlpha;
        }

        public String extension() { return extension; }
        public boolean supportsAlpha() { return supportsAlpha; }

        /** Parses an explicitly chosen format name. */
        public static Format fromName(String name) {
            if (name == null || name.isBlank()) {
                return PNG;
            }
            return switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "png" -> PNG;
                case "jpg", "jpeg" -> JPEG;
                case "bmp" -> BMP;
                case "tif", "tiff" -> TIFF;
                default -> throw new ImageFormatException("Unsupported output format: " + name
                        + ". Supported formats: png, jpeg, bmp, tiff");
            };
        }
    }

    public PixelBuffer decode(InputStream in) throws IOException {
        BufferedImage image = ImageIO.read(in);
        if (image == null) {
            throw new ImageFormatException("The file is not a valid image or is corrupted.");
        }
        return fromBufferedImage(image);
    }

    public PixelBuffer fromBufferedImage(BufferedImage image) {
        final int w = image.getWidth(), h = image.getHeight();
        final boolean alpha = image.getColorModel().hasAlpha();
        final int c = alpha ? 4 : 3;

        int[] argb = new int[w * h];
        image.getRGB(0, 0, w, h, argb, 0, w);

        byte[] data = new byte[w * h * c];
        for (int i = 0, o = 0; i < argb.length; i++, o += c) {
            int p = argb[i];
            data[o] = (byte) (p >> 16);
            data[o + 1] = (byte) (p >> 8);
            data[o + 2] = (byte) p;
            if (alpha) {
                data[o + 3] = (byte) (p >>> 24);
            }
        }
        log.debug("Decoded {}x{} image into {} channels", w, h, c);
        return PixelBuffer.wrap(h, w, c, data);
    }

    public BufferedImage toBufferedImage(PixelBuffer buffer) {
        return toBufferedImage(buffer, buffer.hasAlpha());
    }

    private BufferedImage toBufferedImage(PixelBuffer buffer, boolean keepAlpha) {
        final int w = buffer.width(), h = buffer.height(), c = buffer.channels();
        if (c != 3 && c != 4) {
            throw new ImageFormatException("Cannot render a " + c + "-channel buffer");
        }
        final boolean alpha = keepAlpha && c == 4;
        byte[] data = buffer.data();
        int[] argb = new int[w * h];
        for (int i = 0, o = 0; i < argb.length; i++, o += c) {
            int a = alpha ? data[o + 3] & 0xFF : 0xFF;
            argb[i] = (a << 24) | ((data[o] & 0xFF) << 16) | ((data[o + 1] & 0xFF) << 8) | (data[o + 2] & 0xFF);
        }
        BufferedImage image = new BufferedImage(w, h, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, w, h, argb, 0, w);
        return image;
    }

    public byte[] encode(PixelBuffer buffer, Format format) {
        return encode(toBufferedImage(buffer, format.supportsAlpha()), format);
    }

    public byte[] encode(BufferedImage image, Format format) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, format.writerName, baos)) {
                throw new ImageFormatException("No image writer available for " + format);
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new ImageFormatException("Failed to encode image as " + format, e);
        }
    }
}
