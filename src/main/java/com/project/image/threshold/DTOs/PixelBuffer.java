package com.project.image.threshold.DTOs;

import java.util.Arrays;
import java.util.zip.CRC32;

/**
 * Row-major 8-bit pixel data. Channel order is R, G, B for 3-channel buffers and
 * R, G, B, A for 4-channel buffers; the loader and the encoder both keep to it.
 * <p>
 * Instances are immutable: the constructor copies its input and {@link #data()} returns a copy.
 * Any positive channel count is accepted here, the transform decides which ones it supports.
 */
public final class PixelBuffer {
    private final int height;
    private final int width;
    private final int channels;
    private final byte[] data;

    public PixelBuffer(int height, int width, int channels, byte[] data) {
        this(height, width, channels, data, true);
    }

    private PixelBuffer(int height, int width, int channels, byte[] data, boolean copy) {
        if (height <= 0 || width <= 0 || channels <= 0) {
            throw new IllegalArgumentException(
                    "Invalid buffer shape " + height + "x" + width + "x" + channels);
        }
        if (data == null || (long) height * width * channels != data.length) {
            throw new IllegalArgumentException("Expected " + ((long) height * width * channels)
                    + " bytes for shape " + height + "x" + width + "x" + channels
                    + " but got " + (data == null ? "null" : data.length));
        }
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.data = copy ? data.clone() : data;
    }

    /**
     * Takes ownership of {@code data} without copying. The caller must not touch the array afterwards.
     */
    public static PixelBuffer wrap(int height, int width, int channels, byte[] data) {
        return new PixelBuffer(height, width, channels, data, false);
    }

    public int height() { return height; }
    public int width() { return width; }
    public int channels() { return channels; }

    public boolean hasAlpha() { return channels == 4; }

    public int pixelCount() { return height * width; }

    /** Copy of the raw bytes. */
    public byte[] data() { return data.clone(); }

    /** Unsigned value of one channel of one pixel. */
    public int get(int row, int col, int channel) {
        return data[(row * width + col) * channels + channel] & 0xFF;
    }

    public long checksum() {
        CRC32 crc = new CRC32();
        crc.update(data);
        return crc.getValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer other)) return false;
        return height == other.height && width == other.width
                && channels == other.channels && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = 31 * height + width;
        result = 31 * result + channels;
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + height + "x" + width + "x" + channels + "]";
    }
}
