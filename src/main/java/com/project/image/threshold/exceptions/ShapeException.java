package com.project.image.threshold.exceptions;

/** Pixel buffer with a channel count other than 3 or 4. */
public class ShapeException extends ThresholdException {
    public ShapeException(String message) { super(message); }
}
