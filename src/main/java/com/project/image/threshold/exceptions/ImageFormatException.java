package com.project.image.threshold.exceptions;

/** Uploaded bytes that cannot be decoded, or an output format that cannot be written. */
public class ImageFormatException extends ThresholdException {
    public ImageFormatException(String message) { super(message); }
    public ImageFormatException(String message, Throwable cause) { super(message, cause); }
}
