package com.project.image.threshold.exceptions;

/** Base class for the domain errors raised by the threshold pipeline. */
public class ThresholdException extends RuntimeException {
    public ThresholdException(String message) { super(message); }
    public ThresholdException(String message, Throwable cause) { super(message, cause); }
}
