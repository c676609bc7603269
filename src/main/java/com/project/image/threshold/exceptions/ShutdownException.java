package com.project.image.threshold.exceptions;

/** The pipeline has been shut down and does not accept further work. */
public class ShutdownException extends ThresholdException {
    public ShutdownException(String message) { super(message); }
}
