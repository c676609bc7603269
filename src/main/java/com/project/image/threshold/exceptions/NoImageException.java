package com.project.image.threshold.exceptions;

public class NoImageException extends ThresholdException {
    public NoImageException(String message) { super(message); }
}
