package com.project.image.threshold.exceptions;

public class StorageException extends ThresholdException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
