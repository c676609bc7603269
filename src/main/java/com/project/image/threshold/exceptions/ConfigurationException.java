package com.project.image.threshold.exceptions;

/** A threshold outside [1,255]. Raised before the value reaches the worker. */
public class ConfigurationException extends ThresholdException {
    public ConfigurationException(String message) { super(message); }
}
