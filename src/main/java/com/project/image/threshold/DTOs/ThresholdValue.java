package com.project.image.threshold.DTOs;

import com.project.image.threshold.exceptions.ConfigurationException;

/** A threshold in [1,255]. Pixels whose darkest colour channel is below it get blackened. */
public record ThresholdValue(int value) {
    public static final int MIN = 1;
    public static final int MAX = 255;

    public ThresholdValue {
        if (value < MIN || value > MAX) {
            throw new ConfigurationException(
                    "Threshold must be between " + MIN + " and " + MAX + " (received: " + value + ")");
        }
    }

    public static ThresholdValue of(int value) {
        return new ThresholdValue(value);
    }

    /** Clamps raw user input into range instead of rejecting it. */
    public static ThresholdValue clamp(int value) {
        return new ThresholdValue(Math.max(MIN, Math.min(MAX, value)));
    }
}
