package com.project.image.threshold.DTOs;

/** Output of one completed compute pass, tagged with the image version it was computed from. */
public record ProcessedResult(PixelBuffer buffer, ThresholdValue threshold, long sourceVersion) {}
