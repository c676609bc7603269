package com.project.image.threshold.DTOs;

public record ImageSnapshot(PixelBuffer buffer, long sourceVersion) {}
