package com.project.image.threshold.DTOs;

/**
 * Key of a display-scaled render: target box, the threshold it was rendered at and the
 * version of the source image it came from.
 */
public record DisplayKey(int width, int height, int threshold, long sourceVersion) {}
