package com.project.image.threshold.DTOs;

/**
 * Presenter state as reported to the page.
 *
 * @param state              EMPTY, PENDING, READY or ERROR
 * @param requestedThreshold last value sent to the worker, 0 if none yet
 * @param displayedThreshold threshold of the result on display, 0 if none
 */
public record ThresholdStatus(
        State state,
        int requestedThreshold,
        int displayedThreshold,
        long sourceVersion,
        int width,
        int height,
        String error
) {
    public enum State { EMPTY, PENDING, READY, ERROR }
}
