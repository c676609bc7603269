package com.project.image.threshold.DTOs;

/**
 * What the result callback receives: either a successful {@link ProcessedResult}
 * or an error tagged with the threshold and image version of the failed pass.
 */
public record ThresholdOutcome(
        ProcessedResult result,
        int threshold,
        long sourceVersion,
        String error
) {
    public static ThresholdOutcome success(ProcessedResult result) {
        return new ThresholdOutcome(result, result.threshold().value(), result.sourceVersion(), null);
    }

    public static ThresholdOutcome failure(int threshold, long sourceVersion, String error) {
        return new ThresholdOutcome(null, threshold, sourceVersion, error);
    }

    public boolean isError() {
        return error != null;
    }
}
