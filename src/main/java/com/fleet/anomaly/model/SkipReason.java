package com.fleet.anomaly.model;

/**
 * Why a (unit[, feature]) scope was left out of a detection layer. None of these fail the run.
 */
public enum SkipReason {
    // Group at or below the layer's minimum sample size
    INSUFFICIENT_DATA,
    // MAD of zero, z-score undefined
    NUMERIC_DEGENERACY,
    // Isolation forest could not be fitted or applied for the unit
    MODEL_FIT_FAILURE
}
