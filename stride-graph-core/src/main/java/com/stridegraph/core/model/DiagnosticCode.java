package com.stridegraph.core.model;

/**
 * Reasons a raw detection did not become a component on its own.
 */
public enum DiagnosticCode {
    /** Confidence below the configured threshold */
    LOW_CONFIDENCE,

    /** Confidence missing, NaN or outside [0,1] */
    INVALID_CONFIDENCE,

    /** Bounding box missing, non-finite, empty or outside the image */
    MALFORMED_BOX,

    /** Merged into an overlapping higher-confidence detection */
    MERGED_DUPLICATE
}
