package com.stridegraph.core.model;

import java.util.Objects;

/**
 * Record of a detection that was skipped or merged during normalization.
 *
 * @param detectionIndex position of the detection in the input sequence
 * @param code reason code
 * @param message human-readable detail
 */
public record Diagnostic(
    int detectionIndex,
    DiagnosticCode code,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
