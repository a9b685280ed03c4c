package com.stridegraph.core.normalize;

import com.stridegraph.core.model.DetectedComponent;
import com.stridegraph.core.model.Diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * Output of the {@link ComponentNormalizer}.
 *
 * @param components normalized components ordered by id
 * @param diagnostics skipped or merged detections, in input order
 */
public record NormalizationResult(
    List<DetectedComponent> components,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public NormalizationResult {
        Objects.requireNonNull(components, "components must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        components = List.copyOf(components);
        diagnostics = List.copyOf(diagnostics);
    }
}
