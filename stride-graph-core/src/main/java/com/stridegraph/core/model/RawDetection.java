package com.stridegraph.core.model;

/**
 * A single untrusted output of the external vision model.
 *
 * <p>No field is validated here: malformed values are expected and handled by the
 * normalizer, which records a {@link Diagnostic} instead of failing the run.
 *
 * @param label detected class label (free text, may be null)
 * @param confidence model confidence
 * @param box bounding box, usually in pixel coordinates (may be null)
 */
public record RawDetection(
    String label,
    double confidence,
    BoundingBox box
) {

    /**
     * Converts a normalized component back into a unit-space detection.
     *
     * @param component normalized component
     * @return detection carrying the component's label, confidence and unit-space box
     */
    public static RawDetection fromComponent(DetectedComponent component) {
        return new RawDetection(component.label(), component.confidence(), component.boundingBox());
    }
}
