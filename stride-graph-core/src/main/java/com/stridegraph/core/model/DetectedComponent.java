package com.stridegraph.core.model;

import java.util.Objects;

/**
 * A normalized, deduplicated diagram component.
 *
 * @param id stable identifier assigned by position ({@code C1}, {@code C2}, ...)
 * @param type resolved component type
 * @param label raw label of the detection that survived deduplication
 * @param boundingBox box normalized to the unit square
 * @param confidence detection confidence in [0,1]
 */
public record DetectedComponent(
    String id,
    ComponentType type,
    String label,
    BoundingBox boundingBox,
    double confidence
) {
    /**
     * Compact constructor with validation.
     */
    public DetectedComponent {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(boundingBox, "boundingBox must not be null");
        if (label == null || label.isBlank()) {
            label = type.displayName();
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
    }
}
