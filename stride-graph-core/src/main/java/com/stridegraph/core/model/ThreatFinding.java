package com.stridegraph.core.model;

import java.util.Objects;

/**
 * A STRIDE threat attributed to a component or a relationship.
 *
 * @param subjectKind component or relationship
 * @param subjectId component ID, or {@code source->target} for relationships
 * @param sourceId relationship source ID (null for components)
 * @param targetId relationship target ID (null for components)
 * @param category STRIDE category
 * @param description rendered threat description
 * @param countermeasure rendered countermeasure
 * @param severity base category weight times subject confidence
 */
public record ThreatFinding(
    SubjectKind subjectKind,
    String subjectId,
    String sourceId,
    String targetId,
    StrideCategory category,
    String description,
    String countermeasure,
    double severity
) {
    /**
     * Compact constructor with validation.
     */
    public ThreatFinding {
        Objects.requireNonNull(subjectKind, "subjectKind must not be null");
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(countermeasure, "countermeasure must not be null");
        if (subjectKind == SubjectKind.RELATIONSHIP && (sourceId == null || targetId == null)) {
            throw new IllegalArgumentException("Relationship findings require sourceId and targetId");
        }
        if (severity < 0.0 || Double.isNaN(severity)) {
            throw new IllegalArgumentException("severity must be non-negative, got " + severity);
        }
    }

    /**
     * Returns the display band for this finding's severity.
     *
     * @return severity level
     */
    public SeverityLevel level() {
        return SeverityLevel.of(severity);
    }
}
