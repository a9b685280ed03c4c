package com.stridegraph.core.model;

import java.util.Objects;

/**
 * Relationship between two detected components.
 *
 * <p>An undirected relationship is stored once, with the lower-ordered component as source.
 *
 * @param sourceId source component ID
 * @param targetId target component ID
 * @param kind relationship kind
 * @param confidence heuristic confidence in [0,1]
 * @param directed whether the direction was implied by the component types
 */
public record Relationship(
    String sourceId,
    String targetId,
    RelationshipKind kind,
    double confidence,
    boolean directed
) {
    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (sourceId.equals(targetId)) {
            throw new IllegalArgumentException("Self relationship is not allowed: " + sourceId);
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
    }

    /**
     * Returns the identifier used for findings attributed to this relationship.
     *
     * @return {@code source->target}
     */
    public String id() {
        return sourceId + "->" + targetId;
    }
}
