package com.stridegraph.core.model;

/**
 * Kinds of relationships between detected components.
 */
public enum RelationshipKind {
    /** Logical communication inferred from spatial adjacency */
    COMMUNICATES_WITH
}
