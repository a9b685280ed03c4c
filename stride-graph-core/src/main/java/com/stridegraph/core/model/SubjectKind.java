package com.stridegraph.core.model;

/**
 * What a finding is attributed to.
 */
public enum SubjectKind {
    COMPONENT,
    RELATIONSHIP
}
