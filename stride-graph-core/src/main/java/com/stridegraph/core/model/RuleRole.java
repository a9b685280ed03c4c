package com.stridegraph.core.model;

/**
 * Position of a component type a rule applies to.
 */
public enum RuleRole {
    /** The component itself */
    NODE,

    /** The component is the source of a relationship */
    EDGE_SOURCE,

    /** The component is the target of a relationship */
    EDGE_TARGET
}
