package com.stridegraph.core.model;

import java.util.Objects;

/**
 * One row of the STRIDE rule table.
 *
 * <p>Templates may reference placeholders such as {@code {id}} or {@code {source}}; the set
 * allowed depends on the {@link RuleRole} and is checked when the table is loaded.
 *
 * @param componentType component type the rule matches
 * @param role role of the component
 * @param category STRIDE category of the threat
 * @param descriptionTemplate threat description template
 * @param countermeasureTemplate countermeasure template
 */
public record RuleEntry(
    ComponentType componentType,
    RuleRole role,
    StrideCategory category,
    String descriptionTemplate,
    String countermeasureTemplate
) {
    /**
     * Compact constructor with validation.
     */
    public RuleEntry {
        Objects.requireNonNull(componentType, "componentType must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(descriptionTemplate, "descriptionTemplate must not be null");
        Objects.requireNonNull(countermeasureTemplate, "countermeasureTemplate must not be null");
    }
}
