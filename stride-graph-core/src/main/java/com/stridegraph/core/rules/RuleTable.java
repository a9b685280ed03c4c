package com.stridegraph.core.rules;

import com.stridegraph.core.model.ComponentType;
import com.stridegraph.core.model.RuleEntry;
import com.stridegraph.core.model.RuleRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, versioned mapping from (component type, role) to STRIDE rule entries.
 *
 * <p>The table is pure data: adding a component type or a threat means adding rows, never
 * changing the resolution logic. Validation happens once, in {@link #of(String, List)}:
 * <ul>
 *   <li>the version is present</li>
 *   <li>templates only use placeholders available to their role</li>
 *   <li>no row is duplicated</li>
 *   <li>every {@link ComponentType} has at least one {@link RuleRole#NODE} row</li>
 * </ul>
 *
 * <p>Lookups read an {@link EnumMap} index that is never modified after construction, so one
 * table can be shared by any number of concurrent analyses without locking.
 */
public final class RuleTable {

    private final String version;
    private final List<RuleEntry> entries;
    private final Map<ComponentType, Map<RuleRole, List<RuleEntry>>> index;

    private RuleTable(String version, List<RuleEntry> entries) {
        this.version = version;
        this.entries = List.copyOf(entries);

        Map<ComponentType, Map<RuleRole, List<RuleEntry>>> building = new EnumMap<>(ComponentType.class);
        for (RuleEntry entry : this.entries) {
            building.computeIfAbsent(entry.componentType(), k -> new EnumMap<>(RuleRole.class))
                .computeIfAbsent(entry.role(), k -> new ArrayList<>())
                .add(entry);
        }

        Map<ComponentType, Map<RuleRole, List<RuleEntry>>> frozen = new EnumMap<>(ComponentType.class);
        building.forEach((type, byRole) -> {
            Map<RuleRole, List<RuleEntry>> roles = new EnumMap<>(RuleRole.class);
            byRole.forEach((role, list) -> roles.put(role, List.copyOf(list)));
            frozen.put(type, Collections.unmodifiableMap(roles));
        });
        this.index = Collections.unmodifiableMap(frozen);
    }

    /**
     * Creates and validates a rule table.
     *
     * @param version table version
     * @param entries rule rows, in resolution order
     * @return validated table
     * @throws RuleTableException if validation fails
     */
    public static RuleTable of(String version, List<RuleEntry> entries) {
        if (version == null || version.isBlank()) {
            throw new RuleTableException("Rule table version is missing");
        }
        Objects.requireNonNull(entries, "entries must not be null");

        Set<String> seen = new HashSet<>();
        for (RuleEntry entry : entries) {
            if (entry == null) {
                throw new RuleTableException("Rule table contains a null entry");
            }
            checkPlaceholders(entry, entry.descriptionTemplate());
            checkPlaceholders(entry, entry.countermeasureTemplate());

            String key = entry.componentType() + "|" + entry.role() + "|" + entry.category()
                + "|" + entry.descriptionTemplate();
            if (!seen.add(key)) {
                throw new RuleTableException("Duplicate rule entry for " + entry.componentType() + "/"
                    + entry.role() + "/" + entry.category() + ": " + entry.descriptionTemplate());
            }
        }

        RuleTable table = new RuleTable(version.trim(), entries);
        List<ComponentType> uncovered = new ArrayList<>();
        for (ComponentType type : ComponentType.values()) {
            if (table.lookup(type, RuleRole.NODE).isEmpty()) {
                uncovered.add(type);
            }
        }
        if (!uncovered.isEmpty()) {
            throw new RuleTableException("Rule table " + version
                + " is incomplete: no NODE rules for component types " + uncovered);
        }
        return table;
    }

    /**
     * Returns the rows for a component type in a role, in table order.
     *
     * @param type component type
     * @param role role of the component
     * @return matching rows, possibly empty
     */
    public List<RuleEntry> lookup(ComponentType type, RuleRole role) {
        Map<RuleRole, List<RuleEntry>> byRole = index.get(type);
        if (byRole == null) {
            return List.of();
        }
        return byRole.getOrDefault(role, List.of());
    }

    public String version() {
        return version;
    }

    public List<RuleEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    private static void checkPlaceholders(RuleEntry entry, String template) {
        Set<String> allowed = TemplatePlaceholders.allowedFor(entry.role());
        for (String name : TemplatePlaceholders.referencedBy(template)) {
            if (!allowed.contains(name)) {
                throw new RuleTableException("Template for " + entry.componentType() + "/" + entry.role()
                    + "/" + entry.category() + " uses unknown placeholder {" + name + "}; allowed: "
                    + allowed.stream().sorted().toList());
            }
        }
    }

    @Override
    public String toString() {
        return "RuleTable[version=" + version + ", entries=" + entries.size() + "]";
    }
}
