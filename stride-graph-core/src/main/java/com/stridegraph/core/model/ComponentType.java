package com.stridegraph.core.model;

/**
 * Closed set of component types the engine reasons about.
 *
 * <p>Detection labels outside the known vocabulary map to {@link #UNKNOWN} rather than being
 * rejected, so every detection can still be analyzed.
 */
public enum ComponentType {
    /** Application, web or compute server */
    SERVER("Server"),

    /** Database or other persistent data store */
    DATABASE("Database"),

    /** Human user or client actor */
    USER("User"),

    /** Load balancer or traffic distributor */
    LOAD_BALANCER("Load Balancer"),

    /** API or API gateway */
    API("API"),

    /** Unknown or unclassified component */
    UNKNOWN("Unknown");

    private final String displayName;

    ComponentType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the human-readable name used in reports.
     *
     * @return display name
     */
    public String displayName() {
        return displayName;
    }
}
