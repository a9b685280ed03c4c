package com.stridegraph.core.output;

import java.util.Locale;

/**
 * Report representations that can be written.
 */
public enum ReportFormat {
    MARKDOWN("md"),
    JSON("json");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Parses a format name as used in configuration ({@code markdown}, {@code md}, {@code json}).
     *
     * @param name format name
     * @return format
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ReportFormat fromName(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "markdown", "md" -> MARKDOWN;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unknown report format: " + name);
        };
    }
}
