package com.stridegraph.core.model;

/**
 * Display band for a numeric finding severity (0-10 scale).
 */
public enum SeverityLevel {
    /**
     * Critical - severity 8.0 and above.
     */
    CRITICAL("Critical", 8.0),

    /**
     * High - severity 6.0 and above.
     */
    HIGH("High", 6.0),

    /**
     * Medium - severity 4.0 and above.
     */
    MEDIUM("Medium", 4.0),

    /**
     * Low - anything below 4.0.
     */
    LOW("Low", 0.0);

    private final String displayName;
    private final double lowerBound;

    SeverityLevel(String displayName, double lowerBound) {
        this.displayName = displayName;
        this.lowerBound = lowerBound;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Maps a numeric severity to its band.
     *
     * @param severity numeric severity
     * @return matching level
     */
    public static SeverityLevel of(double severity) {
        for (SeverityLevel level : values()) {
            if (severity >= level.lowerBound) {
                return level;
            }
        }
        return LOW;
    }
}
