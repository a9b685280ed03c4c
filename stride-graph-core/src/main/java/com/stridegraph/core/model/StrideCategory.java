package com.stridegraph.core.model;

/**
 * The six STRIDE threat categories.
 */
public enum StrideCategory {
    /** Impersonating a user, component or service */
    SPOOFING("Spoofing", 'S'),

    /** Unauthorized modification of data in transit or at rest */
    TAMPERING("Tampering", 'T'),

    /** Actions that cannot be traced to their author */
    REPUDIATION("Repudiation", 'R'),

    /** Exposure of data to unauthorized parties */
    INFORMATION_DISCLOSURE("Information Disclosure", 'I'),

    /** Making a component unavailable */
    DENIAL_OF_SERVICE("Denial of Service", 'D'),

    /** Gaining permissions beyond those granted */
    ELEVATION_OF_PRIVILEGE("Elevation of Privilege", 'E');

    private final String displayName;
    private final char letter;

    StrideCategory(String displayName, char letter) {
        this.displayName = displayName;
        this.letter = letter;
    }

    public String displayName() {
        return displayName;
    }

    public char letter() {
        return letter;
    }
}
