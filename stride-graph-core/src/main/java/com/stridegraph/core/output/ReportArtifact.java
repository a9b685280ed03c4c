package com.stridegraph.core.output;

import java.util.Objects;

/**
 * One rendered report file.
 *
 * @param fileName file name relative to the output directory (e.g. "diagram-stride-report.md")
 * @param content file content
 * @param format representation the content is in
 */
public record ReportArtifact(
    String fileName,
    String content,
    ReportFormat format
) {
    /**
     * Compact constructor with validation.
     */
    public ReportArtifact {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(format, "format must not be null");
    }
}
