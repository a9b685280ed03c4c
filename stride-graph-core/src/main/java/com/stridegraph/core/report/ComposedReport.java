package com.stridegraph.core.report;

import java.util.Objects;

/**
 * The two representations of a composed report.
 *
 * @param markdown human-readable document
 * @param report structured record the document was rendered from
 */
public record ComposedReport(String markdown, ThreatReport report) {

    public ComposedReport {
        Objects.requireNonNull(markdown, "markdown must not be null");
        Objects.requireNonNull(report, "report must not be null");
    }

    /**
     * Renders the structured record as JSON.
     *
     * @return pretty-printed JSON
     */
    public String json() {
        return ReportJsonWriter.toJson(report);
    }
}
