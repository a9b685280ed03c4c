package com.stridegraph.core.engine;

import com.stridegraph.core.graph.ThreatGraph;
import com.stridegraph.core.model.ThreatFinding;
import com.stridegraph.core.report.ComposedReport;

import java.util.List;
import java.util.Objects;

/**
 * Output of one analysis run.
 *
 * @param source name of the diagram
 * @param graph threat graph built from the detections
 * @param findings findings in reasoner order
 * @param report composed report
 */
public record AnalysisResult(
    String source,
    ThreatGraph graph,
    List<ThreatFinding> findings,
    ComposedReport report
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(report, "report must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
