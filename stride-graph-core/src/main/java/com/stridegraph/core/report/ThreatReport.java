package com.stridegraph.core.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.stridegraph.core.model.Diagnostic;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured threat report for one analyzed diagram.
 *
 * <p>This record is the machine-readable representation; the Markdown document is rendered
 * from it, so both always carry the same findings in the same order. Severities are rounded
 * to two decimals for presentation.
 *
 * @param title report title
 * @param source name of the analyzed diagram (may be null)
 * @param summary summary block
 * @param components identified components, in id order
 * @param relationships inferred data flows, in edge order
 * @param subjects per-subject finding groups: components first, then relationships
 * @param diagnostics detections that were skipped or merged
 */
@JsonPropertyOrder({"title", "source", "summary", "components", "relationships", "subjects", "diagnostics"})
public record ThreatReport(
    String title,
    String source,
    Summary summary,
    List<ComponentEntry> components,
    List<RelationshipEntry> relationships,
    List<SubjectBlock> subjects,
    List<Diagnostic> diagnostics
) {
    public ThreatReport {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        components = components == null ? List.of() : List.copyOf(components);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Report summary.
     *
     * @param componentCount number of components
     * @param relationshipCount number of relationships
     * @param findingCount number of findings
     * @param diagnosticCount number of skipped or merged detections
     * @param overallRisk level of the highest finding, or {@code None}
     * @param highestFinding most severe finding (null when there are none)
     * @param findingsByLevel finding count per severity level, most severe first
     * @param findingsByCategory finding count per STRIDE category, in STRIDE order
     * @param executiveSummary one-paragraph summary
     */
    @JsonPropertyOrder({"componentCount", "relationshipCount", "findingCount", "diagnosticCount",
        "overallRisk", "highestFinding", "findingsByLevel", "findingsByCategory", "executiveSummary"})
    public record Summary(
        int componentCount,
        int relationshipCount,
        int findingCount,
        int diagnosticCount,
        String overallRisk,
        FindingEntry highestFinding,
        Map<String, Integer> findingsByLevel,
        Map<String, Integer> findingsByCategory,
        String executiveSummary
    ) {}

    @JsonPropertyOrder({"id", "type", "label", "confidence", "x", "y", "width", "height", "findingCount"})
    public record ComponentEntry(
        String id,
        String type,
        String label,
        double confidence,
        double x,
        double y,
        double width,
        double height,
        int findingCount
    ) {}

    @JsonPropertyOrder({"id", "source", "target", "kind", "directed", "confidence", "findingCount"})
    public record RelationshipEntry(
        String id,
        String source,
        String target,
        String kind,
        boolean directed,
        double confidence,
        int findingCount
    ) {}

    /**
     * Findings of one subject, most severe first.
     *
     * @param subjectKind {@code COMPONENT} or {@code RELATIONSHIP}
     * @param subjectId component id or {@code source->target}
     * @param heading human-readable subject heading
     * @param findings ordered findings
     */
    @JsonPropertyOrder({"subjectKind", "subjectId", "heading", "findings"})
    public record SubjectBlock(
        String subjectKind,
        String subjectId,
        String heading,
        List<FindingEntry> findings
    ) {
        public SubjectBlock {
            findings = findings == null ? List.of() : List.copyOf(findings);
        }
    }

    @JsonPropertyOrder({"subjectKind", "subjectId", "category", "severity", "level", "description", "countermeasure"})
    public record FindingEntry(
        String subjectKind,
        String subjectId,
        String category,
        double severity,
        String level,
        String description,
        String countermeasure
    ) {}
}
