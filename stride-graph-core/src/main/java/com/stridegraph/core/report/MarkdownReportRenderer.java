package com.stridegraph.core.report;

import com.stridegraph.core.model.Diagnostic;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link ThreatReport} as a Markdown document.
 *
 * <h2>Document Structure</h2>
 * <ul>
 *   <li><b>Summary:</b> counts, overall risk, highest finding, executive summary, risk matrix</li>
 *   <li><b>Components:</b> identified components table</li>
 *   <li><b>Data Flows:</b> inferred relationships table and a Mermaid graph</li>
 *   <li><b>Threats:</b> one block per component, then one per data flow</li>
 *   <li><b>Diagnostics:</b> detections that were skipped or merged</li>
 * </ul>
 *
 * <p>Only {@code \n} line endings and {@link Locale#ROOT} number formatting are used.
 */
class MarkdownReportRenderer {

    // Markdown formatting constants
    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";
    private static final String BOLD = "**";
    private static final String CODE = "`";
    private static final String PIPE = "|";
    private static final String SPACE = " ";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String BULLET = "- ";
    private static final String RULE = "---";

    // Section headers
    private static final String SUMMARY = "Summary";
    private static final String FINDINGS_BY_LEVEL = "Findings by Severity";
    private static final String FINDINGS_BY_CATEGORY = "Findings by STRIDE Category";
    private static final String COMPONENTS_SECTION = "Identified Components";
    private static final String DATA_FLOWS_SECTION = "Data Flows";
    private static final String THREAT_GRAPH = "Threat Graph";
    private static final String COMPONENT_THREATS = "Threats by Component";
    private static final String FLOW_THREATS = "Threats by Data Flow";
    private static final String DIAGNOSTICS_SECTION = "Diagnostics";

    // Table headers
    private static final String METRIC = "Metric";
    private static final String COUNT = "Count";
    private static final String LEVEL = "Level";
    private static final String CATEGORY = "Category";
    private static final String ID = "ID";
    private static final String TYPE = "Type";
    private static final String LABEL = "Label";
    private static final String CONFIDENCE = "Confidence";
    private static final String FINDINGS = "Findings";
    private static final String SOURCE = "Source";
    private static final String TARGET = "Target";
    private static final String DIRECTION = "Direction";
    private static final String SEVERITY = "Severity";
    private static final String DESCRIPTION = "Description";
    private static final String COUNTERMEASURE = "Countermeasure";

    // Labels and messages
    private static final String OVERALL_RISK_LABEL = "**Overall Risk:** ";
    private static final String HIGHEST_FINDING_LABEL = "**Highest Severity Finding:** ";
    private static final String DIRECTED = "Directed";
    private static final String UNDIRECTED = "Undirected";
    private static final String NO_COMPONENTS = "No components were found.";
    private static final String NO_RELATIONSHIPS = "No relationships were inferred.";
    private static final String NO_THREATS = "No threats identified.";
    private static final String NO_DIAGNOSTICS = "No detections were skipped or merged.";
    private static final String DISCLAIMER = "*This report was generated automatically from detected diagram components. "
        + "Findings are indicative and should be reviewed by a qualified security professional.*";

    // Mermaid
    private static final String MERMAID_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String GRAPH_LR = "graph LR\n";
    private static final String NO_COMPONENTS_NODE = "  A[No components found]\n";
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

    String render(ThreatReport report) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append(H1).append(report.title()).append(DOUBLE_NEWLINE);

        appendSummary(sb, report.summary());
        appendComponents(sb, report.components());
        appendDataFlows(sb, report);
        appendThreats(sb, report.subjects());
        appendDiagnostics(sb, report.diagnostics());

        sb.append(RULE).append(DOUBLE_NEWLINE).append(DISCLAIMER).append(NEWLINE);
        return sb.toString();
    }

    private void appendSummary(StringBuilder sb, ThreatReport.Summary summary) {
        sb.append(H2).append(SUMMARY).append(DOUBLE_NEWLINE);

        appendTableRow(sb, METRIC, COUNT);
        appendTableDivider(sb, 2);
        appendTableRow(sb, "Components", String.valueOf(summary.componentCount()));
        appendTableRow(sb, "Relationships", String.valueOf(summary.relationshipCount()));
        appendTableRow(sb, FINDINGS, String.valueOf(summary.findingCount()));
        appendTableRow(sb, DIAGNOSTICS_SECTION, String.valueOf(summary.diagnosticCount()));
        sb.append(NEWLINE);

        sb.append(OVERALL_RISK_LABEL).append(summary.overallRisk()).append(DOUBLE_NEWLINE);

        ThreatReport.FindingEntry highest = summary.highestFinding();
        if (highest != null) {
            sb.append(HIGHEST_FINDING_LABEL)
                .append(highest.category()).append(" on ").append(CODE).append(highest.subjectId()).append(CODE)
                .append(" (").append(formatScore(highest.severity())).append(", ").append(highest.level()).append(") - ")
                .append(escapeMarkdown(highest.description()))
                .append(DOUBLE_NEWLINE);
        }

        sb.append(summary.executiveSummary()).append(DOUBLE_NEWLINE);

        if (summary.findingCount() > 0) {
            sb.append(H3).append(FINDINGS_BY_LEVEL).append(DOUBLE_NEWLINE);
            appendCounts(sb, LEVEL, summary.findingsByLevel());
            sb.append(H3).append(FINDINGS_BY_CATEGORY).append(DOUBLE_NEWLINE);
            appendCounts(sb, CATEGORY, summary.findingsByCategory());
        }
    }

    private void appendCounts(StringBuilder sb, String header, Map<String, Integer> counts) {
        appendTableRow(sb, header, COUNT);
        appendTableDivider(sb, 2);
        counts.forEach((name, count) -> appendTableRow(sb, name, String.valueOf(count)));
        sb.append(NEWLINE);
    }

    private void appendComponents(StringBuilder sb, List<ThreatReport.ComponentEntry> components) {
        sb.append(H2).append(COMPONENTS_SECTION).append(DOUBLE_NEWLINE);
        if (components.isEmpty()) {
            sb.append(NO_COMPONENTS).append(DOUBLE_NEWLINE);
            return;
        }

        appendTableRow(sb, ID, TYPE, LABEL, CONFIDENCE, FINDINGS);
        appendTableDivider(sb, 5);
        for (ThreatReport.ComponentEntry component : components) {
            appendTableRow(sb,
                CODE + component.id() + CODE,
                component.type(),
                escapeMarkdown(component.label()),
                formatScore(component.confidence()),
                String.valueOf(component.findingCount())
            );
        }
        sb.append(NEWLINE);
    }

    private void appendDataFlows(StringBuilder sb, ThreatReport report) {
        sb.append(H2).append(DATA_FLOWS_SECTION).append(DOUBLE_NEWLINE);
        if (report.relationships().isEmpty()) {
            sb.append(NO_RELATIONSHIPS).append(DOUBLE_NEWLINE);
        } else {
            appendTableRow(sb, ID, SOURCE, TARGET, DIRECTION, CONFIDENCE, FINDINGS);
            appendTableDivider(sb, 6);
            for (ThreatReport.RelationshipEntry relationship : report.relationships()) {
                appendTableRow(sb,
                    CODE + relationship.id() + CODE,
                    relationship.source(),
                    relationship.target(),
                    relationship.directed() ? DIRECTED : UNDIRECTED,
                    formatScore(relationship.confidence()),
                    String.valueOf(relationship.findingCount())
                );
            }
            sb.append(NEWLINE);
        }

        sb.append(H3).append(THREAT_GRAPH).append(DOUBLE_NEWLINE);
        sb.append(MERMAID_START).append(GRAPH_LR);
        if (report.components().isEmpty()) {
            sb.append(NO_COMPONENTS_NODE);
        }
        for (ThreatReport.ComponentEntry component : report.components()) {
            sb.append("  ").append(mermaidNode(component)).append(NEWLINE);
        }
        for (ThreatReport.RelationshipEntry relationship : report.relationships()) {
            sb.append("  ").append(sanitizeId(relationship.source()))
                .append(relationship.directed() ? " -->" : " ---")
                .append(PIPE).append(relationship.findingCount()).append(relationship.findingCount() == 1 ? " threat" : " threats").append(PIPE)
                .append(SPACE).append(sanitizeId(relationship.target()))
                .append(NEWLINE);
        }
        sb.append(CODE_BLOCK_END).append(NEWLINE);
    }

    private void appendThreats(StringBuilder sb, List<ThreatReport.SubjectBlock> subjects) {
        String currentSection = null;
        for (ThreatReport.SubjectBlock subject : subjects) {
            String section = "COMPONENT".equals(subject.subjectKind()) ? COMPONENT_THREATS : FLOW_THREATS;
            if (!section.equals(currentSection)) {
                sb.append(H2).append(section).append(DOUBLE_NEWLINE);
                currentSection = section;
            }

            sb.append(H3).append(escapeMarkdown(subject.heading())).append(DOUBLE_NEWLINE);
            if (subject.findings().isEmpty()) {
                sb.append(NO_THREATS).append(DOUBLE_NEWLINE);
                continue;
            }

            appendTableRow(sb, CATEGORY, SEVERITY, LEVEL, DESCRIPTION, COUNTERMEASURE);
            appendTableDivider(sb, 5);
            for (ThreatReport.FindingEntry finding : subject.findings()) {
                appendTableRow(sb,
                    finding.category(),
                    formatScore(finding.severity()),
                    finding.level(),
                    escapeMarkdown(finding.description()),
                    escapeMarkdown(finding.countermeasure())
                );
            }
            sb.append(NEWLINE);
        }
    }

    private void appendDiagnostics(StringBuilder sb, List<Diagnostic> diagnostics) {
        sb.append(H2).append(DIAGNOSTICS_SECTION).append(DOUBLE_NEWLINE);
        if (diagnostics.isEmpty()) {
            sb.append(NO_DIAGNOSTICS).append(DOUBLE_NEWLINE);
            return;
        }
        for (Diagnostic diagnostic : diagnostics) {
            sb.append(BULLET).append(BOLD).append("Detection #").append(diagnostic.detectionIndex()).append(BOLD)
                .append(SPACE).append(CODE).append(diagnostic.code().name()).append(CODE)
                .append(": ").append(escapeMarkdown(diagnostic.message()))
                .append(NEWLINE);
        }
        sb.append(NEWLINE);
    }

    private String mermaidNode(ThreatReport.ComponentEntry component) {
        String id = sanitizeId(component.id());
        String text = "\"" + escapeMermaid(component.type() + ": " + component.label()) + "\"";
        return switch (component.type()) {
            case "Database" -> id + "[(" + text + ")]";
            case "User" -> id + "([" + text + "])";
            default -> id + "[" + text + "]";
        };
    }

    private String formatScore(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /**
     * Escapes markdown special characters.
     */
    private String escapeMarkdown(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }

    private String escapeMermaid(String text) {
        return text.replace("\"", "'").replace("\n", " ");
    }

    private String sanitizeId(String id) {
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    private void appendTableRow(StringBuilder sb, String... columns) {
        sb.append(PIPE);
        for (String col : columns) {
            sb.append(SPACE).append(col).append(SPACE).append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private void appendTableDivider(StringBuilder sb, int columnCount) {
        sb.append(PIPE);
        for (int i = 0; i < columnCount; i++) {
            sb.append("--------|");
        }
        sb.append(NEWLINE);
    }
}
