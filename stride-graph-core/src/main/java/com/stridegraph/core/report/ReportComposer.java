package com.stridegraph.core.report;

import com.stridegraph.core.graph.ThreatGraph;
import com.stridegraph.core.model.DetectedComponent;
import com.stridegraph.core.model.Relationship;
import com.stridegraph.core.model.SeverityLevel;
import com.stridegraph.core.model.StrideCategory;
import com.stridegraph.core.model.SubjectKind;
import com.stridegraph.core.model.ThreatFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Orders and groups findings into a {@link ThreatReport} and renders its Markdown form.
 *
 * <p>Subjects appear in graph order: components by id, then relationships by edge order.
 * Within a subject findings are sorted by descending severity, then category name, then
 * description. The composer keeps no state between calls and output contains no timestamps,
 * so identical input always yields byte-identical documents.
 */
public class ReportComposer {

    private static final Logger log = LoggerFactory.getLogger(ReportComposer.class);

    /** Title used when no source name is given. */
    public static final String DEFAULT_TITLE = "STRIDE Threat Report";

    /** Overall risk when there are no findings. */
    public static final String NO_RISK = "None";

    static final Comparator<ThreatFinding> FINDING_ORDER = Comparator
        .comparingDouble(ThreatFinding::severity).reversed()
        .thenComparing(f -> f.category().displayName())
        .thenComparing(ThreatFinding::description);

    private final MarkdownReportRenderer renderer = new MarkdownReportRenderer();

    /**
     * Composes a report without a source name.
     *
     * @param graph analyzed graph
     * @param findings findings for the graph
     * @return Markdown document and structured record
     */
    public ComposedReport composeReport(ThreatGraph graph, List<ThreatFinding> findings) {
        return composeReport(null, graph, findings);
    }

    /**
     * Composes a report.
     *
     * @param sourceName name of the analyzed diagram, used in the title (may be null)
     * @param graph analyzed graph
     * @param findings findings for the graph
     * @return Markdown document and structured record
     * @throws IllegalArgumentException if a finding refers to a subject that is not in the graph
     */
    public ComposedReport composeReport(String sourceName, ThreatGraph graph, List<ThreatFinding> findings) {
        ThreatReport report = buildReport(sourceName, graph, findings);
        String markdown = renderer.render(report);
        log.debug("Composed report '{}' with {} subjects", report.title(), report.subjects().size());
        return new ComposedReport(markdown, report);
    }

    /**
     * Builds only the structured record.
     *
     * @param sourceName name of the analyzed diagram (may be null)
     * @param graph analyzed graph
     * @param findings findings for the graph
     * @return structured report
     */
    public ThreatReport buildReport(String sourceName, ThreatGraph graph, List<ThreatFinding> findings) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(findings, "findings must not be null");

        Map<String, List<ThreatFinding>> bySubject = groupBySubject(graph, findings);

        List<ThreatReport.SubjectBlock> subjects = new ArrayList<>();
        List<ThreatReport.ComponentEntry> components = new ArrayList<>();
        for (DetectedComponent node : graph.nodes()) {
            List<ThreatFinding> own = bySubject.getOrDefault(node.id(), List.of());
            components.add(new ThreatReport.ComponentEntry(
                node.id(),
                node.type().displayName(),
                node.label(),
                round(node.confidence()),
                round(node.boundingBox().x(), 4),
                round(node.boundingBox().y(), 4),
                round(node.boundingBox().width(), 4),
                round(node.boundingBox().height(), 4),
                own.size()
            ));
            subjects.add(block(SubjectKind.COMPONENT, node.id(), componentHeading(node), own));
        }

        List<ThreatReport.RelationshipEntry> relationships = new ArrayList<>();
        for (Relationship edge : graph.edges()) {
            List<ThreatFinding> own = bySubject.getOrDefault(edge.id(), List.of());
            relationships.add(new ThreatReport.RelationshipEntry(
                edge.id(),
                edge.sourceId(),
                edge.targetId(),
                edge.kind().name(),
                edge.directed(),
                round(edge.confidence()),
                own.size()
            ));
            subjects.add(block(SubjectKind.RELATIONSHIP, edge.id(), relationshipHeading(graph, edge), own));
        }

        ThreatReport.Summary summary = summarize(graph, findings, bySubject);
        String title = sourceName == null || sourceName.isBlank() ? DEFAULT_TITLE : DEFAULT_TITLE + " - " + sourceName;
        return new ThreatReport(title, sourceName, summary, components, relationships, subjects, graph.diagnostics());
    }

    private static Map<String, List<ThreatFinding>> groupBySubject(ThreatGraph graph, List<ThreatFinding> findings) {
        Set<String> edgeIds = graph.edges().stream().map(Relationship::id).collect(Collectors.toSet());
        Map<String, List<ThreatFinding>> bySubject = new HashMap<>();
        for (ThreatFinding finding : findings) {
            boolean known = finding.subjectKind() == SubjectKind.COMPONENT
                ? graph.node(finding.subjectId()).isPresent()
                : edgeIds.contains(finding.subjectId());
            if (!known) {
                throw new IllegalArgumentException("Finding refers to " + finding.subjectKind()
                    + " '" + finding.subjectId() + "' which is not part of the graph");
            }
            bySubject.computeIfAbsent(finding.subjectId(), k -> new ArrayList<>()).add(finding);
        }
        bySubject.values().forEach(list -> list.sort(FINDING_ORDER));
        return bySubject;
    }

    private static ThreatReport.SubjectBlock block(SubjectKind kind, String id, String heading,
                                                   List<ThreatFinding> findings) {
        List<ThreatReport.FindingEntry> entries = findings.stream()
            .map(ReportComposer::toEntry)
            .toList();
        return new ThreatReport.SubjectBlock(kind.name(), id, heading, entries);
    }

    private static ThreatReport.FindingEntry toEntry(ThreatFinding finding) {
        return new ThreatReport.FindingEntry(
            finding.subjectKind().name(),
            finding.subjectId(),
            finding.category().displayName(),
            round(finding.severity()),
            finding.level().displayName(),
            finding.description(),
            finding.countermeasure()
        );
    }

    private static ThreatReport.Summary summarize(ThreatGraph graph, List<ThreatFinding> findings,
                                                  Map<String, List<ThreatFinding>> bySubject) {
        List<String> subjectOrder = new ArrayList<>();
        graph.nodes().forEach(node -> subjectOrder.add(node.id()));
        graph.edges().forEach(edge -> subjectOrder.add(edge.id()));

        // Highest finding: first strictly greater severity in report order.
        ThreatFinding highest = null;
        for (String subjectId : subjectOrder) {
            for (ThreatFinding finding : bySubject.getOrDefault(subjectId, List.of())) {
                if (highest == null || finding.severity() > highest.severity()) {
                    highest = finding;
                }
            }
        }

        Map<String, Integer> byLevel = new LinkedHashMap<>();
        for (SeverityLevel level : SeverityLevel.values()) {
            byLevel.put(level.displayName(), 0);
        }
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        for (StrideCategory category : StrideCategory.values()) {
            byCategory.put(category.displayName(), 0);
        }
        for (ThreatFinding finding : findings) {
            byLevel.merge(finding.level().displayName(), 1, Integer::sum);
            byCategory.merge(finding.category().displayName(), 1, Integer::sum);
        }

        String overallRisk = highest == null ? NO_RISK : highest.level().displayName();
        String executive = executiveSummary(graph, findings.size(), highest, byLevel);

        return new ThreatReport.Summary(
            graph.nodes().size(),
            graph.edges().size(),
            findings.size(),
            graph.diagnostics().size(),
            overallRisk,
            highest == null ? null : toEntry(highest),
            byLevel,
            byCategory,
            executive
        );
    }

    private static String executiveSummary(ThreatGraph graph, int findingCount, ThreatFinding highest,
                                           Map<String, Integer> byLevel) {
        if (graph.nodes().isEmpty()) {
            return "No components were found. No threats were identified.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Analyzed ").append(plural(graph.nodes().size(), "component"))
            .append(" and ").append(plural(graph.edges().size(), "relationship"))
            .append(", identifying ").append(plural(findingCount, "potential threat")).append('.');
        if (highest == null) {
            sb.append(" No threats were identified.");
            return sb.toString();
        }
        sb.append(" The overall risk level is ").append(highest.level().displayName())
            .append("; the most severe finding is ").append(highest.category().displayName())
            .append(" on ").append(highest.subjectId()).append('.');
        int urgent = byLevel.get(SeverityLevel.CRITICAL.displayName()) + byLevel.get(SeverityLevel.HIGH.displayName());
        if (urgent > 0) {
            sb.append(' ').append(plural(urgent, "finding"))
                .append(urgent == 1 ? " is" : " are")
                .append(" rated Critical or High and should be addressed first.");
        }
        return sb.toString();
    }

    private static String componentHeading(DetectedComponent node) {
        return node.id() + " - " + node.type().displayName() + " (" + node.label() + ")";
    }

    private static String relationshipHeading(ThreatGraph graph, Relationship edge) {
        DetectedComponent source = graph.requireNode(edge.sourceId());
        DetectedComponent target = graph.requireNode(edge.targetId());
        String arrow = edge.directed() ? " -> " : " <-> ";
        return edge.id() + " - " + source.label() + arrow + target.label();
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }

    static double round(double value) {
        return round(value, 2);
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
