package com.stridegraph.core.reasoning;

import com.stridegraph.core.config.AnalysisConfig;
import com.stridegraph.core.graph.ThreatGraph;
import com.stridegraph.core.model.DetectedComponent;
import com.stridegraph.core.model.Relationship;
import com.stridegraph.core.model.RuleEntry;
import com.stridegraph.core.model.RuleRole;
import com.stridegraph.core.model.StrideCategory;
import com.stridegraph.core.model.SubjectKind;
import com.stridegraph.core.model.ThreatFinding;
import com.stridegraph.core.rules.RuleTable;
import com.stridegraph.core.rules.TemplatePlaceholders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves STRIDE findings for every node and edge of a {@link ThreatGraph}.
 *
 * <p>Nodes receive one finding per {@link RuleRole#NODE} rule of their type. Edges receive
 * the union of the source's {@link RuleRole#EDGE_SOURCE} rules and the target's
 * {@link RuleRole#EDGE_TARGET} rules, at most one finding per category. For undirected
 * edges each endpoint is also tried in the opposite role.
 *
 * <p>Severity is the category's base weight scaled by the subject's confidence. The
 * reasoner is stateless apart from its configuration and performs no I/O.
 */
public class StrideReasoner {

    private static final Logger log = LoggerFactory.getLogger(StrideReasoner.class);

    private final AnalysisConfig config;

    public StrideReasoner(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Produces the findings for a graph.
     *
     * @param graph threat graph
     * @param ruleTable rule table to consult
     * @return findings: nodes in id order, then edges in edge order
     * @throws IllegalStateException if a template references a field that cannot be supplied
     */
    public List<ThreatFinding> analyze(ThreatGraph graph, RuleTable ruleTable) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(ruleTable, "ruleTable must not be null");

        List<ThreatFinding> findings = new ArrayList<>();
        for (DetectedComponent node : graph.nodes()) {
            analyzeNode(node, ruleTable, findings);
        }
        for (Relationship edge : graph.edges()) {
            analyzeEdge(graph, edge, ruleTable, findings);
        }

        log.debug("Resolved {} findings for {} nodes and {} edges using rule table {}",
            findings.size(), graph.nodes().size(), graph.edges().size(), ruleTable.version());
        return List.copyOf(findings);
    }

    private void analyzeNode(DetectedComponent node, RuleTable ruleTable, List<ThreatFinding> out) {
        Map<String, String> values = new HashMap<>();
        values.put(TemplatePlaceholders.ID, node.id());
        values.put(TemplatePlaceholders.TYPE, node.type().displayName());
        values.put(TemplatePlaceholders.LABEL, node.label());
        values.put(TemplatePlaceholders.CONFIDENCE, formatConfidence(node.confidence()));

        for (RuleEntry rule : ruleTable.lookup(node.type(), RuleRole.NODE)) {
            out.add(new ThreatFinding(
                SubjectKind.COMPONENT,
                node.id(),
                null,
                null,
                rule.category(),
                TemplateRenderer.render(rule.descriptionTemplate(), values),
                TemplateRenderer.render(rule.countermeasureTemplate(), values),
                config.baseSeverity(rule.category()) * node.confidence()
            ));
        }
    }

    private void analyzeEdge(ThreatGraph graph, Relationship edge, RuleTable ruleTable, List<ThreatFinding> out) {
        DetectedComponent source = graph.requireNode(edge.sourceId());
        DetectedComponent target = graph.requireNode(edge.targetId());

        // First matching row per category wins; insertion order is resolution order.
        Map<StrideCategory, ThreatFinding> byCategory = new EnumMap<>(StrideCategory.class);
        List<StrideCategory> order = new ArrayList<>();

        collect(edge, source, target, ruleTable.lookup(source.type(), RuleRole.EDGE_SOURCE), byCategory, order);
        collect(edge, source, target, ruleTable.lookup(target.type(), RuleRole.EDGE_TARGET), byCategory, order);
        if (!edge.directed()) {
            collect(edge, target, source, ruleTable.lookup(target.type(), RuleRole.EDGE_SOURCE), byCategory, order);
            collect(edge, target, source, ruleTable.lookup(source.type(), RuleRole.EDGE_TARGET), byCategory, order);
        }

        for (StrideCategory category : order) {
            out.add(byCategory.get(category));
        }
    }

    /**
     * Adds findings for rows not yet covered by category. {@code from} and {@code to} are the
     * endpoints in the roles the rows are being applied with.
     */
    private void collect(Relationship edge, DetectedComponent from, DetectedComponent to, List<RuleEntry> rules,
                         Map<StrideCategory, ThreatFinding> byCategory, List<StrideCategory> order) {
        if (rules.isEmpty()) {
            return;
        }
        Map<String, String> values = edgeValues(edge, from, to);
        for (RuleEntry rule : rules) {
            if (byCategory.containsKey(rule.category())) {
                continue;
            }
            byCategory.put(rule.category(), new ThreatFinding(
                SubjectKind.RELATIONSHIP,
                edge.id(),
                edge.sourceId(),
                edge.targetId(),
                rule.category(),
                TemplateRenderer.render(rule.descriptionTemplate(), values),
                TemplateRenderer.render(rule.countermeasureTemplate(), values),
                config.baseSeverity(rule.category()) * edge.confidence()
            ));
            order.add(rule.category());
        }
    }

    private static Map<String, String> edgeValues(Relationship edge, DetectedComponent from, DetectedComponent to) {
        Map<String, String> values = new HashMap<>();
        values.put(TemplatePlaceholders.ID, edge.id());
        values.put(TemplatePlaceholders.SOURCE, from.id());
        values.put(TemplatePlaceholders.TARGET, to.id());
        values.put(TemplatePlaceholders.SOURCE_TYPE, from.type().displayName());
        values.put(TemplatePlaceholders.TARGET_TYPE, to.type().displayName());
        values.put(TemplatePlaceholders.SOURCE_LABEL, from.label());
        values.put(TemplatePlaceholders.TARGET_LABEL, to.label());
        values.put(TemplatePlaceholders.CONFIDENCE, formatConfidence(edge.confidence()));
        return values;
    }

    private static String formatConfidence(double confidence) {
        return String.format(Locale.ROOT, "%.2f", confidence);
    }
}
