package com.stridegraph.core.report;

import com.stridegraph.core.TestDiagrams;
import com.stridegraph.core.config.AnalysisConfig;
import com.stridegraph.core.graph.ThreatGraph;
import com.stridegraph.core.graph.ThreatGraphBuilder;
import com.stridegraph.core.model.ComponentType;
import com.stridegraph.core.model.DetectedComponent;
import com.stridegraph.core.model.StrideCategory;
import com.stridegraph.core.model.SubjectKind;
import com.stridegraph.core.model.ThreatFinding;
import com.stridegraph.core.reasoning.StrideReasoner;
import com.stridegraph.core.rules.RuleTableLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.stridegraph.core.TestDiagrams.component;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link ReportComposer}.
 */
class ReportComposerTest {

    private ReportComposer composer;
    private ThreatGraph graph;
    private List<ThreatFinding> findings;

    @BeforeEach
    void setUp() {
        composer = new ReportComposer();
        graph = ThreatGraphBuilder.buildThreatGraph(TestDiagrams.userAndApi(), TestDiagrams.IMAGE, AnalysisConfig.defaults());
        findings = new StrideReasoner(AnalysisConfig.defaults()).analyze(graph, RuleTableLoader.loadDefault());
    }

    @Test
    void composeReport_sameInput_isByteIdentical() {
        // When
        ComposedReport first = composer.composeReport("shop.png", graph, findings);
        ComposedReport second = new ReportComposer().composeReport("shop.png", graph, findings);

        // Then
        assertThat(second.markdown()).isEqualTo(first.markdown());
        assertThat(second.json()).isEqualTo(first.json());
    }

    @Test
    void composeReport_findingsWithinSubject_areSortedBySeverityDescending() {
        ThreatReport report = composer.composeReport(graph, findings).report();

        for (ThreatReport.SubjectBlock subject : report.subjects()) {
            List<ThreatReport.FindingEntry> entries = subject.findings();
            for (int i = 1; i < entries.size(); i++) {
                assertThat(entries.get(i).severity())
                    .as("severity order in %s", subject.subjectId())
                    .isLessThanOrEqualTo(entries.get(i - 1).severity());
            }
        }
    }

    @Test
    void composeReport_subjects_listComponentsBeforeRelationships() {
        ThreatReport report = composer.composeReport(graph, findings).report();

        assertThat(report.subjects())
            .extracting(ThreatReport.SubjectBlock::subjectId, ThreatReport.SubjectBlock::heading)
            .containsExactly(
                tuple("C1", "C1 - User (User)"),
                tuple("C2", "C2 - API (API)"),
                tuple("C1->C2", "C1->C2 - User -> API")
            );
    }

    @Test
    void composeReport_summary_countsAndHighestFinding() {
        // When
        ThreatReport.Summary summary = composer.composeReport(graph, findings).report().summary();

        // Then
        assertThat(summary.componentCount()).isEqualTo(2);
        assertThat(summary.relationshipCount()).isEqualTo(1);
        assertThat(summary.findingCount()).isEqualTo(findings.size()).isEqualTo(14);
        assertThat(summary.overallRisk()).isEqualTo("Critical");
        assertThat(summary.highestFinding().subjectId()).isEqualTo("C1");
        assertThat(summary.highestFinding().category()).isEqualTo(StrideCategory.ELEVATION_OF_PRIVILEGE.displayName());
        assertThat(summary.highestFinding().severity()).isEqualTo(9.0);
        assertThat(summary.findingsByCategory()).containsKeys("Spoofing", "Tampering", "Repudiation",
            "Information Disclosure", "Denial of Service", "Elevation of Privilege");
        assertThat(summary.findingsByLevel().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(14);
    }

    @Test
    void composeReport_severities_areRoundedToTwoDecimals() {
        ThreatReport report = composer.composeReport(graph, findings).report();

        assertThat(report.subjects())
            .flatExtracting(ThreatReport.SubjectBlock::findings)
            .allSatisfy(entry -> assertThat(BigDecimal.valueOf(entry.severity()).scale()).isLessThanOrEqualTo(2));
    }

    @Test
    void composeReport_markdown_containsAllSections() {
        String markdown = composer.composeReport("shop.png", graph, findings).markdown();

        assertThat(markdown)
            .startsWith("# STRIDE Threat Report - shop.png\n")
            .contains("## Summary")
            .contains("**Overall Risk:** Critical")
            .contains("## Identified Components")
            .contains("## Data Flows")
            .contains("```mermaid")
            .contains("C1 -->|5 threats| C2")
            .contains("## Threats by Component")
            .contains("### C1 - User (User)")
            .contains("## Threats by Data Flow")
            .contains("### C1->C2 - User -> API")
            .contains("No detections were skipped or merged.")
            .doesNotContain("\r");
    }

    @Test
    void composeReport_emptyGraph_producesWellFormedEmptyReport() {
        // When
        ComposedReport composed = composer.composeReport(ThreatGraph.empty(), List.of());

        // Then
        ThreatReport report = composed.report();
        assertThat(report.title()).isEqualTo(ReportComposer.DEFAULT_TITLE);
        assertThat(report.subjects()).isEmpty();
        assertThat(report.summary().componentCount()).isZero();
        assertThat(report.summary().relationshipCount()).isZero();
        assertThat(report.summary().findingCount()).isZero();
        assertThat(report.summary().overallRisk()).isEqualTo(ReportComposer.NO_RISK);
        assertThat(report.summary().highestFinding()).isNull();
        assertThat(composed.markdown())
            .contains("No components were found.")
            .contains("A[No components found]")
            .doesNotContain("## Threats by Component");
    }

    @Test
    void composeReport_componentWithoutFindings_stillGetsBlock() {
        DetectedComponent server = component("C1", ComponentType.SERVER, 0.4, 0.4, 0.8);
        ThreatGraph single = new ThreatGraph(List.of(server), List.of(), List.of());

        ComposedReport composed = composer.composeReport(single, List.of());

        assertThat(composed.report().subjects()).singleElement()
            .satisfies(block -> assertThat(block.findings()).isEmpty());
        assertThat(composed.report().summary().executiveSummary()).endsWith("No threats were identified.");
        assertThat(composed.markdown()).contains("### C1 - Server (Server)").contains("No threats identified.");
    }

    @Test
    void composeReport_findingForUnknownSubject_isRejected() {
        ThreatFinding stray = new ThreatFinding(SubjectKind.COMPONENT, "C9", null, null,
            StrideCategory.TAMPERING, "stray", "none", 1.0);

        assertThatThrownBy(() -> composer.composeReport(graph, List.of(stray)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("C9");
    }

    @Test
    void round_usesHalfUp() {
        assertThat(ReportComposer.round(6.315)).isEqualTo(6.32);
        assertThat(ReportComposer.round(6.3149)).isEqualTo(6.31);
    }
}
