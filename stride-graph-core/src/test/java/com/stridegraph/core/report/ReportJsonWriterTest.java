package com.stridegraph.core.report;

import com.stridegraph.core.TestDiagrams;
import com.stridegraph.core.config.AnalysisConfig;
import com.stridegraph.core.graph.ThreatGraph;
import com.stridegraph.core.graph.ThreatGraphBuilder;
import com.stridegraph.core.model.ThreatFinding;
import com.stridegraph.core.reasoning.StrideReasoner;
import com.stridegraph.core.rules.RuleTableLoader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReportJsonWriter}.
 */
class ReportJsonWriterTest {

    private static ComposedReport webShopReport() {
        ThreatGraph graph = ThreatGraphBuilder.buildThreatGraph(
            TestDiagrams.webShop(), TestDiagrams.IMAGE, AnalysisConfig.defaults());
        List<ThreatFinding> findings = new StrideReasoner(AnalysisConfig.defaults())
            .analyze(graph, RuleTableLoader.loadDefault());
        return new ReportComposer().composeReport("web-shop.png", graph, findings);
    }

    @Test
    void toJson_parsesBackToTheSameReport() {
        // Given
        ComposedReport composed = webShopReport();

        // When
        ThreatReport parsed = ReportJsonWriter.fromJson(composed.json());

        // Then
        assertThat(parsed).isEqualTo(composed.report());
    }

    @Test
    void toJson_andMarkdown_carryTheSameFindings() {
        ComposedReport composed = webShopReport();
        ThreatReport parsed = ReportJsonWriter.fromJson(composed.json());

        for (ThreatReport.SubjectBlock subject : parsed.subjects()) {
            assertThat(composed.markdown()).contains("### " + subject.heading());
            for (ThreatReport.FindingEntry finding : subject.findings()) {
                assertThat(composed.markdown()).contains(finding.description());
            }
        }
    }

    @Test
    void toJson_usesFixedPropertyOrderAndNewlines() {
        String json = webShopReport().json();

        assertThat(json).startsWith("{\n  \"title\"").endsWith("}\n").doesNotContain("\r");
        assertThat(json.indexOf("\"summary\"")).isLessThan(json.indexOf("\"components\""));
        assertThat(json.indexOf("\"components\"")).isLessThan(json.indexOf("\"relationships\""));
        assertThat(json.indexOf("\"subjects\"")).isLessThan(json.indexOf("\"diagnostics\""));
    }

    @Test
    void fromJson_invalidText_isRejected() {
        assertThatThrownBy(() -> ReportJsonWriter.fromJson("{ not json"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid threat report JSON");
    }
}
