package com.stridegraph.core.engine;

import com.stridegraph.core.TestDiagrams;
import com.stridegraph.core.config.AnalysisConfig;
import com.stridegraph.core.graph.ThreatGraph;
import com.stridegraph.core.model.ImageDimensions;
import com.stridegraph.core.model.ThreatFinding;
import com.stridegraph.core.report.ComposedReport;
import com.stridegraph.core.rules.RuleTableLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ThreatModelingEngine}.
 */
class ThreatModelingEngineTest {

    private ThreatModelingEngine engine;

    @BeforeEach
    void setUp() {
        engine = ThreatModelingEngine.withDefaults();
    }

    @Test
    void pipeline_userAndApi_producesGraphFindingsAndReport() {
        // When
        ThreatGraph graph = engine.buildThreatGraph(TestDiagrams.userAndApi(), TestDiagrams.IMAGE);
        List<ThreatFinding> findings = engine.analyze(graph);
        ComposedReport report = engine.composeReport("pair.png", graph, findings);

        // Then
        assertThat(graph.nodes()).hasSize(2);
        assertThat(graph.edges()).hasSize(1);
        assertThat(findings).isNotEmpty();
        assertThat(report.report().summary().findingCount()).isEqualTo(findings.size());
        assertThat(report.markdown()).startsWith("# STRIDE Threat Report - pair.png");
    }

    @Test
    void run_matchesStepByStepPipeline() {
        AnalysisRequest request = new AnalysisRequest("shop.png", TestDiagrams.webShop(), TestDiagrams.IMAGE);

        AnalysisResult result = engine.run(request);

        ThreatGraph graph = engine.buildThreatGraph(TestDiagrams.webShop(), TestDiagrams.IMAGE);
        assertThat(result.source()).isEqualTo("shop.png");
        assertThat(result.graph()).isEqualTo(graph);
        assertThat(result.findings()).isEqualTo(engine.analyze(graph));
        assertThat(result.report().markdown())
            .isEqualTo(engine.composeReport("shop.png", graph, result.findings()).markdown());
    }

    @Test
    void run_emptyDetections_yieldsEmptyReport() {
        AnalysisResult result = engine.run(new AnalysisRequest("blank.png", List.of(), ImageDimensions.normalized()));

        assertThat(result.graph().isEmpty()).isTrue();
        assertThat(result.findings()).isEmpty();
        assertThat(result.report().markdown()).contains("No components were found.");
    }

    @Test
    void analyzeAll_returnsResultsInRequestOrder() {
        // Given
        List<AnalysisRequest> requests = List.of(
            new AnalysisRequest("a.png", TestDiagrams.webShop(), TestDiagrams.IMAGE),
            new AnalysisRequest("b.png", TestDiagrams.userAndApi(), TestDiagrams.IMAGE),
            new AnalysisRequest("c.png", List.of(), TestDiagrams.IMAGE)
        );

        // When
        List<AnalysisResult> results = engine.analyzeAll(requests, 3);

        // Then
        assertThat(results).extracting(AnalysisResult::source).containsExactly("a.png", "b.png", "c.png");
        assertThat(results.get(0).report().markdown()).isEqualTo(engine.run(requests.get(0)).report().markdown());
    }

    @Test
    void analyzeAll_runsRequestsConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        ThreatModelingEngine latched = new ThreatModelingEngine(AnalysisConfig.defaults(), RuleTableLoader.loadDefault()) {
            @Override
            public AnalysisResult run(AnalysisRequest request) {
                bothStarted.countDown();
                try {
                    if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("runs did not overlap");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return super.run(request);
            }
        };
        List<AnalysisRequest> requests = List.of(
            new AnalysisRequest("a.png", TestDiagrams.userAndApi(), TestDiagrams.IMAGE),
            new AnalysisRequest("b.png", TestDiagrams.userAndApi(), TestDiagrams.IMAGE)
        );

        List<AnalysisResult> results = latched.analyzeAll(requests, 2);

        assertThat(results).hasSize(2);
    }

    @Test
    void analyzeAll_failingRequest_isWrappedWithItsSource() {
        ThreatModelingEngine failing = new ThreatModelingEngine(AnalysisConfig.defaults(), RuleTableLoader.loadDefault()) {
            @Override
            public AnalysisResult run(AnalysisRequest request) {
                if (request.source().equals("bad.png")) {
                    throw new IllegalStateException("boom");
                }
                return super.run(request);
            }
        };
        List<AnalysisRequest> requests = List.of(
            new AnalysisRequest("good.png", TestDiagrams.userAndApi(), TestDiagrams.IMAGE),
            new AnalysisRequest("bad.png", TestDiagrams.userAndApi(), TestDiagrams.IMAGE)
        );

        assertThatThrownBy(() -> failing.analyzeAll(requests, 2))
            .isInstanceOf(AnalysisException.class)
            .hasMessageContaining("bad.png")
            .hasRootCauseMessage("boom")
            .satisfies(e -> assertThat(((AnalysisException) e).getSource()).isEqualTo("bad.png"));
    }

    @Test
    void analyzeAll_invalidParallelism_isRejected() {
        assertThatThrownBy(() -> engine.analyzeAll(List.of(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void analyzeAll_noRequests_returnsEmptyList() {
        assertThat(engine.analyzeAll(List.of(), 4)).isEmpty();
    }
}
