package com.stridegraph.core.engine;

import com.stridegraph.core.config.AnalysisConfig;
import com.stridegraph.core.graph.ThreatGraph;
import com.stridegraph.core.graph.ThreatGraphBuilder;
import com.stridegraph.core.model.ImageDimensions;
import com.stridegraph.core.model.RawDetection;
import com.stridegraph.core.model.ThreatFinding;
import com.stridegraph.core.reasoning.StrideReasoner;
import com.stridegraph.core.report.ComposedReport;
import com.stridegraph.core.report.ReportComposer;
import com.stridegraph.core.rules.RuleTable;
import com.stridegraph.core.rules.RuleTableLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry point of the threat-modeling pipeline.
 *
 * <p>Runs detections through normalization, relationship inference, STRIDE reasoning and
 * report composition:
 * <pre>{@code
 * ThreatModelingEngine engine = ThreatModelingEngine.withDefaults();
 * ThreatGraph graph = engine.buildThreatGraph(detections, new ImageDimensions(1200, 800));
 * List<ThreatFinding> findings = engine.analyze(graph);
 * ComposedReport report = engine.composeReport("diagram.png", graph, findings);
 * }</pre>
 *
 * <p>An engine holds only immutable collaborators, so one instance may serve concurrent
 * runs. Each run owns its graph and findings.
 */
public class ThreatModelingEngine {

    private static final Logger log = LoggerFactory.getLogger(ThreatModelingEngine.class);

    private final AnalysisConfig config;
    private final RuleTable ruleTable;
    private final StrideReasoner reasoner;
    private final ReportComposer composer;

    public ThreatModelingEngine(AnalysisConfig config, RuleTable ruleTable) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.ruleTable = Objects.requireNonNull(ruleTable, "ruleTable must not be null");
        this.reasoner = new StrideReasoner(config);
        this.composer = new ReportComposer();
    }

    /**
     * Creates an engine with default thresholds and the bundled rule table.
     *
     * @return engine
     */
    public static ThreatModelingEngine withDefaults() {
        return new ThreatModelingEngine(AnalysisConfig.defaults(), RuleTableLoader.loadDefault());
    }

    public AnalysisConfig config() {
        return config;
    }

    public RuleTable ruleTable() {
        return ruleTable;
    }

    /**
     * Builds the threat graph for one image using this engine's configuration.
     *
     * @param detections raw detections
     * @param dimensions image dimensions
     * @return threat graph
     */
    public ThreatGraph buildThreatGraph(List<RawDetection> detections, ImageDimensions dimensions) {
        return ThreatGraphBuilder.buildThreatGraph(detections, dimensions, config);
    }

    /**
     * Resolves findings against this engine's rule table.
     *
     * @param graph threat graph
     * @return findings
     */
    public List<ThreatFinding> analyze(ThreatGraph graph) {
        return analyze(graph, ruleTable);
    }

    /**
     * Resolves findings against the given rule table.
     *
     * @param graph threat graph
     * @param table rule table
     * @return findings
     */
    public List<ThreatFinding> analyze(ThreatGraph graph, RuleTable table) {
        return reasoner.analyze(graph, table);
    }

    public ComposedReport composeReport(ThreatGraph graph, List<ThreatFinding> findings) {
        return composer.composeReport(graph, findings);
    }

    public ComposedReport composeReport(String sourceName, ThreatGraph graph, List<ThreatFinding> findings) {
        return composer.composeReport(sourceName, graph, findings);
    }

    /**
     * Runs the whole pipeline for one request.
     *
     * @param request analysis input
     * @return graph, findings and report
     */
    public AnalysisResult run(AnalysisRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        log.info("Analyzing {} ({} detections)", request.source(), request.detections().size());

        ThreatGraph graph = buildThreatGraph(request.detections(), request.dimensions());
        List<ThreatFinding> findings = analyze(graph);
        ComposedReport report = composeReport(request.source(), graph, findings);

        log.info("Analysis of {} complete: {} components, {} relationships, {} findings",
            request.source(), graph.nodes().size(), graph.edges().size(), findings.size());
        return new AnalysisResult(request.source(), graph, findings, report);
    }

    /**
     * Runs independent requests concurrently.
     *
     * @param requests analysis inputs
     * @param parallelism maximum number of concurrent runs
     * @return results in request order
     * @throws AnalysisException if any run fails; names the failing request
     */
    public List<AnalysisResult> analyzeAll(List<AnalysisRequest> requests, int parallelism) {
        Objects.requireNonNull(requests, "requests must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        if (requests.isEmpty()) {
            return List.of();
        }

        int threads = Math.min(parallelism, requests.size());
        log.debug("Analyzing {} requests on {} threads", requests.size(), threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<AnalysisResult>> futures = new ArrayList<>(requests.size());
            for (AnalysisRequest request : requests) {
                futures.add(pool.submit(() -> run(request)));
            }

            List<AnalysisResult> results = new ArrayList<>(requests.size());
            for (int i = 0; i < futures.size(); i++) {
                String source = requests.get(i).source();
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    throw new AnalysisException(source, e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new AnalysisException(source, e);
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }
}
