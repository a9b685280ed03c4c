package com.stridegraph.cli;

import com.stridegraph.core.config.ConfigLoader;
import com.stridegraph.core.config.StrideConfig;
import com.stridegraph.core.engine.AnalysisRequest;
import com.stridegraph.core.engine.AnalysisResult;
import com.stridegraph.core.engine.ThreatModelingEngine;
import com.stridegraph.core.io.DetectionFileReader;
import com.stridegraph.core.output.OutputContext;
import com.stridegraph.core.output.ReportArtifact;
import com.stridegraph.core.output.ReportFormat;
import com.stridegraph.core.output.ReportOutput;
import com.stridegraph.core.output.ReportSink;
import com.stridegraph.core.output.ReportSinks;
import com.stridegraph.core.report.ThreatReport;
import com.stridegraph.core.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to analyze detection files and write threat reports.
 *
 * <p>Runs the full pipeline for every file:
 * <ol>
 *   <li>Load configuration and the rule table</li>
 *   <li>Read detection files</li>
 *   <li>Build threat graphs, resolve findings and compose reports (concurrently)</li>
 *   <li>Write {@code <source>-stride-report.md} and {@code .json} to the output directory</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * stridegraph analyze shop.json
 * stridegraph analyze *.json -o reports --format both --parallelism 4
 * stridegraph analyze shop.json --console --format markdown
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze detection files and write STRIDE threat reports",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", description = "Detection files (JSON)")
    private List<Path> files;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: stridegraph.yaml)")
    private Path configPath = Paths.get(ConfigSupport.DEFAULT_CONFIG);

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"--format"}, description = "Report format: markdown, json or both (overrides config)")
    private String format;

    @Option(names = {"--console"}, description = "Also print the reports to standard output")
    private boolean console;

    @Option(names = {"--parallelism"}, description = "Maximum number of files analyzed concurrently (default: ${DEFAULT-VALUE})",
        defaultValue = "4")
    private int parallelism;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            StrideConfig config = ConfigLoader.load(configPath);
            RuleTable ruleTable = ConfigSupport.ruleTable(config, configPath);
            out.println("✓ Loaded rule table " + ruleTable.version() + " (" + ruleTable.size() + " entries)");

            List<AnalysisRequest> requests = readRequests();
            out.println("✓ Read " + requests.size() + " detection file(s)");

            ThreatModelingEngine engine = new ThreatModelingEngine(config.analysis(), ruleTable);
            List<AnalysisResult> results = engine.analyzeAll(requests, parallelism);

            Set<ReportFormat> formats = resolveFormats(config);
            String directory = outputDir != null ? outputDir.toString() : config.output().directory();
            OutputContext context = new OutputContext(directory, Map.of("console.formats", "all"));
            List<ReportSink> sinks = resolveSinks();

            List<ReportOutput> outputs = new ArrayList<>(results.size());
            for (AnalysisResult result : results) {
                outputs.add(ReportOutput.of(result.source(), result.report(), formats));
            }
            requireDistinctFileNames(outputs);

            for (int i = 0; i < results.size(); i++) {
                for (ReportSink sink : sinks) {
                    sink.write(outputs.get(i), context);
                }
                printResult(out, results.get(i));
            }

            out.println();
            out.println("✓ Wrote reports to: " + directory);
            return 0;
        } catch (Exception e) {
            log.error("Analysis failed", e);
            err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private List<AnalysisRequest> readRequests() throws IOException {
        List<AnalysisRequest> requests = new ArrayList<>(files.size());
        for (Path file : files) {
            log.debug("Reading detection file: {}", file);
            requests.add(AnalysisRequest.from(DetectionFileReader.read(file)));
        }
        return requests;
    }

    private Set<ReportFormat> resolveFormats(StrideConfig config) {
        if (format != null) {
            if ("both".equalsIgnoreCase(format.trim())) {
                return EnumSet.allOf(ReportFormat.class);
            }
            return EnumSet.of(ReportFormat.fromName(format));
        }
        Set<ReportFormat> formats = EnumSet.noneOf(ReportFormat.class);
        for (String name : config.output().formats()) {
            formats.add(ReportFormat.fromName(name));
        }
        return formats;
    }

    private List<ReportSink> resolveSinks() {
        List<ReportSink> sinks = new ArrayList<>();
        sinks.add(ReportSinks.require("filesystem"));
        if (console) {
            sinks.add(ReportSinks.require("console"));
        }
        return sinks;
    }

    /**
     * Fails before anything is written when two diagrams map to the same report file.
     */
    private static void requireDistinctFileNames(List<ReportOutput> outputs) {
        Map<String, String> owners = new HashMap<>();
        for (ReportOutput output : outputs) {
            for (ReportArtifact artifact : output.artifacts()) {
                String previous = owners.putIfAbsent(artifact.fileName(), output.source());
                if (previous != null) {
                    throw new IllegalStateException("Report file " + artifact.fileName()
                        + " would be written for both " + previous + " and " + output.source()
                        + "; rename one of the diagrams or analyze them separately");
                }
            }
        }
    }

    private void printResult(PrintWriter out, AnalysisResult result) {
        ThreatReport.Summary summary = result.report().report().summary();
        out.println("✓ " + result.source() + ": "
            + summary.componentCount() + " components, "
            + summary.relationshipCount() + " relationships, "
            + summary.findingCount() + " findings (overall risk: " + summary.overallRisk() + ")");
    }
}
