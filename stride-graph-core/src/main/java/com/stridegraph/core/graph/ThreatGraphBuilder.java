package com.stridegraph.core.graph;

import com.stridegraph.core.config.AnalysisConfig;
import com.stridegraph.core.model.ImageDimensions;
import com.stridegraph.core.model.RawDetection;
import com.stridegraph.core.model.Relationship;
import com.stridegraph.core.normalize.ComponentNormalizer;
import com.stridegraph.core.normalize.NormalizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link ThreatGraph} from raw detections: normalization followed by relationship
 * inference.
 *
 * <p>Stateless apart from the configuration; identical inputs always produce equal graphs.
 */
public class ThreatGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ThreatGraphBuilder.class);

    private ThreatGraphBuilder() {
        // Utility class
    }

    /**
     * Builds the threat graph for one image.
     *
     * @param detections raw detections from the vision model
     * @param dimensions pixel dimensions of the image
     * @param config analysis thresholds
     * @return immutable threat graph
     */
    public static ThreatGraph buildThreatGraph(List<RawDetection> detections, ImageDimensions dimensions,
                                               AnalysisConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        NormalizationResult normalized = new ComponentNormalizer(config).normalize(detections, dimensions);
        List<Relationship> relationships = new RelationshipInferencer(config).infer(normalized.components());

        ThreatGraph graph = new ThreatGraph(normalized.components(), relationships, normalized.diagnostics());
        log.info("Built threat graph: {} components, {} relationships, {} diagnostics",
            graph.nodes().size(), graph.edges().size(), graph.diagnostics().size());
        return graph;
    }
}
