package com.stridegraph.core.graph;

import com.stridegraph.core.config.AnalysisConfig;
import com.stridegraph.core.model.DetectedComponent;
import com.stridegraph.core.model.Relationship;
import com.stridegraph.core.model.RelationshipKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Infers relationships between components from their positions in the diagram.
 *
 * <p>Diagrams carry no explicit connector information, so spatial adjacency stands in for
 * architectural adjacency. For each pair of components the center distance is divided by the
 * unit-square diagonal and turned into an inverse-distance score:
 *
 * <pre>
 * proximity = 1 / (1 + 4 * distance / sqrt(2))
 * </pre>
 *
 * <p>Pairs scoring above {@code proximityThreshold} are connected. Components one third of the
 * diagram apart score about 0.43-0.51 and connect under the default 0.4; components two
 * thirds apart score about 0.35 and do not.
 *
 * <p>Orientation comes from {@link FlowDirection}. Pairs without a canonical direction become
 * one undirected relationship with the lower-ordered component as source.
 */
public class RelationshipInferencer {

    private static final Logger log = LoggerFactory.getLogger(RelationshipInferencer.class);

    private static final double DIAGONAL = Math.sqrt(2.0);
    private static final double DISTANCE_SCALE = 4.0;

    private final AnalysisConfig config;

    public RelationshipInferencer(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Infers relationships for components already ordered by id.
     *
     * @param components normalized components
     * @return relationships ordered by (source ordinal, target ordinal)
     */
    public List<Relationship> infer(List<DetectedComponent> components) {
        Objects.requireNonNull(components, "components must not be null");
        if (components.size() < 2) {
            return List.of();
        }

        List<Relationship> relationships = new ArrayList<>();
        for (int i = 0; i < components.size(); i++) {
            for (int j = i + 1; j < components.size(); j++) {
                DetectedComponent first = components.get(i);
                DetectedComponent second = components.get(j);

                double score = proximity(first, second);
                if (score <= config.proximityThreshold()) {
                    continue;
                }

                Relationship relationship = orient(first, second, clamp(score));
                log.debug("Inferred {} {} (proximity {})",
                    relationship.directed() ? "directed" : "undirected", relationship.id(), score);
                relationships.add(relationship);
            }
        }
        return relationships;
    }

    /**
     * Computes the proximity score of two components.
     *
     * @param a first component
     * @param b second component
     * @return score in (0,1]; 1 when the centers coincide
     */
    public static double proximity(DetectedComponent a, DetectedComponent b) {
        double normalizedDistance = a.boundingBox().centerDistance(b.boundingBox()) / DIAGONAL;
        return 1.0 / (1.0 + DISTANCE_SCALE * normalizedDistance);
    }

    private static Relationship orient(DetectedComponent first, DetectedComponent second, double confidence) {
        if (FlowDirection.flowsTo(first.type(), second.type())) {
            return new Relationship(first.id(), second.id(), RelationshipKind.COMMUNICATES_WITH, confidence, true);
        }
        if (FlowDirection.flowsTo(second.type(), first.type())) {
            return new Relationship(second.id(), first.id(), RelationshipKind.COMMUNICATES_WITH, confidence, true);
        }
        return new Relationship(first.id(), second.id(), RelationshipKind.COMMUNICATES_WITH, confidence, false);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
