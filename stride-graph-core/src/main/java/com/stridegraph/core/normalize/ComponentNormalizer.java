package com.stridegraph.core.normalize;

import com.stridegraph.core.config.AnalysisConfig;
import com.stridegraph.core.model.BoundingBox;
import com.stridegraph.core.model.ComponentType;
import com.stridegraph.core.model.DetectedComponent;
import com.stridegraph.core.model.Diagnostic;
import com.stridegraph.core.model.DiagnosticCode;
import com.stridegraph.core.model.ImageDimensions;
import com.stridegraph.core.model.RawDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns raw, noisy detections into canonical {@link DetectedComponent}s.
 *
 * <p>Processing steps:
 * <ol>
 *   <li>Validate confidence and bounding box; skip malformed detections with a diagnostic</li>
 *   <li>Drop detections below the confidence threshold</li>
 *   <li>Normalize boxes to the unit square using the image dimensions</li>
 *   <li>Map labels to {@link ComponentType} via {@link LabelMapper}</li>
 *   <li>Merge detections whose IoU exceeds the threshold, keeping the most confident</li>
 *   <li>Assign ids {@code C1..Cn} by ascending (x, y)</li>
 * </ol>
 *
 * <p>The result depends only on the multiset of detections, never on their arrival order.
 * Normalizing the output again (see {@link RawDetection#fromComponent}) yields the same
 * components.
 */
public class ComponentNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ComponentNormalizer.class);

    /** Slack for floating point error when checking a box against the unit square */
    static final double BOUNDS_TOLERANCE = 1e-6;

    private static final String ID_PREFIX = "C";

    /** Highest confidence first; geometry and label break ties. */
    private static final Comparator<Candidate> MERGE_ORDER = Comparator
        .comparingDouble((Candidate c) -> c.confidence).reversed()
        .thenComparingDouble(c -> c.box.x())
        .thenComparingDouble(c -> c.box.y())
        .thenComparingDouble(c -> c.box.width())
        .thenComparingDouble(c -> c.box.height())
        .thenComparing(c -> c.label);

    private static final Comparator<Candidate> ID_ORDER = Comparator
        .comparingDouble((Candidate c) -> c.box.x())
        .thenComparingDouble(c -> c.box.y())
        .thenComparingDouble(c -> c.box.width())
        .thenComparingDouble(c -> c.box.height())
        .thenComparing(c -> c.type)
        .thenComparing(Comparator.comparingDouble((Candidate c) -> c.confidence).reversed())
        .thenComparing(c -> c.label);

    private final AnalysisConfig config;
    private final LabelMapper labelMapper;

    public ComponentNormalizer(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.labelMapper = new LabelMapper(config.labelAliases());
    }

    /**
     * Normalizes a detection sequence.
     *
     * @param detections raw detections in any order
     * @param dimensions image dimensions the boxes are expressed in
     * @return normalized components and diagnostics
     */
    public NormalizationResult normalize(List<RawDetection> detections, ImageDimensions dimensions) {
        Objects.requireNonNull(detections, "detections must not be null");
        Objects.requireNonNull(dimensions, "dimensions must not be null");

        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Candidate> candidates = new ArrayList<>();

        for (int i = 0; i < detections.size(); i++) {
            Candidate candidate = toCandidate(i, detections.get(i), dimensions, diagnostics);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }

        List<Candidate> kept = deduplicate(candidates, diagnostics);
        kept.sort(ID_ORDER);

        List<DetectedComponent> components = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            Candidate c = kept.get(i);
            components.add(new DetectedComponent(ID_PREFIX + (i + 1), c.type, c.label, c.box, c.confidence));
        }

        diagnostics.sort(Comparator.comparingInt(Diagnostic::detectionIndex));
        log.debug("Normalized {} detections into {} components ({} diagnostics)",
            detections.size(), components.size(), diagnostics.size());
        return new NormalizationResult(components, diagnostics);
    }

    /**
     * Validates one detection and converts it to unit space.
     *
     * @return candidate, or null when the detection is skipped
     */
    private Candidate toCandidate(int index, RawDetection detection, ImageDimensions dimensions,
                                  List<Diagnostic> diagnostics) {
        if (detection == null) {
            skip(index, DiagnosticCode.MALFORMED_BOX, "Detection is null", diagnostics);
            return null;
        }

        double confidence = detection.confidence();
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            skip(index, DiagnosticCode.INVALID_CONFIDENCE,
                "Confidence " + confidence + " is outside [0,1]", diagnostics);
            return null;
        }

        BoundingBox raw = detection.box();
        if (raw == null || !raw.isFinite()) {
            skip(index, DiagnosticCode.MALFORMED_BOX, "Bounding box is missing or not finite", diagnostics);
            return null;
        }
        if (raw.width() <= 0.0 || raw.height() <= 0.0) {
            skip(index, DiagnosticCode.MALFORMED_BOX,
                "Bounding box has non-positive size " + raw.width() + "x" + raw.height(), diagnostics);
            return null;
        }

        BoundingBox box = raw.scale(1.0 / dimensions.width(), 1.0 / dimensions.height());
        if (!insideUnitSquare(box)) {
            skip(index, DiagnosticCode.MALFORMED_BOX,
                "Bounding box " + describe(box) + " lies outside the image", diagnostics);
            return null;
        }

        if (confidence < config.confidenceThreshold()) {
            diagnostics.add(new Diagnostic(index, DiagnosticCode.LOW_CONFIDENCE,
                "Confidence " + confidence + " is below threshold " + config.confidenceThreshold()));
            log.debug("Dropping detection {} ('{}'): confidence {} below threshold",
                index, detection.label(), confidence);
            return null;
        }

        String label = detection.label() == null ? "" : detection.label().trim();
        return new Candidate(index, label, labelMapper.map(label), box, confidence);
    }

    /**
     * Greedy merge by descending confidence.
     */
    private List<Candidate> deduplicate(List<Candidate> candidates, List<Diagnostic> diagnostics) {
        List<Candidate> ordered = new ArrayList<>(candidates);
        ordered.sort(MERGE_ORDER);

        List<Candidate> kept = new ArrayList<>();
        for (Candidate candidate : ordered) {
            Candidate duplicateOf = null;
            for (Candidate existing : kept) {
                if (existing.box.intersectionOverUnion(candidate.box) > config.iouThreshold()) {
                    duplicateOf = existing;
                    break;
                }
            }

            if (duplicateOf == null) {
                kept.add(candidate);
            } else {
                diagnostics.add(new Diagnostic(candidate.index, DiagnosticCode.MERGED_DUPLICATE,
                    "Merged '" + candidate.label + "' into detection " + duplicateOf.index
                        + " ('" + duplicateOf.label + "')"));
                log.debug("Merged detection {} into {} (IoU {})", candidate.index, duplicateOf.index,
                    duplicateOf.box.intersectionOverUnion(candidate.box));
            }
        }
        return kept;
    }

    private void skip(int index, DiagnosticCode code, String message, List<Diagnostic> diagnostics) {
        log.warn("Skipping detection {}: {}", index, message);
        diagnostics.add(new Diagnostic(index, code, message));
    }

    private static boolean insideUnitSquare(BoundingBox box) {
        return box.x() >= -BOUNDS_TOLERANCE
            && box.y() >= -BOUNDS_TOLERANCE
            && box.x() + box.width() <= 1.0 + BOUNDS_TOLERANCE
            && box.y() + box.height() <= 1.0 + BOUNDS_TOLERANCE;
    }

    private static String describe(BoundingBox box) {
        return String.format(Locale.ROOT, "[x=%.3f, y=%.3f, w=%.3f, h=%.3f]",
            box.x(), box.y(), box.width(), box.height());
    }

    private static final class Candidate {
        private final int index;
        private final String label;
        private final ComponentType type;
        private final BoundingBox box;
        private final double confidence;

        private Candidate(int index, String label, ComponentType type, BoundingBox box, double confidence) {
            this.index = index;
            this.label = label;
            this.type = type;
            this.box = box;
            this.confidence = confidence;
        }
    }
}
