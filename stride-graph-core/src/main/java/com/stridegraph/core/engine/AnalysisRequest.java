package com.stridegraph.core.engine;

import com.stridegraph.core.io.DetectionFile;
import com.stridegraph.core.model.ImageDimensions;
import com.stridegraph.core.model.RawDetection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Input of one analysis run.
 *
 * @param source name of the diagram
 * @param detections raw detections
 * @param dimensions image dimensions the boxes are relative to
 */
public record AnalysisRequest(
    String source,
    List<RawDetection> detections,
    ImageDimensions dimensions
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisRequest {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(dimensions, "dimensions must not be null");
        detections = detections == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(detections));
    }

    /**
     * Creates a request from a parsed detection file.
     *
     * @param file detection file
     * @return request
     */
    public static AnalysisRequest from(DetectionFile file) {
        return new AnalysisRequest(file.source(), file.detections(), file.dimensions());
    }
}
