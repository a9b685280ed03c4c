package com.stridegraph.core.io;

import com.stridegraph.core.model.ImageDimensions;
import com.stridegraph.core.model.RawDetection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Detections of one diagram image, as read from a detection file.
 *
 * @param source name of the analyzed image
 * @param dimensions dimensions to normalize boxes against ({@link ImageDimensions#normalized()}
 *                   when boxes are already in unit space)
 * @param detections raw detections, in file order (entries may be null)
 */
public record DetectionFile(
    String source,
    ImageDimensions dimensions,
    List<RawDetection> detections
) {
    public DetectionFile {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(dimensions, "dimensions must not be null");
        detections = detections == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(detections));
    }
}
