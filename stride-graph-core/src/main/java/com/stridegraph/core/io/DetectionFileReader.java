package com.stridegraph.core.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stridegraph.core.model.BoundingBox;
import com.stridegraph.core.model.ImageDimensions;
import com.stridegraph.core.model.RawDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads detection files produced by the external vision model.
 *
 * <p><b>Format:</b>
 * <pre>{@code
 * {
 *   "source": "diagram.png",
 *   "image": { "width": 1200, "height": 800 },
 *   "coordinates": "pixel",
 *   "detections": [
 *     { "label": "Database", "confidence": 0.9,
 *       "bbox": { "x": 100, "y": 200, "width": 120, "height": 80 } }
 *   ]
 * }
 * }</pre>
 *
 * <p>{@code coordinates} is {@code pixel} (default) or {@code normalized}; the {@code image}
 * block is required for pixel coordinates. Missing confidences or boxes are passed through
 * as NaN or null so the normalizer can record them as diagnostics.
 */
public final class DetectionFileReader {

    private static final Logger log = LoggerFactory.getLogger(DetectionFileReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String PIXEL = "pixel";
    private static final String NORMALIZED = "normalized";

    private DetectionFileReader() {
        // Utility class
    }

    /**
     * Reads a detection file.
     *
     * @param path JSON file
     * @return parsed detections
     * @throws IOException if the file cannot be read
     * @throws DetectionFormatException if the content is not a valid detection file
     */
    public static DetectionFile read(Path path) throws IOException {
        String fallbackSource = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        try (InputStream input = Files.newInputStream(path)) {
            return read(input, fallbackSource);
        }
    }

    /**
     * Reads detection JSON from a stream.
     *
     * @param input JSON content
     * @param fallbackSource source name used when the document has none
     * @return parsed detections
     * @throws IOException if the stream cannot be read
     * @throws DetectionFormatException if the content is not a valid detection file
     */
    public static DetectionFile read(InputStream input, String fallbackSource) throws IOException {
        DetectionDocument document;
        try {
            document = MAPPER.readValue(input, DetectionDocument.class);
        } catch (JsonProcessingException e) {
            throw new DetectionFormatException("Invalid detection file " + fallbackSource + ": "
                + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new DetectionFormatException("Detection file " + fallbackSource + " is empty");
        }

        String source = document.source() == null || document.source().isBlank()
            ? fallbackSource
            : document.source();
        ImageDimensions dimensions = dimensionsOf(document, source);

        List<RawDetection> detections = new ArrayList<>();
        if (document.detections() != null) {
            for (DetectionEntry entry : document.detections()) {
                detections.add(toRaw(entry));
            }
        }

        log.debug("Read {} detections from {}", detections.size(), source);
        return new DetectionFile(source, dimensions, detections);
    }

    private static ImageDimensions dimensionsOf(DetectionDocument document, String source) {
        String coordinates = document.coordinates() == null
            ? PIXEL
            : document.coordinates().trim().toLowerCase(Locale.ROOT);

        if (NORMALIZED.equals(coordinates)) {
            return ImageDimensions.normalized();
        }
        if (!PIXEL.equals(coordinates)) {
            throw new DetectionFormatException("Detection file " + source + " has unknown coordinates '"
                + document.coordinates() + "' (expected pixel or normalized)");
        }

        ImageBlock image = document.image();
        if (image == null || image.width() == null || image.height() == null) {
            throw new DetectionFormatException("Detection file " + source
                + " is missing the image block required for pixel coordinates");
        }
        try {
            return new ImageDimensions(image.width(), image.height());
        } catch (IllegalArgumentException e) {
            throw new DetectionFormatException("Detection file " + source + ": " + e.getMessage(), e);
        }
    }

    private static RawDetection toRaw(DetectionEntry entry) {
        if (entry == null) {
            return null;
        }
        double confidence = entry.confidence() == null ? Double.NaN : entry.confidence();
        BoxBlock bbox = entry.bbox();
        BoundingBox box = null;
        if (bbox != null && bbox.x() != null && bbox.y() != null && bbox.width() != null && bbox.height() != null) {
            box = new BoundingBox(bbox.x(), bbox.y(), bbox.width(), bbox.height());
        }
        return new RawDetection(entry.label(), confidence, box);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DetectionDocument(
        @JsonProperty("source") String source,
        @JsonProperty("image") ImageBlock image,
        @JsonProperty("coordinates") String coordinates,
        @JsonProperty("detections") List<DetectionEntry> detections
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ImageBlock(
        @JsonProperty("width") Double width,
        @JsonProperty("height") Double height
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DetectionEntry(
        @JsonProperty("label") String label,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("bbox") BoxBlock bbox
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BoxBlock(
        @JsonProperty("x") Double x,
        @JsonProperty("y") Double y,
        @JsonProperty("width") Double width,
        @JsonProperty("height") Double height
    ) {}
}
