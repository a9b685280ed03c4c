package com.stridegraph.core.io;

import com.stridegraph.core.model.ImageDimensions;
import com.stridegraph.core.model.RawDetection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DetectionFileReader}.
 */
class DetectionFileReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void read_pixelFile_parsesDimensionsAndDetections() throws IOException {
        // Given
        Path file = tempDir.resolve("shop.json");
        Files.writeString(file, """
            {
              "source": "shop.png",
              "image": { "width": 1200, "height": 800 },
              "detections": [
                { "label": "Database", "confidence": 0.9,
                  "bbox": { "x": 100, "y": 200, "width": 120, "height": 80 } },
                { "label": "API", "confidence": 0.7,
                  "bbox": { "x": 400, "y": 200, "width": 100, "height": 60 }, "extra": true }
              ]
            }
            """);

        // When
        DetectionFile detections = DetectionFileReader.read(file);

        // Then
        assertThat(detections.source()).isEqualTo("shop.png");
        assertThat(detections.dimensions()).isEqualTo(new ImageDimensions(1200, 800));
        assertThat(detections.detections()).hasSize(2);
        RawDetection first = detections.detections().get(0);
        assertThat(first.label()).isEqualTo("Database");
        assertThat(first.confidence()).isEqualTo(0.9);
        assertThat(first.box().x()).isEqualTo(100);
        assertThat(first.box().height()).isEqualTo(80);
    }

    @Test
    void read_withoutSource_usesFileName() throws IOException {
        Path file = tempDir.resolve("diagram.json");
        Files.writeString(file, """
            { "coordinates": "normalized", "detections": [] }
            """);

        DetectionFile detections = DetectionFileReader.read(file);

        assertThat(detections.source()).isEqualTo("diagram.json");
        assertThat(detections.dimensions()).isEqualTo(ImageDimensions.normalized());
        assertThat(detections.detections()).isEmpty();
    }

    @Test
    void read_incompleteEntries_arePassedThroughForDiagnostics() throws IOException {
        // Given
        String json = """
            {
              "coordinates": "Normalized",
              "detections": [
                { "label": "Server", "bbox": { "x": 0.1, "y": 0.1, "width": 0.1, "height": 0.1 } },
                { "label": "User", "confidence": 0.8, "bbox": { "x": 0.1, "y": 0.1 } },
                null
              ]
            }
            """;

        // When
        DetectionFile detections = DetectionFileReader.read(stream(json), "inline");

        // Then
        assertThat(detections.detections()).hasSize(3);
        assertThat(detections.detections().get(0).confidence()).isNaN();
        assertThat(detections.detections().get(1).box()).isNull();
        assertThat(detections.detections().get(2)).isNull();
    }

    @Test
    void read_pixelCoordinatesWithoutImage_isRejected() {
        String json = """
            { "detections": [] }
            """;

        assertThatThrownBy(() -> DetectionFileReader.read(stream(json), "no-image.json"))
            .isInstanceOf(DetectionFormatException.class)
            .hasMessageContaining("no-image.json")
            .hasMessageContaining("image block");
    }

    @Test
    void read_unknownCoordinates_isRejected() {
        String json = """
            { "coordinates": "polar", "detections": [] }
            """;

        assertThatThrownBy(() -> DetectionFileReader.read(stream(json), "polar.json"))
            .isInstanceOf(DetectionFormatException.class)
            .hasMessageContaining("polar");
    }

    @Test
    void read_nonPositiveImageSize_isRejected() {
        String json = """
            { "image": { "width": 0, "height": 800 }, "detections": [] }
            """;

        assertThatThrownBy(() -> DetectionFileReader.read(stream(json), "zero.json"))
            .isInstanceOf(DetectionFormatException.class)
            .hasMessageContaining("zero.json");
    }

    @Test
    void read_invalidJson_isRejected() {
        assertThatThrownBy(() -> DetectionFileReader.read(stream("{ \"detections\": [ "), "broken.json"))
            .isInstanceOf(DetectionFormatException.class)
            .hasMessageContaining("Invalid detection file broken.json");
    }

    @Test
    void read_missingFile_throwsIOException() {
        assertThatThrownBy(() -> DetectionFileReader.read(tempDir.resolve("absent.json")))
            .isInstanceOf(IOException.class);
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
