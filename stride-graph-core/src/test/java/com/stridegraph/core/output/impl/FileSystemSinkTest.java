package com.stridegraph.core.output.impl;

import com.stridegraph.core.output.OutputContext;
import com.stridegraph.core.output.ReportArtifact;
import com.stridegraph.core.output.ReportFormat;
import com.stridegraph.core.output.ReportOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemSink}.
 */
class FileSystemSinkTest {

    @TempDir
    Path tempDir;

    private FileSystemSink sink;

    @BeforeEach
    void setUp() {
        sink = new FileSystemSink();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(sink.getId()).isEqualTo("filesystem");
    }

    @Test
    void write_createsDirectoryAndFiles() throws IOException {
        // Given
        Path outputDir = tempDir.resolve("reports/nested");
        ReportOutput output = new ReportOutput("shop.png", List.of(
            new ReportArtifact("shop-stride-report.md", "# Report\n", ReportFormat.MARKDOWN),
            new ReportArtifact("shop-stride-report.json", "{}\n", ReportFormat.JSON)
        ));

        // When
        sink.write(output, new OutputContext(outputDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(outputDir.resolve("shop-stride-report.md"))).isEqualTo("# Report\n");
        assertThat(Files.readString(outputDir.resolve("shop-stride-report.json"))).isEqualTo("{}\n");
    }

    @Test
    void write_existingFile_isOverwritten() throws IOException {
        Files.writeString(tempDir.resolve("a-stride-report.md"), "old content");
        ReportOutput output = new ReportOutput("a.png", List.of(
            new ReportArtifact("a-stride-report.md", "new", ReportFormat.MARKDOWN)));

        sink.write(output, new OutputContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("a-stride-report.md"))).isEqualTo("new");
    }

    @Test
    void write_fileNameEscapingDirectory_isRejected() {
        ReportOutput output = new ReportOutput("evil", List.of(
            new ReportArtifact("../outside.md", "x", ReportFormat.MARKDOWN)));
        OutputContext context = new OutputContext(tempDir.resolve("out").toString(), Map.of());

        assertThatThrownBy(() -> sink.write(output, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes");
        assertThat(tempDir.resolve("outside.md")).doesNotExist();
    }

    @Test
    void write_outputPathIsAFile_failsWithIllegalState() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        ReportOutput output = new ReportOutput("a.png", List.of(
            new ReportArtifact("a-stride-report.md", "x", ReportFormat.MARKDOWN)));

        assertThatThrownBy(() -> sink.write(output, new OutputContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("output directory");
    }
}
