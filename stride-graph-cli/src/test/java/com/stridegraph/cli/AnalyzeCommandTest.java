package com.stridegraph.cli;

import com.stridegraph.cli.CommandTestSupport.Execution;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.stridegraph.cli.CommandTestSupport.SHOP_DETECTIONS;
import static com.stridegraph.cli.CommandTestSupport.execute;
import static com.stridegraph.cli.CommandTestSupport.write;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnalyzeCommand}.
 */
class AnalyzeCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void analyze_detectionFile_writesMarkdownAndJsonReports() throws IOException {
        // Given
        Path detections = write(tempDir, "shop.json", SHOP_DETECTIONS);
        Path outputDir = tempDir.resolve("reports");

        // When
        Execution result = execute("analyze", detections.toString(),
            "-c", tempDir.resolve("absent.yaml").toString(),
            "-o", outputDir.toString());

        // Then
        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("✓ Loaded rule table 1.0")
            .contains("✓ Read 1 detection file(s)")
            .contains("✓ shop.png: 2 components, 1 relationships")
            .contains("✓ Wrote reports to: " + outputDir);
        assertThat(Files.readString(outputDir.resolve("shop-stride-report.md")))
            .startsWith("# STRIDE Threat Report - shop.png")
            .contains("LOW_CONFIDENCE");
        assertThat(Files.readString(outputDir.resolve("shop-stride-report.json")))
            .contains("\"title\" : \"STRIDE Threat Report - shop.png\"");
    }

    @Test
    void analyze_jsonFormat_writesOnlyJson() throws IOException {
        Path detections = write(tempDir, "shop.json", SHOP_DETECTIONS);
        Path outputDir = tempDir.resolve("reports");

        Execution result = execute("analyze", detections.toString(),
            "-c", tempDir.resolve("absent.yaml").toString(),
            "-o", outputDir.toString(), "--format", "json");

        assertThat(result.exitCode()).isZero();
        assertThat(outputDir.resolve("shop-stride-report.json")).exists();
        assertThat(outputDir.resolve("shop-stride-report.md")).doesNotExist();
    }

    @Test
    void analyze_configFile_suppliesOutputDirectoryAndRules() throws IOException {
        // Given
        write(tempDir, "rules/extra.yaml", """
            version: "extra"
            rules:
              - componentType: USER
                role: NODE
                category: DENIAL_OF_SERVICE
                description: "{label} could be locked out by repeated failed logins."
                countermeasure: "Use progressive delays instead of hard lockouts."
            """);
        Path config = write(tempDir, "stridegraph.yaml", """
            rules:
              additionalFiles:
                - rules/extra.yaml
            output:
              directory: "%s"
              formats: [markdown]
            """.formatted(tempDir.resolve("configured").toString().replace("\\", "/")));
        Path detections = write(tempDir, "shop.json", SHOP_DETECTIONS);

        // When
        Execution result = execute("analyze", detections.toString(), "-c", config.toString());

        // Then
        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("✓ Loaded rule table 1.0+extra.yaml");
        assertThat(Files.readString(tempDir.resolve("configured/shop-stride-report.md")))
            .contains("could be locked out by repeated failed logins");
    }

    @Test
    void analyze_severalFiles_reportsEachInArgumentOrder() throws IOException {
        Path first = write(tempDir, "b.json", SHOP_DETECTIONS.replace("shop.png", "b.png"));
        Path second = write(tempDir, "a.json", SHOP_DETECTIONS.replace("shop.png", "a.png"));
        Path outputDir = tempDir.resolve("reports");

        Execution result = execute("analyze", first.toString(), second.toString(),
            "-c", tempDir.resolve("absent.yaml").toString(),
            "-o", outputDir.toString(), "--parallelism", "2");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out().indexOf("✓ b.png")).isLessThan(result.out().indexOf("✓ a.png"));
        assertThat(outputDir.resolve("a-stride-report.md")).exists();
        assertThat(outputDir.resolve("b-stride-report.md")).exists();
    }

    @Test
    void analyze_sourcesSharingBaseName_failsWithoutWritingReports() throws IOException {
        // Given
        Path png = write(tempDir, "a.json", SHOP_DETECTIONS);
        Path jpg = write(tempDir, "b.json", SHOP_DETECTIONS.replace("shop.png", "shop.jpg"));
        Path outputDir = tempDir.resolve("reports");

        // When
        Execution result = execute("analyze", png.toString(), jpg.toString(),
            "-c", tempDir.resolve("absent.yaml").toString(),
            "-o", outputDir.toString());

        // Then
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err())
            .contains("✗ Analysis failed")
            .contains("shop-stride-report")
            .contains("shop.png")
            .contains("shop.jpg");
        assertThat(result.out()).doesNotContain("✓ Wrote reports to");
        assertThat(outputDir.resolve("shop-stride-report.md")).doesNotExist();
        assertThat(outputDir.resolve("shop-stride-report.json")).doesNotExist();
    }

    @Test
    void analyze_bothFormat_writesMarkdownAndJson() throws IOException {
        Path detections = write(tempDir, "shop.json", SHOP_DETECTIONS);
        Path outputDir = tempDir.resolve("reports");

        Execution result = execute("analyze", detections.toString(),
            "-c", tempDir.resolve("absent.yaml").toString(),
            "-o", outputDir.toString(), "--format", "both");

        assertThat(result.exitCode()).isZero();
        assertThat(outputDir.resolve("shop-stride-report.md")).exists();
        assertThat(outputDir.resolve("shop-stride-report.json")).exists();
    }

    @Test
    void analyze_consoleFlag_printsReportsAndStillWritesFiles() throws IOException {
        // Given
        Path detections = write(tempDir, "shop.json", SHOP_DETECTIONS);
        Path outputDir = tempDir.resolve("reports");
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;

        // When
        Execution result;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            result = execute("analyze", detections.toString(),
                "-c", tempDir.resolve("absent.yaml").toString(),
                "-o", outputDir.toString(), "--format", "markdown", "--console");
        } finally {
            System.setOut(originalOut);
        }

        // Then
        assertThat(result.exitCode()).isZero();
        assertThat(captured.toString(StandardCharsets.UTF_8))
            .contains("== shop-stride-report.md ==")
            .contains("# STRIDE Threat Report - shop.png")
            .doesNotContain("shop-stride-report.json");
        assertThat(outputDir.resolve("shop-stride-report.md")).exists();
    }

    @Test
    void analyze_missingDetectionFile_failsWithExitCodeOne() {
        Execution result = execute("analyze", tempDir.resolve("missing.json").toString(),
            "-c", tempDir.resolve("absent.yaml").toString(),
            "-o", tempDir.resolve("reports").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("✗ Analysis failed");
    }

    @Test
    void analyze_malformedDetectionFile_failsWithExitCodeOne() throws IOException {
        Path detections = write(tempDir, "broken.json", "{ \"detections\": [] }");

        Execution result = execute("analyze", detections.toString(),
            "-c", tempDir.resolve("absent.yaml").toString(),
            "-o", tempDir.resolve("reports").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("image block");
    }

    @Test
    void analyze_unknownFormat_failsWithExitCodeOne() throws IOException {
        Path detections = write(tempDir, "shop.json", SHOP_DETECTIONS);

        Execution result = execute("analyze", detections.toString(),
            "-c", tempDir.resolve("absent.yaml").toString(),
            "-o", tempDir.resolve("reports").toString(), "--format", "pdf");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Unknown report format: pdf");
    }
}
