package com.stridegraph.core.output;

import com.stridegraph.core.report.ComposedReport;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rendered artifacts of one analyzed diagram.
 *
 * @param source name of the analyzed diagram
 * @param artifacts rendered files
 */
public record ReportOutput(
    String source,
    List<ReportArtifact> artifacts
) {
    /** Suffix appended to the diagram's base name. */
    public static final String FILE_SUFFIX = "-stride-report";

    private static final String FILE_NAME_SANITIZATION_PATTERN = "[^A-Za-z0-9._-]";

    /**
     * Compact constructor with validation.
     */
    public ReportOutput {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(artifacts, "artifacts must not be null");
        artifacts = List.copyOf(artifacts);
    }

    /**
     * Builds the artifacts for a composed report.
     *
     * <p>Files are named {@code <base>-stride-report.<ext>}, where {@code base} is the source
     * name without its extension. Artifacts follow {@link ReportFormat} order.
     *
     * @param source name of the analyzed diagram
     * @param report composed report
     * @param formats formats to include
     * @return output with one artifact per format
     */
    public static ReportOutput of(String source, ComposedReport report, Set<ReportFormat> formats) {
        Objects.requireNonNull(report, "report must not be null");
        String baseName = baseName(source);

        List<ReportArtifact> artifacts = new ArrayList<>();
        EnumSet<ReportFormat> selected = formats.isEmpty()
            ? EnumSet.noneOf(ReportFormat.class)
            : EnumSet.copyOf(formats);
        for (ReportFormat format : selected) {
            String content = format == ReportFormat.JSON ? report.json() : report.markdown();
            artifacts.add(new ReportArtifact(baseName + FILE_SUFFIX + "." + format.extension(), content, format));
        }
        return new ReportOutput(source, artifacts);
    }

    static String baseName(String source) {
        if (source == null || source.isBlank()) {
            return "diagram";
        }
        String name = source.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        name = name.replaceAll(FILE_NAME_SANITIZATION_PATTERN, "_");
        return name.isEmpty() ? "diagram" : name;
    }
}
