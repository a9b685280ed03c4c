package com.stridegraph.core.output;

/**
 * Destination for composed reports.
 *
 * <p>The engine itself never persists anything; callers hand its output to one or more
 * sinks. Sinks are discovered through {@link java.util.ServiceLoader}; register
 * implementations in {@code META-INF/services/com.stridegraph.core.output.ReportSink}.
 *
 * @see ReportSinks
 */
public interface ReportSink {

    /**
     * Returns the unique, lowercase identifier of this sink (e.g. "filesystem", "console").
     *
     * @return sink identifier
     */
    String getId();

    /**
     * Writes the artifacts of one report.
     *
     * @param output rendered artifacts
     * @param context output directory and settings
     * @throws IllegalStateException if the artifacts cannot be written
     */
    void write(ReportOutput output, OutputContext context);
}
