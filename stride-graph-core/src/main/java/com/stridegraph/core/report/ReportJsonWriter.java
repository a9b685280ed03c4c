package com.stridegraph.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Serializes {@link ThreatReport}s to JSON.
 *
 * <p>Indentation always uses {@code \n}, independent of the platform line separator, so the
 * output is byte-identical across hosts.
 */
public final class ReportJsonWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter WRITER = MAPPER.writer(prettyPrinter());

    private ReportJsonWriter() {
        // Utility class
    }

    /**
     * Serializes a report.
     *
     * @param report report to serialize
     * @return pretty-printed JSON terminated by a newline
     * @throws IllegalStateException if serialization fails
     */
    public static String toJson(ThreatReport report) {
        try {
            return WRITER.writeValueAsString(report) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize threat report: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a report previously written by {@link #toJson(ThreatReport)}.
     *
     * @param json JSON text
     * @return report
     * @throws IllegalArgumentException if the text is not a valid report
     */
    public static ThreatReport fromJson(String json) {
        try {
            return MAPPER.readValue(json, ThreatReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid threat report JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static DefaultPrettyPrinter prettyPrinter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter().withObjectIndenter(indenter);
        printer.indentArraysWith(indenter);
        return printer;
    }
}
