package com.stridegraph.core.output.impl;

import com.stridegraph.core.output.OutputContext;
import com.stridegraph.core.output.ReportArtifact;
import com.stridegraph.core.output.ReportFormat;
import com.stridegraph.core.output.ReportOutput;
import com.stridegraph.core.output.ReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints report artifacts to standard output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors for headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.formats} - which artifacts to print ("markdown", "json" or "all", default: "markdown")</li>
 * </ul>
 */
public class ConsoleSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(ConsoleSink.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String SEPARATOR = "-".repeat(80);

    private final PrintStream out;

    public ConsoleSink() {
        this(System.out);
    }

    public ConsoleSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void write(ReportOutput output, OutputContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        String formats = context.getSettingOrDefault("console.formats", "markdown");

        int printed = 0;
        for (ReportArtifact artifact : output.artifacts()) {
            if (!selected(artifact.format(), formats)) {
                continue;
            }
            String header = "== " + artifact.fileName() + " ==";
            out.println(useColors ? ANSI_BOLD + ANSI_CYAN + header + ANSI_RESET : header);
            out.println(artifact.content());
            out.println(SEPARATOR);
            printed++;
        }
        out.flush();
        log.debug("Printed {} artifact(s) for {} to console", printed, output.source());
    }

    private static boolean selected(ReportFormat format, String formats) {
        if ("all".equalsIgnoreCase(formats)) {
            return true;
        }
        return ReportFormat.fromName(formats) == format;
    }
}
