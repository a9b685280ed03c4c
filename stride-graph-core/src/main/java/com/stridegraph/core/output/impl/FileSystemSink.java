package com.stridegraph.core.output.impl;

import com.stridegraph.core.output.OutputContext;
import com.stridegraph.core.output.ReportArtifact;
import com.stridegraph.core.output.ReportOutput;
import com.stridegraph.core.output.ReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes report artifacts into the output directory, creating it when needed and
 * overwriting existing files.
 */
public class FileSystemSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSink.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void write(ReportOutput output, OutputContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (ReportArtifact artifact : output.artifacts()) {
            writeArtifact(outputDir, artifact);
        }
        log.info("Wrote {} report file(s) for {} to {}", output.artifacts().size(), output.source(), outputDir);
    }

    private void writeArtifact(Path outputDir, ReportArtifact artifact) {
        Path target = outputDir.resolve(artifact.fileName()).normalize();
        if (!target.startsWith(outputDir.normalize())) {
            throw new IllegalStateException("Report file escapes output directory: " + artifact.fileName());
        }
        try {
            Files.writeString(target, artifact.content(), StandardCharsets.UTF_8);
            log.debug("Wrote file: {} ({} bytes)", target, artifact.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write report file: " + target, e);
        }
    }
}
