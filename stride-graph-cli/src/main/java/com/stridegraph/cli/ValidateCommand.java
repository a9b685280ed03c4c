package com.stridegraph.cli;

import com.stridegraph.core.config.ConfigLoader;
import com.stridegraph.core.config.StrideConfig;
import com.stridegraph.core.output.ReportFormat;
import com.stridegraph.core.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file and the rule table it selects.
 *
 * <p>Unlike {@code analyze}, which falls back to defaults, every problem is reported and
 * yields exit code 1.
 */
@Command(
    name = "validate",
    description = "Validate configuration file and rule table",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigSupport.DEFAULT_CONFIG)
    private Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        log.info("Validating configuration: {}", configFile);
        try {
            StrideConfig config = ConfigLoader.loadStrict(configFile);
            out.println("✓ Configuration is valid: " + configFile);

            for (String format : config.output().formats()) {
                ReportFormat.fromName(format);
            }
            out.println("✓ Output formats: " + config.output().formats());

            RuleTable table = ConfigSupport.ruleTable(config, configFile);
            out.println("✓ Rule table " + table.version() + " is complete (" + table.size() + " entries)");
            return 0;
        } catch (Exception e) {
            log.error("Validation failed", e);
            spec.commandLine().getErr().println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
