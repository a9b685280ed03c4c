package com.stridegraph.cli;

import com.stridegraph.core.config.ConfigLoader;
import com.stridegraph.core.config.StrideConfig;
import com.stridegraph.core.model.ComponentType;
import com.stridegraph.core.model.RuleEntry;
import com.stridegraph.core.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to print the loaded STRIDE rule table.
 */
@Command(
    name = "rules",
    description = "Print the STRIDE rule table",
    mixinStandardHelpOptions = true
)
public class RulesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RulesCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: stridegraph.yaml)")
    private Path configPath = Paths.get(ConfigSupport.DEFAULT_CONFIG);

    @Option(names = {"-t", "--type"}, description = "Only show rules for this component type: ${COMPLETION-CANDIDATES}")
    private ComponentType type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            StrideConfig config = ConfigLoader.load(configPath);
            RuleTable table = ConfigSupport.ruleTable(config, configPath);

            out.println("Rule table version " + table.version() + " (" + table.size() + " entries)");
            out.println();

            int shown = 0;
            for (RuleEntry entry : table.entries()) {
                if (type != null && entry.componentType() != type) {
                    continue;
                }
                out.printf("%-14s %-12s %-23s %s%n",
                    entry.componentType(), entry.role(), entry.category().displayName(), entry.descriptionTemplate());
                shown++;
            }
            out.println();
            out.println("Total: " + shown + " rule(s)");
            return 0;
        } catch (Exception e) {
            log.error("Failed to load rule table", e);
            spec.commandLine().getErr().println("✗ Failed to load rule table: " + e.getMessage());
            return 1;
        }
    }
}
