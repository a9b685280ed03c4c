package com.stridegraph;

import ch.qos.logback.classic.Level;
import com.stridegraph.cli.AnalyzeCommand;
import com.stridegraph.cli.RulesCommand;
import com.stridegraph.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for StrideGraph.
 *
 * <p>StrideGraph turns component detections from architecture diagrams into STRIDE threat
 * reports.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze detection files and write threat reports</li>
 *   <li>{@code rules} - Print the loaded STRIDE rule table</li>
 *   <li>{@code validate} - Validate configuration and rule table</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * stridegraph analyze detections/shop.json -o reports
 * stridegraph -v analyze a.json b.json --parallelism 2 --format json
 * stridegraph rules --type DATABASE
 * }</pre>
 */
@Command(
    name = "stridegraph",
    mixinStandardHelpOptions = true,
    version = "StrideGraph 1.0.0-SNAPSHOT",
    description = "STRIDE threat reports from detected architecture-diagram components",
    subcommands = {
        AnalyzeCommand.class,
        RulesCommand.class,
        ValidateCommand.class
    }
)
public class StrideGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StrideGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("StrideGraph - STRIDE Threat Graph Synthesis");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'stridegraph --help' to see available commands");
        System.out.println("Use 'stridegraph <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        StrideGraphCLI cli = new StrideGraphCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
