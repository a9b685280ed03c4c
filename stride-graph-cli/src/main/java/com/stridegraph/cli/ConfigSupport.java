package com.stridegraph.cli;

import com.stridegraph.core.config.StrideConfig;
import com.stridegraph.core.rules.RuleTable;
import com.stridegraph.core.rules.RuleTableLoader;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Helpers shared by commands that read {@code stridegraph.yaml}.
 */
final class ConfigSupport {

    static final String DEFAULT_CONFIG = "stridegraph.yaml";

    private ConfigSupport() {
        // Utility class
    }

    /**
     * Directory that relative paths in a config file are resolved against.
     */
    static Path baseDirectory(Path configPath) {
        Path parent = configPath.toAbsolutePath().getParent();
        return parent != null ? parent : Paths.get(".");
    }

    static RuleTable ruleTable(StrideConfig config, Path configPath) {
        return RuleTableLoader.fromConfig(config.rules(), baseDirectory(configPath));
    }
}
