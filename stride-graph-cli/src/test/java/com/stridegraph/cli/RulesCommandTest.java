package com.stridegraph.cli;

import com.stridegraph.cli.CommandTestSupport.Execution;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.stridegraph.cli.CommandTestSupport.execute;
import static com.stridegraph.cli.CommandTestSupport.write;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RulesCommand}.
 */
class RulesCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void rules_defaultTable_printsEveryEntry() {
        Execution result = execute("rules", "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .startsWith("Rule table version 1.0 (")
            .contains("LOAD_BALANCER")
            .contains("EDGE_TARGET");
    }

    @Test
    void rules_typeFilter_printsOnlyThatType() {
        Execution result = execute("rules", "-c", tempDir.resolve("absent.yaml").toString(), "--type", "DATABASE");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("DATABASE")
            .doesNotContain("LOAD_BALANCER")
            .contains("Total: 8 rule(s)");
    }

    @Test
    void rules_brokenRuleFile_failsWithExitCodeOne() throws IOException {
        Path config = write(tempDir, "stridegraph.yaml", """
            rules:
              file: missing-rules.yaml
            """);

        Execution result = execute("rules", "-c", config.toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("✗ Failed to load rule table");
    }
}
