package com.stridegraph.core.output;

import com.stridegraph.core.output.impl.ConsoleSink;
import com.stridegraph.core.output.impl.FileSystemSink;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReportSinks}.
 */
class ReportSinksTest {

    @Test
    void discover_findsBuiltInSinks() {
        Map<String, ReportSink> sinks = ReportSinks.discover();

        assertThat(sinks).containsKeys("console", "filesystem");
        assertThat(sinks.get("console")).isInstanceOf(ConsoleSink.class);
        assertThat(sinks.get("filesystem")).isInstanceOf(FileSystemSink.class);
    }

    @Test
    void require_unknownId_isRejected() {
        assertThatThrownBy(() -> ReportSinks.require("s3"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("s3");
    }
}
