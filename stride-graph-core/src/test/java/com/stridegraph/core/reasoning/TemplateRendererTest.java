package com.stridegraph.core.reasoning;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TemplateRenderer}.
 */
class TemplateRendererTest {

    @Test
    void render_substitutesEveryOccurrence() {
        String rendered = TemplateRenderer.render("{label} ({id}) talks to {label}", Map.of("label", "Web", "id", "C1"));

        assertThat(rendered).isEqualTo("Web (C1) talks to Web");
    }

    @Test
    void render_valueWithRegexCharacters_isInsertedLiterally() {
        String rendered = TemplateRenderer.render("Label: {label}", Map.of("label", "$1 \\ cost"));

        assertThat(rendered).isEqualTo("Label: $1 \\ cost");
    }

    @Test
    void render_textWithoutPlaceholders_isUnchanged() {
        assertThat(TemplateRenderer.render("Use MFA.", Map.of())).isEqualTo("Use MFA.");
    }

    @Test
    void render_missingValue_failsLoudly() {
        assertThatThrownBy(() -> TemplateRenderer.render("{source} -> {target}", Map.of("source", "C1")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("{target}");
    }
}
