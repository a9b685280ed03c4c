package com.stridegraph.core.reasoning;

import com.stridegraph.core.rules.TemplatePlaceholders;

import java.util.Map;
import java.util.regex.Matcher;

/**
 * Substitutes {@code {name}} placeholders in rule templates.
 */
final class TemplateRenderer {

    private TemplateRenderer() {
        // Utility class
    }

    /**
     * Renders a template.
     *
     * @param template template text
     * @param values placeholder values
     * @return rendered text
     * @throws IllegalStateException if the template references a value that is not supplied
     */
    static String render(String template, Map<String, String> values) {
        Matcher matcher = TemplatePlaceholders.PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder(template.length() + 32);
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = values.get(name);
            if (value == null) {
                throw new IllegalStateException("Template references unavailable field {" + name + "}: " + template);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
