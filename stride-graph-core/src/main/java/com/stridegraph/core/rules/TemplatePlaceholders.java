package com.stridegraph.core.rules;

import com.stridegraph.core.model.RuleRole;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder vocabulary of rule templates.
 *
 * <p>Templates reference attributes as {@code {name}}. Node rules see the component; edge
 * rules see both endpoints of the relationship.
 */
public final class TemplatePlaceholders {

    /** Matches {@code {name}} placeholders. */
    public static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z]+)}");

    public static final String ID = "id";
    public static final String TYPE = "type";
    public static final String LABEL = "label";
    public static final String CONFIDENCE = "confidence";
    public static final String SOURCE = "source";
    public static final String TARGET = "target";
    public static final String SOURCE_TYPE = "sourceType";
    public static final String TARGET_TYPE = "targetType";
    public static final String SOURCE_LABEL = "sourceLabel";
    public static final String TARGET_LABEL = "targetLabel";

    private static final Set<String> NODE = Set.of(ID, TYPE, LABEL, CONFIDENCE);
    private static final Set<String> EDGE = Set.of(
        ID, SOURCE, TARGET, SOURCE_TYPE, TARGET_TYPE, SOURCE_LABEL, TARGET_LABEL, CONFIDENCE);

    private TemplatePlaceholders() {
        // Utility class
    }

    /**
     * Returns the placeholders available to templates of a role.
     *
     * @param role rule role
     * @return allowed placeholder names
     */
    public static Set<String> allowedFor(RuleRole role) {
        return role == RuleRole.NODE ? NODE : EDGE;
    }

    /**
     * Extracts the placeholder names a template references, in order of first use.
     *
     * @param template template text
     * @return referenced placeholder names
     */
    public static Set<String> referencedBy(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }
}
