package com.stridegraph.core.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.stridegraph.core.config.StrideConfig;
import com.stridegraph.core.model.ComponentType;
import com.stridegraph.core.model.RuleEntry;
import com.stridegraph.core.model.RuleRole;
import com.stridegraph.core.model.StrideCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Loads {@link RuleTable}s from YAML.
 *
 * <p><b>Format:</b>
 * <pre>{@code
 * version: "1.0"
 * rules:
 *   - componentType: DATABASE
 *     role: NODE
 *     category: TAMPERING
 *     description: "Records in {label} ({id}) can be modified ..."
 *     countermeasure: "Enforce least-privilege write access ..."
 * }</pre>
 *
 * <p>Enum values accept constant names ({@code INFORMATION_DISCLOSURE}) as well as display
 * spellings ({@code Information Disclosure}, {@code LoadBalancer}). Every failure is a
 * {@link RuleTableException}.
 */
public final class RuleTableLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleTableLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Classpath location of the bundled rule table. */
    public static final String DEFAULT_RESOURCE = "/stride-rules.yaml";

    private RuleTableLoader() {
        // Utility class
    }

    /**
     * Returns the bundled rule table, loaded once per process.
     *
     * @return default rule table
     * @throws RuleTableException if the bundled table is missing or invalid
     */
    public static RuleTable loadDefault() {
        return DefaultTableHolder.TABLE;
    }

    /**
     * Builds the rule table described by configuration: the replacement file (or the bundled
     * table) extended with every additional file.
     *
     * @param rules rule sources
     * @param baseDirectory directory relative paths are resolved against
     * @return rule table
     */
    public static RuleTable fromConfig(StrideConfig.RulesConfig rules, Path baseDirectory) {
        Objects.requireNonNull(rules, "rules must not be null");
        RuleTable table = rules.file() == null
            ? loadDefault()
            : load(baseDirectory.resolve(rules.file()));
        for (String additional : rules.additionalFiles()) {
            table = extend(table, baseDirectory.resolve(additional));
        }
        return table;
    }

    /**
     * Loads a complete rule table from a file.
     *
     * @param path YAML file
     * @return validated table
     */
    public static RuleTable load(Path path) {
        RuleDocument document = read(path);
        return RuleTable.of(document.version(), toEntries(document, path.toString()));
    }

    /**
     * Loads a complete rule table from a stream.
     *
     * @param input YAML content
     * @param sourceName name used in error messages
     * @return validated table
     */
    public static RuleTable load(InputStream input, String sourceName) {
        RuleDocument document;
        try {
            document = YAML_MAPPER.readValue(input, RuleDocument.class);
        } catch (IOException e) {
            throw new RuleTableException("Cannot parse rule table " + sourceName + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new RuleTableException("Rule table " + sourceName + " is empty");
        }
        RuleTable table = RuleTable.of(document.version(), toEntries(document, sourceName));
        log.info("Loaded rule table {} version {} ({} entries)", sourceName, table.version(), table.size());
        return table;
    }

    /**
     * Appends the rows of an additional rule file to an existing table.
     *
     * <p>The additional file's {@code version} is optional; the result keeps the base version
     * suffixed with the file name so reports show the table was extended.
     *
     * @param base table to extend
     * @param path YAML file with extra rows
     * @return new validated table
     */
    public static RuleTable extend(RuleTable base, Path path) {
        RuleDocument document = read(path);
        List<RuleEntry> combined = new ArrayList<>(base.entries());
        List<RuleEntry> extra = toEntries(document, path.toString());
        combined.addAll(extra);
        log.info("Extended rule table {} with {} entries from {}", base.version(), extra.size(), path);
        return RuleTable.of(base.version() + "+" + path.getFileName(), combined);
    }

    private static RuleDocument read(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new RuleTableException("Rule table file is missing or unreadable: " + path);
        }
        try {
            RuleDocument document = YAML_MAPPER.readValue(path.toFile(), RuleDocument.class);
            if (document == null) {
                throw new RuleTableException("Rule table " + path + " is empty");
            }
            return document;
        } catch (IOException e) {
            throw new RuleTableException("Cannot parse rule table " + path + ": " + e.getMessage(), e);
        }
    }

    private static List<RuleEntry> toEntries(RuleDocument document, String sourceName) {
        if (document.rules() == null) {
            throw new RuleTableException("Rule table " + sourceName + " has no 'rules' list");
        }
        List<RuleEntry> entries = new ArrayList<>(document.rules().size());
        for (int i = 0; i < document.rules().size(); i++) {
            RuleRow row = document.rules().get(i);
            String where = sourceName + " rule #" + (i + 1);
            if (row == null) {
                throw new RuleTableException(where + " is empty");
            }
            entries.add(new RuleEntry(
                parse(ComponentType.class, row.componentType(), "componentType", where),
                parse(RuleRole.class, row.role(), "role", where),
                parse(StrideCategory.class, row.category(), "category", where),
                require(row.description(), "description", where),
                require(row.countermeasure(), "countermeasure", where)
            ));
        }
        return entries;
    }

    /**
     * Matches enum constants ignoring case, spaces, hyphens and underscores, so
     * {@code LOAD_BALANCER}, {@code load-balancer} and {@code LoadBalancer} are the same value.
     */
    private static <E extends Enum<E>> E parse(Class<E> type, String value, String field, String where) {
        String key = squash(require(value, field, where));
        for (E constant : type.getEnumConstants()) {
            if (squash(constant.name()).equals(key)) {
                return constant;
            }
        }
        throw new RuleTableException(where + ": unknown " + field + " '" + value + "'");
    }

    private static String squash(String value) {
        return value.replaceAll("[\\s_\\-]+", "").toUpperCase(Locale.ROOT);
    }

    private static String require(String value, String field, String where) {
        if (value == null || value.isBlank()) {
            throw new RuleTableException(where + ": missing " + field);
        }
        return value;
    }

    private static final class DefaultTableHolder {
        private static final RuleTable TABLE = loadBundled();

        private static RuleTable loadBundled() {
            try (InputStream input = RuleTableLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                if (input == null) {
                    throw new RuleTableException("Bundled rule table not found on classpath: " + DEFAULT_RESOURCE);
                }
                return load(input, DEFAULT_RESOURCE);
            } catch (IOException e) {
                throw new RuleTableException("Cannot read bundled rule table: " + e.getMessage(), e);
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleDocument(
        @JsonProperty("version") String version,
        @JsonProperty("rules") List<RuleRow> rules
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleRow(
        @JsonProperty("componentType") String componentType,
        @JsonProperty("role") String role,
        @JsonProperty("category") String category,
        @JsonProperty("description") String description,
        @JsonProperty("countermeasure") String countermeasure
    ) {}
}
