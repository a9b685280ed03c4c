package com.stridegraph.core.normalize;

import com.stridegraph.core.model.ComponentType;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps free-text detection labels onto the closed {@link ComponentType} enumeration.
 *
 * <p>Lookup is a table keyed by a canonical form of the label (lower case, separators
 * collapsed to single spaces). Anything not in the table maps to {@link ComponentType#UNKNOWN},
 * so the mapping is total over all strings, including null.
 *
 * <p>The built-in table covers common English labels as well as the Portuguese vocabulary of
 * diagram annotations ("banco de dados", "usuário", ...). Callers may add aliases through
 * {@code analysis.labelAliases}.
 */
public final class LabelMapper {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s_\\-./]+");

    private static final Map<String, ComponentType> BUILT_IN_ALIASES = Map.ofEntries(
        // Servers and compute
        Map.entry("server", ComponentType.SERVER),
        Map.entry("servers", ComponentType.SERVER),
        Map.entry("web server", ComponentType.SERVER),
        Map.entry("webserver", ComponentType.SERVER),
        Map.entry("application server", ComponentType.SERVER),
        Map.entry("app server", ComponentType.SERVER),
        Map.entry("host", ComponentType.SERVER),
        Map.entry("vm", ComponentType.SERVER),
        Map.entry("virtual machine", ComponentType.SERVER),
        Map.entry("ec2", ComponentType.SERVER),
        Map.entry("container", ComponentType.SERVER),
        Map.entry("microservice", ComponentType.SERVER),
        Map.entry("servidor", ComponentType.SERVER),
        Map.entry("servidor web", ComponentType.SERVER),
        Map.entry("servidor de aplicação", ComponentType.SERVER),
        Map.entry("contêiner", ComponentType.SERVER),
        Map.entry("microsserviço", ComponentType.SERVER),

        // Databases
        Map.entry("database", ComponentType.DATABASE),
        Map.entry("databases", ComponentType.DATABASE),
        Map.entry("db", ComponentType.DATABASE),
        Map.entry("data store", ComponentType.DATABASE),
        Map.entry("datastore", ComponentType.DATABASE),
        Map.entry("rds", ComponentType.DATABASE),
        Map.entry("sql", ComponentType.DATABASE),
        Map.entry("postgresql", ComponentType.DATABASE),
        Map.entry("postgres", ComponentType.DATABASE),
        Map.entry("mysql", ComponentType.DATABASE),
        Map.entry("mongodb", ComponentType.DATABASE),
        Map.entry("banco de dados", ComponentType.DATABASE),

        // Users and clients
        Map.entry("user", ComponentType.USER),
        Map.entry("users", ComponentType.USER),
        Map.entry("client", ComponentType.USER),
        Map.entry("actor", ComponentType.USER),
        Map.entry("person", ComponentType.USER),
        Map.entry("browser", ComponentType.USER),
        Map.entry("usuário", ComponentType.USER),
        Map.entry("usuario", ComponentType.USER),
        Map.entry("cliente", ComponentType.USER),

        // Load balancers
        Map.entry("load balancer", ComponentType.LOAD_BALANCER),
        Map.entry("loadbalancer", ComponentType.LOAD_BALANCER),
        Map.entry("lb", ComponentType.LOAD_BALANCER),
        Map.entry("elb", ComponentType.LOAD_BALANCER),
        Map.entry("alb", ComponentType.LOAD_BALANCER),
        Map.entry("nlb", ComponentType.LOAD_BALANCER),
        Map.entry("balanceador de carga", ComponentType.LOAD_BALANCER),

        // APIs
        Map.entry("api", ComponentType.API),
        Map.entry("apis", ComponentType.API),
        Map.entry("api gateway", ComponentType.API),
        Map.entry("gateway", ComponentType.API),
        Map.entry("rest api", ComponentType.API),
        Map.entry("graphql", ComponentType.API),
        Map.entry("endpoint", ComponentType.API),

        Map.entry("unknown", ComponentType.UNKNOWN)
    );

    private final Map<String, ComponentType> aliases;

    /**
     * Creates a mapper with only the built-in aliases.
     */
    public LabelMapper() {
        this(Map.of());
    }

    /**
     * Creates a mapper with the built-in aliases plus the given extra aliases.
     *
     * <p>Extra aliases override built-in ones with the same canonical key.
     *
     * @param extraAliases additional label-to-type mappings
     */
    public LabelMapper(Map<String, ComponentType> extraAliases) {
        Map<String, ComponentType> table = new HashMap<>();
        for (ComponentType type : ComponentType.values()) {
            table.put(canonicalize(type.name()), type);
            table.put(canonicalize(type.displayName()), type);
        }
        BUILT_IN_ALIASES.forEach((label, type) -> table.put(canonicalize(label), type));
        extraAliases.forEach((label, type) -> {
            if (label != null && type != null) {
                table.put(canonicalize(label), type);
            }
        });
        this.aliases = Map.copyOf(table);
    }

    /**
     * Resolves a label to a component type.
     *
     * @param label raw detection label (may be null)
     * @return mapped type, or {@link ComponentType#UNKNOWN}
     */
    public ComponentType map(String label) {
        if (label == null) {
            return ComponentType.UNKNOWN;
        }
        return aliases.getOrDefault(canonicalize(label), ComponentType.UNKNOWN);
    }

    /**
     * Canonical lookup form of a label.
     *
     * @param label raw label
     * @return trimmed, lower-cased label with separators collapsed to single spaces
     */
    static String canonicalize(String label) {
        return SEPARATORS.matcher(label.trim().toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
