package com.stridegraph.core.graph;

import com.stridegraph.core.model.DetectedComponent;
import com.stridegraph.core.model.Diagnostic;
import com.stridegraph.core.model.Relationship;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Components and inferred relationships for one diagram.
 *
 * <p>Index-based: nodes live in a list ordered by id ordinal, and adjacency lists are keyed by
 * component id, so nodes never hold references to each other. Edges are kept sorted by
 * (source ordinal, target ordinal). The graph is immutable and owned by a single run.
 *
 * <p>Construction checks the relationship invariants: both ends reference existing components,
 * no self-edges, and no duplicate (source, target, kind) triple.
 */
public final class ThreatGraph {

    private static final ThreatGraph EMPTY = new ThreatGraph(List.of(), List.of(), List.of());

    private final List<DetectedComponent> nodes;
    private final List<Relationship> edges;
    private final List<Diagnostic> diagnostics;
    private final Map<String, Integer> indexById;
    private final Map<String, List<Relationship>> outgoing;
    private final Map<String, List<Relationship>> incoming;

    /**
     * Creates a graph.
     *
     * @param nodes components in id order
     * @param edges relationships between the components
     * @param diagnostics normalization diagnostics for the source detections
     * @throws IllegalArgumentException if an invariant is violated
     */
    public ThreatGraph(List<DetectedComponent> nodes, List<Relationship> edges, List<Diagnostic> diagnostics) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");

        this.nodes = List.copyOf(nodes);
        this.diagnostics = List.copyOf(diagnostics);

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            String id = this.nodes.get(i).id();
            if (index.putIfAbsent(id, i) != null) {
                throw new IllegalArgumentException("Duplicate component id: " + id);
            }
        }
        this.indexById = Map.copyOf(index);

        Set<String> seen = new HashSet<>();
        List<Relationship> sorted = new ArrayList<>(edges);
        for (Relationship edge : sorted) {
            if (!indexById.containsKey(edge.sourceId()) || !indexById.containsKey(edge.targetId())) {
                throw new IllegalArgumentException("Relationship references unknown component: " + edge.id());
            }
            if (!seen.add(edge.sourceId() + "|" + edge.targetId() + "|" + edge.kind())) {
                throw new IllegalArgumentException("Duplicate relationship: " + edge.id() + " " + edge.kind());
            }
        }
        sorted.sort(Comparator
            .comparingInt((Relationship r) -> indexById.get(r.sourceId()))
            .thenComparingInt(r -> indexById.get(r.targetId()))
            .thenComparing(Relationship::kind));
        this.edges = List.copyOf(sorted);

        Map<String, List<Relationship>> out = new LinkedHashMap<>();
        Map<String, List<Relationship>> in = new LinkedHashMap<>();
        for (Relationship edge : this.edges) {
            out.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.targetId(), k -> new ArrayList<>()).add(edge);
        }
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
    }

    /**
     * Returns the graph with no components.
     *
     * @return empty graph
     */
    public static ThreatGraph empty() {
        return EMPTY;
    }

    public List<DetectedComponent> nodes() {
        return nodes;
    }

    public List<Relationship> edges() {
        return edges;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Looks up a component by id.
     *
     * @param id component id
     * @return the component, if present
     */
    public Optional<DetectedComponent> node(String id) {
        Integer index = indexById.get(id);
        return index == null ? Optional.empty() : Optional.of(nodes.get(index));
    }

    /**
     * Returns a component that must exist.
     *
     * @param id component id
     * @return the component
     * @throws IllegalArgumentException if no component has this id
     */
    public DetectedComponent requireNode(String id) {
        return node(id).orElseThrow(() -> new IllegalArgumentException("Unknown component id: " + id));
    }

    /**
     * Returns the position of a component in id order.
     *
     * @param id component id
     * @return ordinal, or -1 if unknown
     */
    public int ordinalOf(String id) {
        return indexById.getOrDefault(id, -1);
    }

    public List<Relationship> outgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<Relationship> incoming(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    private static Map<String, List<Relationship>> freeze(Map<String, List<Relationship>> adjacency) {
        Map<String, List<Relationship>> frozen = new LinkedHashMap<>();
        adjacency.forEach((id, list) -> frozen.put(id, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ThreatGraph other)) {
            return false;
        }
        return nodes.equals(other.nodes) && edges.equals(other.edges) && diagnostics.equals(other.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges, diagnostics);
    }

    @Override
    public String toString() {
        return "ThreatGraph[nodes=" + nodes.size() + ", edges=" + edges.size()
            + ", diagnostics=" + diagnostics.size() + "]";
    }
}
