package com.stridegraph.core.graph;

import com.stridegraph.core.model.ComponentType;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Canonical data-flow directions between component types.
 *
 * <p>A pair listed here is oriented source to target regardless of which component was
 * detected first. Pairs not listed produce an undirected relationship.
 */
final class FlowDirection {

    private static final Map<ComponentType, Set<ComponentType>> DOWNSTREAM = new EnumMap<>(ComponentType.class);

    static {
        flow(ComponentType.USER, ComponentType.API);
        flow(ComponentType.API, ComponentType.SERVER);
        flow(ComponentType.SERVER, ComponentType.DATABASE);
        flow(ComponentType.LOAD_BALANCER, ComponentType.SERVER);
        flow(ComponentType.USER, ComponentType.LOAD_BALANCER);
        flow(ComponentType.LOAD_BALANCER, ComponentType.API);
        flow(ComponentType.API, ComponentType.DATABASE);
    }

    private FlowDirection() {
        // Utility class
    }

    private static void flow(ComponentType source, ComponentType target) {
        DOWNSTREAM.computeIfAbsent(source, k -> EnumSet.noneOf(ComponentType.class)).add(target);
    }

    /**
     * Returns true when data canonically flows from {@code source} to {@code target}.
     *
     * @param source candidate source type
     * @param target candidate target type
     * @return true if the pair is a canonical direction
     */
    static boolean flowsTo(ComponentType source, ComponentType target) {
        Set<ComponentType> targets = DOWNSTREAM.get(source);
        return targets != null && targets.contains(target);
    }
}
