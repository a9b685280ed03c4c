package com.stridegraph.core.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * Discovers {@link ReportSink} implementations registered through the service loader.
 */
public final class ReportSinks {

    private static final Logger log = LoggerFactory.getLogger(ReportSinks.class);

    private ReportSinks() {
        // Utility class
    }

    /**
     * Loads all registered sinks keyed by id.
     *
     * @return sinks sorted by id
     */
    public static Map<String, ReportSink> discover() {
        Map<String, ReportSink> sinks = new TreeMap<>();
        for (ReportSink sink : ServiceLoader.load(ReportSink.class)) {
            ReportSink previous = sinks.putIfAbsent(sink.getId(), sink);
            if (previous != null) {
                log.warn("Ignoring duplicate report sink '{}': {}", sink.getId(), sink.getClass().getName());
            }
        }
        log.debug("Discovered report sinks: {}", sinks.keySet());
        return sinks;
    }

    /**
     * Returns the registered sink with the given id.
     *
     * @param id sink identifier
     * @return sink
     * @throws IllegalArgumentException if no sink has that id
     */
    public static ReportSink require(String id) {
        ReportSink sink = discover().get(id);
        if (sink == null) {
            throw new IllegalArgumentException("No report sink registered with id '" + id + "'");
        }
        return sink;
    }
}
