package com.stridegraph.core.engine;

/**
 * Failure of one analysis run inside a batch.
 */
public class AnalysisException extends RuntimeException {

    private final String source;

    public AnalysisException(String source, Throwable cause) {
        super("Analysis of '" + source + "' failed: " + cause.getMessage(), cause);
        this.source = source;
    }

    /**
     * Returns the name of the diagram whose analysis failed.
     *
     * @return source name
     */
    public String getSource() {
        return source;
    }
}
