package com.stridegraph.core.rules;

/**
 * Fatal configuration error raised when a rule table cannot be loaded or fails validation.
 *
 * <p>The engine refuses to run with an invalid table rather than produce partial analyses.
 */
public class RuleTableException extends RuntimeException {

    public RuleTableException(String message) {
        super(message);
    }

    public RuleTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
