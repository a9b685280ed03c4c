package com.stridegraph.core.io;

/**
 * Raised when a detection file is structurally invalid (bad JSON, missing image block,
 * unknown coordinate system).
 *
 * <p>Individual malformed detections are not format errors; they reach the normalizer and
 * become diagnostics.
 */
public class DetectionFormatException extends RuntimeException {

    public DetectionFormatException(String message) {
        super(message);
    }

    public DetectionFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
