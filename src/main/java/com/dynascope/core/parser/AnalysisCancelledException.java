package com.dynascope.core.parser;

/**
 * Thrown from a reader or analyzer once cancellation of the run has been requested.
 */
public class AnalysisCancelledException extends RuntimeException {

    public AnalysisCancelledException(String message) {
        super(message);
    }
}
