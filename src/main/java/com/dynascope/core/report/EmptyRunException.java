package com.dynascope.core.report;

/**
 * Thrown when no reader produced anything usable, so there is nothing to report on.
 */
public class EmptyRunException extends RuntimeException {

    public EmptyRunException(String directory) {
        super("No usable data was read from " + directory);
    }
}
