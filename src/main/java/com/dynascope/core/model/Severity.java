package com.dynascope.core.model;

/**
 * How urgently a {@link Finding} needs attention.
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
