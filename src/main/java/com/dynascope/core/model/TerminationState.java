package com.dynascope.core.model;

/**
 * How the solver run ended.
 */
public enum TerminationState {
    NORMAL,
    ERROR_TERMINATED,
    INCOMPLETE
}
