package com.dynascope.core.model;

import java.io.Serializable;

/**
 * A termination banner seen in a message log.
 */
public record TerminationMarker(TerminationState state, int rank) implements RunRecord, Serializable {}
