package com.dynascope.core.model;

import java.io.Serializable;

/**
 * A dynamic memory expansion reported by one rank, in words.
 */
public record MemoryRequest(long words, long secondaryWords, int rank) implements RunRecord, Serializable {}
