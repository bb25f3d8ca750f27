package com.dynascope.core.model;

/**
 * Marker for typed records produced by the readers that emit more than one
 * record type from a single file.
 */
public interface RunRecord {
}
