package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Per-interface total from the warning message summary at the end of a message log.
 */
public record InterfaceWarningCount(int interfaceId, long count, int rank) implements RunRecord, Serializable {}
