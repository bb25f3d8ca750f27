package com.dynascope.core.model;

import java.io.Serializable;

/**
 * "N initial penetrations were found for interface I".
 */
public record InitialPenetration(int interfaceId, long count, int rank) implements RunRecord, Serializable {}
