package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Clock seconds one MPP rank spent in one contact interface.
 */
public record InterfaceLoadSample(
    int interfaceId,
    int rank,
    double seconds
) implements Serializable {}
