package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Mass, mass centre and principal inertias of one part.
 */
public record MassProperty(
    int partId,
    double totalMass,
    double centerX,
    double centerY,
    double centerZ,
    double i11,
    double i22,
    double i33
) implements Serializable {}
