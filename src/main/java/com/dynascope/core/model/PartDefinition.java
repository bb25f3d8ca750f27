package com.dynascope.core.model;

import java.io.Serializable;

/**
 * One block of the part definition table.
 */
public record PartDefinition(
    int partId,
    String name,
    int sectionId,
    int materialId,
    int materialType,
    String materialTypeName,
    int eosType,
    int hourglassType,
    double hourglassCoefficient,
    double density,
    double youngsModulus,
    double poissonRatio,
    int solidFormulation,
    String sectionTitle,
    String materialTitle
) implements Serializable {}
