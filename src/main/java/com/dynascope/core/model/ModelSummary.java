package com.dynascope.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structural statistics of the model, built once from the high-speed-printer log.
 *
 * @param keywordCounts non-zero keyword card counts, sorted by keyword
 */
public record ModelSummary(
    SimulationHeader header,
    ControlSettings control,
    int materials,
    long nodes,
    long solids,
    long shells,
    long beams,
    long thickShells,
    long sphParticles,
    int contacts,
    long spcNodes,
    int parts,
    Map<String, Integer> keywordCounts,
    List<MassProperty> massProperties
) implements RunRecord, Serializable {

    public ModelSummary {
        keywordCounts = Collections.unmodifiableMap(new TreeMap<>(keywordCounts));
        massProperties = List.copyOf(massProperties);
    }

    public long elements() {
        return solids + shells + beams + thickShells;
    }

    public double totalMass() {
        return massProperties.stream().mapToDouble(MassProperty::totalMass).sum();
    }
}
