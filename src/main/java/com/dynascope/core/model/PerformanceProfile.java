package com.dynascope.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Timing tables from the tail of the high-speed-printer log.
 */
public record PerformanceProfile(
    List<ComponentTiming> components,
    List<InterfaceTiming> interfaces,
    List<ProcessorTiming> processors,
    DecompositionMetrics decomposition
) implements RunRecord, Serializable {

    public PerformanceProfile {
        components = List.copyOf(components);
        interfaces = List.copyOf(interfaces);
        processors = List.copyOf(processors);
    }

    public static PerformanceProfile empty() {
        return new PerformanceProfile(List.of(), List.of(), List.of(), DecompositionMetrics.empty());
    }

    public boolean isEmpty() {
        return components.isEmpty() && interfaces.isEmpty() && processors.isEmpty()
                && decomposition.maximumCost() <= 0.0;
    }
}
