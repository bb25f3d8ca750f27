package com.dynascope.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The complete diagnosis of one run, handed to renderers. Contains no wall-clock
 * data, so identical inputs produce equal reports.
 *
 * @param model         structural statistics, {@code null} without a high-speed-printer log
 * @param termination   end-of-run summary, {@code null} when no log reports one
 * @param warningCounts occurrences per warning/error code, sorted by code
 * @param findings      findings in analyzer order, each in evidence order
 */
public record Report(
    String directory,
    ModelSummary model,
    TerminationStatus termination,
    Coverage coverage,
    List<PartDefinition> parts,
    EnergyTimeSeries energy,
    TimestepSummary timestep,
    List<ContactInterfaceSummary> contacts,
    PerformanceProfile performance,
    List<ComponentImbalance> loadBalance,
    List<ScalingProjection> scaling,
    Map<Integer, Long> warningCounts,
    List<Finding> findings
) implements Serializable {

    public Report {
        parts = List.copyOf(parts);
        contacts = List.copyOf(contacts);
        loadBalance = List.copyOf(loadBalance);
        scaling = List.copyOf(scaling);
        warningCounts = Collections.unmodifiableMap(new TreeMap<>(warningCounts));
        findings = List.copyOf(findings);
    }

    public long count(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).count();
    }

    public List<Finding> findingsIn(String category) {
        return findings.stream().filter(f -> f.category().equals(category)).toList();
    }
}
