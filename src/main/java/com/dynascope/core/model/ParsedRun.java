package com.dynascope.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Materialized output of every reader except the time-history readers, joined
 * before analysis starts.
 */
public record ParsedRun(
    ModelSummary model,
    TerminationStatus termination,
    List<PartDefinition> parts,
    List<ContactDefinition> contacts,
    PerformanceProfile performance,
    EnergyTimeSeries energy,
    List<TimestepRecord> timesteps,
    List<SmallestTimestep> smallestTimesteps,
    List<WarningEvent> warnings,
    List<InitialPenetration> penetrations,
    List<InterfaceWarningCount> interfaceWarningCounts,
    List<MemoryRequest> memoryRequests,
    List<StatusSample> status,
    List<MaterialSample> materials,
    List<ProcessorLoadSample> processorLoad,
    List<InterfaceLoadSample> interfaceLoad,
    Coverage coverage
) {

    public ParsedRun {
        parts = List.copyOf(parts);
        contacts = List.copyOf(contacts);
        timesteps = List.copyOf(timesteps);
        smallestTimesteps = List.copyOf(smallestTimesteps);
        warnings = List.copyOf(warnings);
        penetrations = List.copyOf(penetrations);
        interfaceWarningCounts = List.copyOf(interfaceWarningCounts);
        memoryRequests = List.copyOf(memoryRequests);
        status = List.copyOf(status);
        materials = List.copyOf(materials);
        processorLoad = List.copyOf(processorLoad);
        interfaceLoad = List.copyOf(interfaceLoad);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** True when no reader produced anything usable. */
    public boolean isEmpty() {
        return model == null && termination == null && parts.isEmpty() && contacts.isEmpty()
                && performance.isEmpty() && energy.isEmpty() && timesteps.isEmpty()
                && smallestTimesteps.isEmpty() && warnings.isEmpty() && penetrations.isEmpty()
                && interfaceWarningCounts.isEmpty() && memoryRequests.isEmpty() && status.isEmpty()
                && materials.isEmpty() && processorLoad.isEmpty() && interfaceLoad.isEmpty();
    }

    public static final class Builder {

        private ModelSummary model;
        private TerminationStatus termination;
        private List<PartDefinition> parts = List.of();
        private List<ContactDefinition> contacts = List.of();
        private PerformanceProfile performance = PerformanceProfile.empty();
        private EnergyTimeSeries energy = EnergyTimeSeries.empty();
        private List<TimestepRecord> timesteps = List.of();
        private List<SmallestTimestep> smallestTimesteps = List.of();
        private final List<WarningEvent> warnings = new ArrayList<>();
        private final List<InitialPenetration> penetrations = new ArrayList<>();
        private final List<InterfaceWarningCount> interfaceWarningCounts = new ArrayList<>();
        private final List<MemoryRequest> memoryRequests = new ArrayList<>();
        private List<StatusSample> status = List.of();
        private List<MaterialSample> materials = List.of();
        private List<ProcessorLoadSample> processorLoad = List.of();
        private List<InterfaceLoadSample> interfaceLoad = List.of();
        private Coverage coverage = new Coverage(List.of(), List.of(), List.of(), Map.of());

        private Builder() {}

        public Builder model(ModelSummary model) { this.model = model; return this; }
        public Builder termination(TerminationStatus termination) { this.termination = termination; return this; }
        public Builder parts(List<PartDefinition> parts) { this.parts = parts; return this; }
        public Builder contacts(List<ContactDefinition> contacts) { this.contacts = contacts; return this; }
        public Builder performance(PerformanceProfile performance) { this.performance = performance; return this; }
        public Builder energy(EnergyTimeSeries energy) { this.energy = energy; return this; }
        public Builder timesteps(List<TimestepRecord> timesteps) { this.timesteps = timesteps; return this; }
        public Builder smallestTimesteps(List<SmallestTimestep> rows) { this.smallestTimesteps = rows; return this; }
        public Builder addWarnings(List<WarningEvent> events) { this.warnings.addAll(events); return this; }
        public Builder addPenetrations(List<InitialPenetration> rows) { this.penetrations.addAll(rows); return this; }
        public Builder addInterfaceWarningCounts(List<InterfaceWarningCount> rows) { this.interfaceWarningCounts.addAll(rows); return this; }
        public Builder addMemoryRequests(List<MemoryRequest> rows) { this.memoryRequests.addAll(rows); return this; }
        public Builder status(List<StatusSample> status) { this.status = status; return this; }
        public Builder materials(List<MaterialSample> materials) { this.materials = materials; return this; }
        public Builder processorLoad(List<ProcessorLoadSample> samples) { this.processorLoad = samples; return this; }
        public Builder interfaceLoad(List<InterfaceLoadSample> samples) { this.interfaceLoad = samples; return this; }
        public Builder coverage(Coverage coverage) { this.coverage = coverage; return this; }

        public ParsedRun build() {
            return new ParsedRun(model, termination, parts, contacts, performance, energy, timesteps,
                    smallestTimesteps, warnings, penetrations, interfaceWarningCounts, memoryRequests,
                    status, materials, processorLoad, interfaceLoad, coverage);
        }
    }
}
