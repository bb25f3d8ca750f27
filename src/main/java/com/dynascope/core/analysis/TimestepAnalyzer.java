package com.dynascope.core.analysis;

import com.dynascope.core.model.ControlSettings;
import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.PartTimestepGroup;
import com.dynascope.core.model.SmallestTimestep;
import com.dynascope.core.model.TimestepRecord;
import com.dynascope.core.model.TimestepSummary;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Timestep stability: collapse detection, controlling-element intervals and the
 * parts that own the smallest stable timesteps.
 */
@Component
@Order(3)
public class TimestepAnalyzer implements Analyzer {

    public static final String CATEGORY = "timestep";

    static final double COLLAPSE_DT = 1e-11;
    static final int TOP_ELEMENTS = 20;
    static final int TOP_FOR_PARTS = 100;
    static final double PART_DOMINANCE = 0.80;
    static final int PART_DOMINANCE_MIN_ENTRIES = 10;
    static final double SEVERE_DROP = 0.1;
    static final double NOTABLE_DROP = 0.5;

    private static final Comparator<SmallestTimestep> BY_DT =
            Comparator.comparingDouble(SmallestTimestep::dt).thenComparingLong(SmallestTimestep::elementId);

    @Override
    public String name() {
        return "timestep";
    }

    @Override
    public List<Finding> analyze(AnalysisInputs inputs) {
        ParsedRun run = inputs.run();
        List<Finding> findings = new ArrayList<>();
        findings.addAll(collapses(run.timesteps()));
        findings.addAll(timestepDrop(run.timesteps()));
        findings.addAll(contactControl(run.timesteps()));
        findings.addAll(partDominance(run.smallestTimesteps(), inputs::partName));
        if (run.model() != null) {
            findings.addAll(massScaling(run.model().control()));
        }
        return FindingOrder.byObservation(findings);
    }

    /** Interval compression, top elements and part grouping for the report. */
    public static TimestepSummary summarize(ParsedRun run, IntFunction<String> partNames) {
        List<TimestepRecord> records = run.timesteps();
        double initial = Double.NaN;
        double last = Double.NaN;
        double minimum = Double.NaN;
        for (TimestepRecord record : records) {
            if (Double.isNaN(initial)) {
                initial = record.dt();
            }
            last = record.dt();
            if (Double.isNaN(minimum) || record.dt() < minimum) {
                minimum = record.dt();
            }
        }
        List<SmallestTimestep> ranked = rankSmallest(run.smallestTimesteps());
        return new TimestepSummary(
                ControllingIntervals.compress(records),
                ranked.subList(0, Math.min(TOP_ELEMENTS, ranked.size())),
                groupByPart(ranked.subList(0, Math.min(TOP_FOR_PARTS, ranked.size())), partNames),
                initial,
                last,
                minimum);
    }

    static List<SmallestTimestep> rankSmallest(List<SmallestTimestep> rows) {
        List<SmallestTimestep> ranked = new ArrayList<>(rows);
        ranked.sort(BY_DT);
        return ranked;
    }

    /** Parts of the given rows, ascending by their smallest dt. */
    static List<PartTimestepGroup> groupByPart(List<SmallestTimestep> rows, IntFunction<String> partNames) {
        Map<Integer, int[]> counts = new LinkedHashMap<>();
        Map<Integer, Double> minima = new LinkedHashMap<>();
        for (SmallestTimestep row : rows) {
            counts.computeIfAbsent(row.partId(), k -> new int[1])[0]++;
            minima.merge(row.partId(), row.dt(), Math::min);
        }
        List<PartTimestepGroup> groups = new ArrayList<>();
        for (Map.Entry<Integer, int[]> entry : counts.entrySet()) {
            int partId = entry.getKey();
            groups.add(new PartTimestepGroup(partId, partNames.apply(partId), entry.getValue()[0], minima.get(partId)));
        }
        groups.sort(Comparator.comparingDouble(PartTimestepGroup::minimumDt).thenComparingInt(PartTimestepGroup::partId));
        return groups;
    }

    /** One Critical per reported cycle whose timestep fell below 1e-11. */
    static List<Finding> collapses(List<TimestepRecord> records) {
        List<Finding> findings = new ArrayList<>();
        for (TimestepRecord record : records) {
            if (record.dt() < COLLAPSE_DT) {
                findings.add(Finding.critical(CATEGORY, "Timestep collapse",
                                String.format("dt=%.3E at cycle %d (t=%.4E), controlled by %s.",
                                        record.dt(), record.cycle(), record.time(), controller(record)))
                        .withRecommendation("Inspect the controlling element for severe distortion; add erosion with a "
                                + "TSMIN or remesh the region.")
                        .withEvidence(reference(record)));
            }
        }
        return findings;
    }

    static String controller(TimestepRecord record) {
        if (!record.hasController()) {
            return "an unreported controller";
        }
        String named = record.elementType() + " " + record.elementId();
        return record.partId() > 0 ? named + " of part " + record.partId() : named;
    }

    private static Evidence reference(TimestepRecord record) {
        if (!record.hasController()) {
            return Evidence.sample(record.source(), "timestep", record.cycle(), record.time());
        }
        String entity = "contact".equals(record.elementType()) ? "contact" : "element";
        return Evidence.at(record.source(), entity, record.elementId(), record.cycle(), record.time());
    }

    /** Warning when the last timestep is below 10% of the first; Info below 50%. */
    static List<Finding> timestepDrop(List<TimestepRecord> records) {
        if (records.size() < 2) {
            return List.of();
        }
        TimestepRecord first = records.get(0);
        TimestepRecord last = records.get(records.size() - 1);
        if (first.dt() <= 0.0) {
            return List.of();
        }
        double ratio = last.dt() / first.dt();
        String message = String.format("Timestep fell from %.3E to %.3E (%.1f%% of the initial value) by cycle %d.",
                first.dt(), last.dt(), ratio * 100.0, last.cycle());
        Evidence ref = reference(last);
        if (ratio < SEVERE_DROP) {
            return List.of(Finding.warning(CATEGORY, "Timestep dropped below 10% of initial", message)
                    .withRecommendation("Find the elements that distort most and consider erosion, remeshing or "
                            + "selective mass scaling.")
                    .withEvidence(ref));
        }
        if (ratio < NOTABLE_DROP) {
            return List.of(Finding.info(CATEGORY, "Timestep dropped below 50% of initial", message).withEvidence(ref));
        }
        return List.of();
    }

    /** Info at the first cycle whose timestep is set by a contact rather than an element. */
    static List<Finding> contactControl(List<TimestepRecord> records) {
        for (TimestepRecord record : records) {
            if ("contact".equals(record.elementType())) {
                return List.of(Finding.info(CATEGORY, "Timestep controlled by contact",
                                String.format("Contact %d sets the timestep at cycle %d (t=%.4E).",
                                        record.elementId(), record.cycle(), record.time()))
                        .withEvidence(Evidence.at(record.source(), "contact", record.elementId(), record.cycle(), record.time())));
            }
        }
        return List.of();
    }

    /** Warning when one part owns more than 80% of the smallest-timestep entries. */
    static List<Finding> partDominance(List<SmallestTimestep> rows, IntFunction<String> partNames) {
        List<SmallestTimestep> ranked = rankSmallest(rows);
        List<SmallestTimestep> top = ranked.subList(0, Math.min(TOP_FOR_PARTS, ranked.size()));
        if (top.size() < PART_DOMINANCE_MIN_ENTRIES) {
            return List.of();
        }
        for (PartTimestepGroup group : groupByPart(top, partNames)) {
            double share = (double) group.elementCount() / top.size();
            if (share > PART_DOMINANCE) {
                return List.of(Finding.warning(CATEGORY, "One part controls the timestep",
                                String.format("Part %d (%s) owns %d of the %d smallest timesteps (%.0f%%), minimum dt %.3E.",
                                        group.partId(), group.partName(), group.elementCount(), top.size(),
                                        share * 100.0, group.minimumDt()))
                        .withRecommendation("Coarsen or regularise the mesh of this part, or apply selective mass scaling to it.")
                        .withEvidence(Evidence.of(InputKind.HSP, "part", group.partId())));
            }
        }
        return List.of();
    }

    /** Info when the control settings request mass scaling. */
    static List<Finding> massScaling(ControlSettings control) {
        if (!control.massScalingActive()) {
            return List.of();
        }
        return List.of(Finding.info(CATEGORY, "Mass scaling active",
                        String.format("Mass scaling is active with target dt %.3E; check that added mass stays small.",
                                control.massScalingDt()))
                .withEvidence(Evidence.of(InputKind.HSP, "control", "dt2ms")));
    }
}
