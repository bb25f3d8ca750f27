package com.dynascope.core.analysis;

import com.dynascope.core.model.ComponentImbalance;
import com.dynascope.core.model.ComponentTiming;
import com.dynascope.core.model.DecompositionMetrics;
import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.ProcessorLoadSample;
import com.dynascope.core.model.ProcessorTiming;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Where the run spent its time and how evenly the MPP ranks shared it.
 * <p>
 * Component shares come from the timing table of the high-speed-printer log
 * and, when that table is absent, from the mean percentages of the load profile.
 */
@Component
@Order(5)
public class PerformanceAnalyzer implements Analyzer {

    public static final String CATEGORY = "performance";

    static final double CONTACT_SHARE = 40.0;
    static final double PRIMARY_COST = 25.0;
    static final double SHARING_SHARE = 25.0;
    static final double FORCE_GATHER_SHARE = 10.0;
    static final double LOAD_VARIATION = 0.08;
    /** Components below this share of a rank's time are too small for a meaningful spread. */
    static final double LOAD_VARIATION_MIN_SHARE = 0.01;
    static final double CPU_RATIO_SPREAD = 0.15;
    static final double DECOMPOSITION_WARNING = 0.30;
    static final double DECOMPOSITION_CRITICAL = 0.50;

    @Override
    public String name() {
        return "performance";
    }

    @Override
    public List<Finding> analyze(AnalysisInputs inputs) {
        ParsedRun run = inputs.run();
        InputKind source = run.performance().components().isEmpty() ? InputKind.LOAD_PROFILE : InputKind.HSP;
        Map<String, Double> shares = componentShares(run);
        List<Finding> findings = new ArrayList<>();
        findings.addAll(primaryCosts(shares, source));
        findings.addAll(contactShare(shares, source));
        findings.addAll(sharingOverhead(shares, source));
        findings.addAll(forceGather(shares, source));
        findings.addAll(loadVariation(run.processorLoad()));
        findings.addAll(cpuRatioSpread(run.performance().processors()));
        findings.addAll(decomposition(run.performance().decomposition()));
        return findings;
    }

    /** Percent of run time per component, in table order. */
    public static Map<String, Double> componentShares(ParsedRun run) {
        Map<String, Double> shares = new LinkedHashMap<>();
        for (ComponentTiming timing : run.performance().components()) {
            shares.putIfAbsent(timing.component(), timing.cpuPercent());
        }
        if (!shares.isEmpty()) {
            return shares;
        }
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (ProcessorLoadSample sample : run.processorLoad()) {
            if (!Double.isNaN(sample.percent())) {
                double[] acc = sums.computeIfAbsent(sample.component(), k -> new double[2]);
                acc[0] += sample.percent();
                acc[1]++;
            }
        }
        sums.forEach((component, acc) -> shares.put(component, acc[0] / acc[1]));
        return shares;
    }

    /** Info per component above 25% of run time. */
    static List<Finding> primaryCosts(Map<String, Double> shares, InputKind source) {
        List<Finding> findings = new ArrayList<>();
        shares.forEach((component, percent) -> {
            if (percent > PRIMARY_COST) {
                findings.add(Finding.info(CATEGORY, "Primary cost: " + component,
                                String.format("%s takes %.1f%% of run time.", component, percent))
                        .withEvidence(Evidence.of(source, "component", component)));
            }
        });
        return findings;
    }

    /** Warning when contact components together exceed 40% of run time. */
    static List<Finding> contactShare(Map<String, Double> shares, InputKind source) {
        double contact = sumMatching(shares, "contact");
        if (contact <= CONTACT_SHARE) {
            return List.of();
        }
        return List.of(Finding.warning(CATEGORY, "Contact dominates run time",
                        String.format("Contact processing takes %.1f%% of run time.", contact))
                .withRecommendation("Limit contacts to the parts that interact, prefer segment sets over whole-model "
                        + "single-surface contacts, and review the bucket sort interval.")
                .withEvidence(Evidence.of(source, "component", "contact")));
    }

    /** Warning when communication (sharing) components together exceed 25% of run time. */
    static List<Finding> sharingOverhead(Map<String, Double> shares, InputKind source) {
        double sharing = 0.0;
        for (Map.Entry<String, Double> entry : shares.entrySet()) {
            if (ScalingModel.isCommunication(entry.getKey())) {
                sharing += entry.getValue();
            }
        }
        if (sharing <= SHARING_SHARE) {
            return List.of();
        }
        return List.of(Finding.warning(CATEGORY, "High communication overhead",
                        String.format("Sharing between ranks takes %.1f%% of run time.", sharing))
                .withRecommendation("The model is likely spread over too many ranks; try fewer processes or a "
                        + "decomposition that follows the model's geometry.")
                .withEvidence(Evidence.of(source, "component", "sharing")));
    }

    /** Warning when force gathering exceeds 10% of run time. */
    static List<Finding> forceGather(Map<String, Double> shares, InputKind source) {
        double gather = sumMatching(shares, "force gather");
        if (gather <= FORCE_GATHER_SHARE) {
            return List.of();
        }
        return List.of(Finding.warning(CATEGORY, "Force gather overhead",
                        String.format("Force gather takes %.1f%% of run time; rigid body forces are collected across ranks "
                                + "every cycle.", gather))
                .withRecommendation("Merge small rigid bodies with *CONSTRAINED_RIGID_BODIES, make unneeded rigid parts "
                        + "deformable, or reduce RCFORC output frequency.")
                .withEvidence(Evidence.of(source, "component", "force gather")));
    }

    /** Warning per component whose per-rank seconds vary by more than 8%. */
    static List<Finding> loadVariation(List<ProcessorLoadSample> samples) {
        double rankTotal = LoadStatistics.meanRankSeconds(samples);
        List<Finding> findings = new ArrayList<>();
        for (ComponentImbalance imbalance : LoadStatistics.imbalance(samples)) {
            if (imbalance.ranks() < 2 || imbalance.meanSeconds() < rankTotal * LOAD_VARIATION_MIN_SHARE) {
                continue;
            }
            if (imbalance.coefficientOfVariation() > LOAD_VARIATION) {
                findings.add(Finding.warning(CATEGORY, "Uneven load: " + imbalance.component(),
                                String.format("%s varies by %.1f%% across %d ranks (mean %.2f s, max %.2f s on rank %d).",
                                        imbalance.component(), imbalance.coefficientOfVariation() * 100.0, imbalance.ranks(),
                                        imbalance.meanSeconds(), imbalance.maximumSeconds(), imbalance.busiestRank()))
                        .withRecommendation("Balance the decomposition for this phase, for example with RCBLOG or contact "
                                + "weighting in *CONTROL_MPP_DECOMPOSITION.")
                        .withEvidence(Evidence.of(InputKind.LOAD_PROFILE, "component", imbalance.component())));
            }
        }
        return findings;
    }

    /** Warning when the CPU ratio of the slowest and fastest rank differ by more than 0.15. */
    static List<Finding> cpuRatioSpread(List<ProcessorTiming> processors) {
        if (processors.size() < 2) {
            return List.of();
        }
        ProcessorTiming slowest = processors.get(0);
        ProcessorTiming fastest = processors.get(0);
        for (ProcessorTiming processor : processors) {
            if (processor.cpuRatio() > slowest.cpuRatio()) {
                slowest = processor;
            }
            if (processor.cpuRatio() < fastest.cpuRatio()) {
                fastest = processor;
            }
        }
        double spread = slowest.cpuRatio() - fastest.cpuRatio();
        if (spread <= CPU_RATIO_SPREAD) {
            return List.of();
        }
        return List.of(Finding.warning(CATEGORY, "MPP load imbalance",
                        String.format("CPU ratio ranges from %.4f (rank %d, %s) to %.4f (rank %d, %s).",
                                fastest.cpuRatio(), fastest.rank(), fastest.hostname(),
                                slowest.cpuRatio(), slowest.rank(), slowest.hostname()))
                .withRecommendation("Review the domain decomposition, for example RCBLOG in *CONTROL_MPP_DECOMPOSITION.")
                .withEvidence(Evidence.of(InputKind.HSP, "rank", slowest.rank())));
    }

    /** Warning above 30% decomposition cost imbalance, Critical above 50%. */
    static List<Finding> decomposition(DecompositionMetrics metrics) {
        double imbalance = metrics.imbalance();
        if (imbalance <= DECOMPOSITION_WARNING) {
            return List.of();
        }
        String message = String.format("Decomposition cost ranges from %.4E to %.4E (%.1f%% imbalance).",
                metrics.minimumCost(), metrics.maximumCost(), imbalance * 100.0);
        Finding finding = imbalance > DECOMPOSITION_CRITICAL
                ? Finding.critical(CATEGORY, "Severe decomposition imbalance", message)
                : Finding.warning(CATEGORY, "Decomposition imbalance", message);
        return List.of(finding
                .withRecommendation("Weight the decomposition by element cost or change the decomposition method.")
                .withEvidence(Evidence.of(InputKind.HSP, "decomposition", "cost")));
    }

    private static double sumMatching(Map<String, Double> shares, String needle) {
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : shares.entrySet()) {
            if (entry.getKey().toLowerCase(Locale.ROOT).contains(needle)) {
                sum += entry.getValue();
            }
        }
        return sum;
    }
}
