package com.dynascope.core.analysis;

import com.dynascope.core.model.EnergySample;
import com.dynascope.core.model.EnergyTimeSeries;
import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.MaterialSample;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Energy balance rules over the global energy series and the per-part material summary.
 * Each rule is a static function of the series so it can be tested on its own.
 */
@Component
@Order(2)
public class EnergyAnalyzer implements Analyzer {

    public static final String CATEGORY = "energy";

    static final double HOURGLASS_WARNING = 0.10;
    static final double HOURGLASS_CRITICAL = 0.20;
    static final double RATIO_LOW = 0.95;
    static final double RATIO_HIGH = 1.05;
    static final double RATIO_DEPARTURE = 4.0;
    static final double KINETIC_JUMP = 100.0;
    static final double KINETIC_TO_INTERNAL = 10.0;
    static final double SLIDING_SHARE = 0.30;
    static final double SLIDING_SPIKE = 50.0;
    static final double TOTAL_GROWTH = 0.05;
    static final double PART_HOURGLASS = 0.10;

    @Override
    public String name() {
        return "energy";
    }

    @Override
    public List<Finding> analyze(AnalysisInputs inputs) {
        EnergyTimeSeries series = inputs.run().energy();
        List<Finding> findings = new ArrayList<>();
        findings.addAll(hourglassGrowth(series));
        List<Finding> departures = ratioDepartures(series);
        findings.addAll(departures);
        if (departures.isEmpty()) {
            findings.addAll(finalRatio(series));
        }
        findings.addAll(kineticJumps(series));
        findings.addAll(kineticDominance(series));
        findings.addAll(slidingEnergy(series));
        findings.addAll(negativeInternal(series));
        findings.addAll(totalGrowth(series));
        findings.addAll(partHourglass(inputs.run().materials(), inputs));
        return FindingOrder.byObservation(findings);
    }

    /** Warning at the first sample whose hourglass/internal ratio passes 10%, Critical at the first past 20%. */
    static List<Finding> hourglassGrowth(EnergyTimeSeries series) {
        List<Finding> findings = new ArrayList<>();
        boolean warned = false;
        for (EnergySample s : series.samples()) {
            double ratio = s.hourglassRatio();
            if (!warned && ratio > HOURGLASS_WARNING) {
                warned = true;
                findings.add(Finding.warning(CATEGORY, "Hourglass energy exceeds 10% of internal energy",
                                String.format("Hourglass/internal energy reached %.1f%% at cycle %d (t=%.4E).",
                                        ratio * 100.0, s.cycle(), s.time()))
                        .withRecommendation("Review hourglass control: type 4 or 5 with a suitable QH, or fully integrated "
                                + "formulations (ELFORM=2 for solids, 16 for shells).")
                        .withEvidence(sampleRef(s)));
            }
            if (ratio > HOURGLASS_CRITICAL) {
                findings.add(Finding.critical(CATEGORY, "Hourglass energy exceeds 20% of internal energy",
                                String.format("Hourglass/internal energy reached %.1f%% at cycle %d (t=%.4E); "
                                        + "zero-energy modes dominate the deformation.", ratio * 100.0, s.cycle(), s.time()))
                        .withRecommendation("Switch the affected parts to fully integrated elements or stiffness-based "
                                + "hourglass control, and refine the mesh where deformation concentrates.")
                        .withEvidence(sampleRef(s)));
                break;
            }
        }
        return findings;
    }

    /**
     * Distance of an energy ratio from the [0.95, 1.05] band; 0 inside the band.
     */
    static double ratioDeparture(double ratio) {
        if (ratio < RATIO_LOW) {
            return RATIO_LOW - ratio;
        }
        if (ratio > RATIO_HIGH) {
            return ratio - RATIO_HIGH;
        }
        return 0.0;
    }

    /** One Critical per sample whose energy ratio lies more than 4.0 outside the balance band. */
    static List<Finding> ratioDepartures(EnergyTimeSeries series) {
        List<Finding> findings = new ArrayList<>();
        for (EnergySample s : series.samples()) {
            if (Double.isNaN(s.ratio()) || ratioDeparture(s.ratio()) <= RATIO_DEPARTURE) {
                continue;
            }
            findings.add(Finding.critical(CATEGORY, "Energy balance violated",
                            String.format("Total/initial energy ratio is %.4f at cycle %d (t=%.4E), far outside [%.2f, %.2f].",
                                    s.ratio(), s.cycle(), s.time(), RATIO_LOW, RATIO_HIGH))
                    .withRecommendation("Locate the energy source: contact energy growth, mass scaling, or loads "
                            + "applied without matching external work. *CONTROL_ENERGY output helps.")
                    .withEvidence(sampleRef(s)));
        }
        return findings;
    }

    /** Warning when the last reported energy ratio sits outside the balance band. */
    static List<Finding> finalRatio(EnergyTimeSeries series) {
        EnergySample last = null;
        for (EnergySample s : series.samples()) {
            if (!Double.isNaN(s.ratio())) {
                last = s;
            }
        }
        if (last == null || ratioDeparture(last.ratio()) == 0.0) {
            return List.of();
        }
        return List.of(Finding.warning(CATEGORY, "Final energy ratio outside balance band",
                        String.format("Total/initial energy ratio ends at %.4f (t=%.4E), outside [%.2f, %.2f].",
                                last.ratio(), last.time(), RATIO_LOW, RATIO_HIGH))
                .withRecommendation("Compare the energy components over time to find which one drifts.")
                .withEvidence(sampleRef(last)));
    }

    /** Warning per pair of consecutive samples where kinetic energy grows 100-fold or more. */
    static List<Finding> kineticJumps(EnergyTimeSeries series) {
        List<Finding> findings = new ArrayList<>();
        EnergySample previous = null;
        for (EnergySample s : series.samples()) {
            if (previous != null && previous.kinetic() > 0.0 && s.kinetic() / previous.kinetic() >= KINETIC_JUMP) {
                findings.add(Finding.warning(CATEGORY, "Kinetic energy jump",
                                String.format("Kinetic energy grew %.0fx between cycle %d and cycle %d (t=%.4E).",
                                        s.kinetic() / previous.kinetic(), previous.cycle(), s.cycle(), s.time()))
                        .withRecommendation("Look for sudden loads, contact releases or nodes being launched at this time.")
                        .withEvidence(sampleRef(s)));
            }
            previous = s;
        }
        return findings;
    }

    /** Warning at the first sample where kinetic energy exceeds ten times internal energy. */
    static List<Finding> kineticDominance(EnergyTimeSeries series) {
        for (EnergySample s : series.samples()) {
            if (s.internal() > 0.0 && s.kinetic() / s.internal() > KINETIC_TO_INTERNAL) {
                return List.of(Finding.warning(CATEGORY, "Kinetic energy dominates internal energy",
                                String.format("Kinetic/internal energy ratio is %.1f at cycle %d (t=%.4E).",
                                        s.kinetic() / s.internal(), s.cycle(), s.time()))
                        .withRecommendation("For quasi-static problems reduce the loading rate or the mass scaling; "
                                + "otherwise confirm that the parts are actually deforming.")
                        .withEvidence(sampleRef(s)));
            }
        }
        return List.of();
    }

    /** Warning when sliding energy passes 30% of total energy (once) and per 50-fold spike. */
    static List<Finding> slidingEnergy(EnergyTimeSeries series) {
        List<Finding> findings = new ArrayList<>();
        boolean shareReported = false;
        EnergySample previous = null;
        for (EnergySample s : series.samples()) {
            if (!shareReported && s.total() > 0.0 && Math.abs(s.sliding()) / s.total() > SLIDING_SHARE) {
                shareReported = true;
                findings.add(Finding.warning(CATEGORY, "High sliding interface energy",
                                String.format("Sliding interface energy is %.1f%% of total energy at cycle %d (t=%.4E).",
                                        Math.abs(s.sliding()) / s.total() * 100.0, s.cycle(), s.time()))
                        .withRecommendation("Check contacts for excessive penetration; raise SLSFAC or use SOFT=1.")
                        .withEvidence(sampleRef(s)));
            }
            if (previous != null && Math.abs(previous.sliding()) > 0.0
                    && Math.abs(s.sliding()) / Math.abs(previous.sliding()) >= SLIDING_SPIKE) {
                findings.add(Finding.warning(CATEGORY, "Sliding interface energy spike",
                                String.format("Sliding interface energy grew %.0fx between cycle %d and cycle %d (t=%.4E).",
                                        Math.abs(s.sliding()) / Math.abs(previous.sliding()), previous.cycle(), s.cycle(), s.time()))
                        .withRecommendation("Identify the contact interface that engages at this time and check it for "
                                + "initial penetrations or mismatched stiffness.")
                        .withEvidence(sampleRef(s)));
            }
            previous = s;
        }
        return findings;
    }

    /** Critical at the first sample reporting negative internal energy. */
    static List<Finding> negativeInternal(EnergyTimeSeries series) {
        for (EnergySample s : series.samples()) {
            if (s.internal() < 0.0) {
                return List.of(Finding.critical(CATEGORY, "Negative internal energy",
                                String.format("Internal energy is %.4E at cycle %d (t=%.4E).", s.internal(), s.cycle(), s.time()))
                        .withRecommendation("Negative internal energy is nonphysical; check material models and "
                                + "elements with inverted or collapsed geometry.")
                        .withEvidence(sampleRef(s)));
            }
        }
        return List.of();
    }

    /** Warning when total energy at the end exceeds the initial total energy by more than 5%. */
    static List<Finding> totalGrowth(EnergyTimeSeries series) {
        if (series.size() < 3) {
            return List.of();
        }
        EnergySample first = series.samples().get(0);
        EnergySample last = series.samples().get(series.size() - 1);
        if (first.total() <= 0.0 || (last.total() - first.total()) / first.total() <= TOTAL_GROWTH) {
            return List.of();
        }
        return List.of(Finding.warning(CATEGORY, "Total energy is growing",
                        String.format("Total energy grew from %.4E to %.4E (%.1f%%).",
                                first.total(), last.total(), (last.total() / first.total() - 1.0) * 100.0))
                .withRecommendation("Unless external work accounts for it, reduce the timestep scale factor and check "
                        + "contacts for initial penetrations.")
                .withEvidence(sampleRef(last)));
    }

    /** Warning per part whose last material-summary state has hourglass energy above 10% of internal. */
    static List<Finding> partHourglass(List<MaterialSample> materials, AnalysisInputs inputs) {
        Map<Integer, MaterialSample> lastByPart = new LinkedHashMap<>();
        for (MaterialSample sample : materials) {
            lastByPart.put(sample.partId(), sample);
        }
        List<Finding> findings = new ArrayList<>();
        for (MaterialSample last : lastByPart.values()) {
            if (last.internal() <= 0.0 || last.hourglass() / last.internal() <= PART_HOURGLASS) {
                continue;
            }
            String name = last.name().isBlank() ? inputs.partName(last.partId()) : last.name();
            findings.add(Finding.warning(CATEGORY, "Part hourglass energy above 10%",
                            String.format("Part %d (%s) ends with hourglass energy at %.1f%% of its internal energy.",
                                    last.partId(), name, last.hourglass() / last.internal() * 100.0))
                    .withRecommendation("Apply stiffer hourglass control or a fully integrated section to this part.")
                    .withEvidence(Evidence.at(InputKind.MATSUM, "part", last.partId(), last.cycle(), last.time())));
        }
        return findings;
    }

    private static Evidence sampleRef(EnergySample s) {
        return Evidence.sample(s.source(), "energy-sample", s.cycle(), s.time());
    }
}
