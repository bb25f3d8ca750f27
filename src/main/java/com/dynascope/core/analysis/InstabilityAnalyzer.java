package com.dynascope.core.analysis;

import com.dynascope.core.config.DynascopeProperties;
import com.dynascope.core.model.BoundaryForceSample;
import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.NodalSample;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.LongFunction;
import java.util.stream.Stream;

/**
 * Numerical instability in the nodal and boundary-force time histories.
 * <p>
 * Both histories are consumed as single-pass streams. Per-node state is a fixed-size
 * trailing window or a handful of scalars, so memory depends on the tracked-node
 * cap and the window length, never on the number of output steps.
 */
@Component
@Order(7)
public class InstabilityAnalyzer implements Analyzer {

    public static final String CATEGORY = "instability";

    static final double SHOOTING_SPEED = 1000.0;
    static final double FREQUENCY_LIMIT_HZ = 1.0e4;
    static final int MIN_OSCILLATION_SAMPLES = 10;
    static final double SPIKE_RATIO = 100.0;
    static final int MIN_SPIKE_SAMPLES = 5;
    static final double NEGLIGIBLE_FORCE = 1.0e-9;
    static final double ALTERNATION = 0.8;
    static final double SUSTAINED_AMPLITUDE = 0.8;

    private static final String[] AXES = {"x", "y", "z"};

    private final DynascopeProperties properties;

    public InstabilityAnalyzer(DynascopeProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "instability";
    }

    @Override
    public List<Finding> analyze(AnalysisInputs inputs) {
        LongFunction<String> nodeLabel = nodeId -> describeNode(inputs, nodeId);
        List<Finding> findings = new ArrayList<>();
        try (Stream<NodalSample> samples = inputs.timeHistory().nodal()) {
            findings.addAll(shootingNodes(samples, nodeLabel));
        }
        try (Stream<NodalSample> samples = inputs.timeHistory().nodal()) {
            findings.addAll(highFrequency(samples, properties.getAnalysis().getOscillationWindow(), nodeLabel));
        }
        try (Stream<BoundaryForceSample> samples = inputs.timeHistory().boundary()) {
            findings.addAll(forceSpikes(samples, nodeLabel));
        }
        try (Stream<BoundaryForceSample> samples = inputs.timeHistory().boundary()) {
            findings.addAll(dampingDeficiency(samples, properties.getAnalysis().getDampingWindow(), nodeLabel));
        }
        return FindingOrder.byObservation(findings);
    }

    /**
     * One Critical per node whose speed ever exceeds {@link #SHOOTING_SPEED}, in order of
     * first exceedance. The evidence names the first exceeding step and the peak step.
     */
    static List<Finding> shootingNodes(Stream<NodalSample> samples, LongFunction<String> nodeLabel) {
        Map<Long, NodalSample> first = new LinkedHashMap<>();
        Map<Long, NodalSample> peak = new LinkedHashMap<>();
        samples.forEach(sample -> {
            if (sample.speed() > SHOOTING_SPEED) {
                first.putIfAbsent(sample.nodeId(), sample);
                peak.merge(sample.nodeId(), sample, (a, b) -> b.speed() > a.speed() ? b : a);
            }
        });
        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<Long, NodalSample> entry : first.entrySet()) {
            NodalSample start = entry.getValue();
            NodalSample top = peak.get(entry.getKey());
            findings.add(Finding.critical(CATEGORY, "Shooting node " + entry.getKey(),
                            String.format("%s reaches a speed of %.4g (limit %.0f) at t=%.6g, first exceeding "
                                            + "the limit at t=%.6g.",
                                    nodeLabel.apply(entry.getKey()), top.speed(), SHOOTING_SPEED,
                                    top.time(), start.time()))
                    .withRecommendation("Check constraints, contact penalty stiffness and rigid body connections "
                            + "around this node.")
                    .withEvidence(nodeEvidence(start), nodeEvidence(top)));
        }
        return findings;
    }

    /**
     * Warning per node once the zero-crossing frequency of any velocity component over
     * the trailing {@code window} samples exceeds {@link #FREQUENCY_LIMIT_HZ}.
     */
    static List<Finding> highFrequency(Stream<NodalSample> samples, int window, LongFunction<String> nodeLabel) {
        OscillationDetector<AxisKey> detector = new OscillationDetector<>(window);
        Set<Long> flagged = new HashSet<>();
        List<Finding> findings = new ArrayList<>();
        samples.forEach(sample -> {
            if (flagged.contains(sample.nodeId())) {
                return;
            }
            double[] velocity = {sample.xVelocity(), sample.yVelocity(), sample.zVelocity()};
            for (int axis = 0; axis < AXES.length; axis++) {
                AxisKey key = new AxisKey(sample.nodeId(), axis);
                detector.record(key, sample.time(), velocity[axis]);
                if (detector.sampleCount(key) < MIN_OSCILLATION_SAMPLES) {
                    continue;
                }
                double frequency = detector.zeroCrossingFrequency(key);
                if (frequency > FREQUENCY_LIMIT_HZ) {
                    flagged.add(sample.nodeId());
                    findings.add(Finding.warning(CATEGORY, "High-frequency oscillation at node " + sample.nodeId(),
                                    String.format("%s %s-velocity changes sign at about %.4g Hz over the last %d "
                                                    + "output steps (limit %.0f Hz).",
                                            nodeLabel.apply(sample.nodeId()), AXES[axis], frequency,
                                            detector.sampleCount(key), FREQUENCY_LIMIT_HZ))
                            .withRecommendation("Look for hourglassing, overly stiff contact or poorly connected "
                                    + "elements near this node.")
                            .withEvidence(nodeEvidence(sample)));
                    for (int other = 0; other < AXES.length; other++) {
                        detector.clearHistory(new AxisKey(sample.nodeId(), other));
                    }
                    return;
                }
            }
        });
        return findings;
    }

    /**
     * Warning per node whose peak force magnitude exceeds {@link #SPIKE_RATIO} times the
     * series mean, referencing the peak step.
     */
    static List<Finding> forceSpikes(Stream<BoundaryForceSample> samples, LongFunction<String> nodeLabel) {
        Map<Long, ForceStatistics> statistics = new LinkedHashMap<>();
        samples.forEach(sample -> statistics.computeIfAbsent(sample.nodeId(), id -> new ForceStatistics()).add(sample));
        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<Long, ForceStatistics> entry : statistics.entrySet()) {
            ForceStatistics stats = entry.getValue();
            double mean = stats.sum / stats.count;
            if (stats.count < MIN_SPIKE_SAMPLES || mean <= NEGLIGIBLE_FORCE) {
                continue;
            }
            double ratio = stats.peak.forceMagnitude() / mean;
            if (ratio > SPIKE_RATIO) {
                findings.add(Finding.warning(CATEGORY, "Boundary force spike at node " + entry.getKey(),
                                String.format("%s peaks at %.4g, %.0f times its mean force of %.4g, at t=%.6g.",
                                        nodeLabel.apply(entry.getKey()), stats.peak.forceMagnitude(), ratio, mean,
                                        stats.peak.time()))
                        .withRecommendation("Check for impact against a constraint or a sudden change in a "
                                + "prescribed motion at this node.")
                        .withEvidence(boundaryEvidence(stats.peak)));
            }
        }
        return findings;
    }

    /**
     * Warning per node whose reaction force keeps alternating sign without losing
     * amplitude over the trailing {@code window} samples. Windows that never fill are
     * judged at the end of the stream when they hold enough samples.
     */
    static List<Finding> dampingDeficiency(Stream<BoundaryForceSample> samples, int window,
                                           LongFunction<String> nodeLabel) {
        OscillationDetector<AxisKey> detector = new OscillationDetector<>(window);
        Set<Long> flagged = new HashSet<>();
        Map<Long, BoundaryForceSample> latest = new LinkedHashMap<>();
        List<Finding> findings = new ArrayList<>();
        samples.forEach(sample -> {
            if (flagged.contains(sample.nodeId())) {
                return;
            }
            latest.put(sample.nodeId(), sample);
            double[] force = {sample.xForce(), sample.yForce(), sample.zForce()};
            for (int axis = 0; axis < AXES.length; axis++) {
                AxisKey key = new AxisKey(sample.nodeId(), axis);
                detector.record(key, sample.time(), force[axis]);
                if (detector.isFull(key) && undamped(detector, key)) {
                    flagged.add(sample.nodeId());
                    findings.add(dampingFinding(sample, axis, detector.sampleCount(key), nodeLabel));
                    return;
                }
            }
        });
        for (Map.Entry<Long, BoundaryForceSample> entry : latest.entrySet()) {
            if (flagged.contains(entry.getKey())) {
                continue;
            }
            for (int axis = 0; axis < AXES.length; axis++) {
                AxisKey key = new AxisKey(entry.getKey(), axis);
                if (!detector.isFull(key) && detector.sampleCount(key) >= MIN_OSCILLATION_SAMPLES
                        && undamped(detector, key)) {
                    findings.add(dampingFinding(entry.getValue(), axis, detector.sampleCount(key), nodeLabel));
                    break;
                }
            }
        }
        return findings;
    }

    private static boolean undamped(OscillationDetector<AxisKey> detector, AxisKey key) {
        return detector.alternationRatio(key) >= ALTERNATION
                && detector.meanMagnitude(key) > NEGLIGIBLE_FORCE
                && detector.decayRatio(key) >= SUSTAINED_AMPLITUDE;
    }

    private static Finding dampingFinding(BoundaryForceSample sample, int axis, int samples,
                                          LongFunction<String> nodeLabel) {
        return Finding.warning(CATEGORY, "Undamped force oscillation at node " + sample.nodeId(),
                        String.format("%s %s-force alternates sign without decaying over %d output steps "
                                + "ending at t=%.6g.", nodeLabel.apply(sample.nodeId()), AXES[axis], samples,
                                sample.time()))
                .withRecommendation("Consider adding system or contact damping, or reviewing the constraint "
                        + "stiffness at this node.")
                .withEvidence(boundaryEvidence(sample));
    }

    private static String describeNode(AnalysisInputs inputs, long nodeId) {
        OptionalInt part = inputs.mapper().owningPartOfNode(nodeId);
        if (part.isPresent()) {
            return "Node " + nodeId + " (" + inputs.partName(part.getAsInt()) + ")";
        }
        return "Node " + nodeId;
    }

    private static Evidence nodeEvidence(NodalSample sample) {
        return Evidence.at(InputKind.NODOUT, "node", sample.nodeId(), sample.cycle(), sample.time());
    }

    private static Evidence boundaryEvidence(BoundaryForceSample sample) {
        return Evidence.at(InputKind.BNDOUT, "node", sample.nodeId(), sample.cycle(), sample.time());
    }

    private record AxisKey(long nodeId, int axis) {}

    private static final class ForceStatistics {
        long count;
        double sum;
        BoundaryForceSample peak;

        void add(BoundaryForceSample sample) {
            count++;
            sum += sample.forceMagnitude();
            if (peak == null || sample.forceMagnitude() > peak.forceMagnitude()) {
                peak = sample;
            }
        }
    }
}
