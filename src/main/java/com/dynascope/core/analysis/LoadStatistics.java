package com.dynascope.core.analysis;

import com.dynascope.core.model.ComponentImbalance;
import com.dynascope.core.model.ProcessorLoadSample;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-component spread of processor load across MPP ranks.
 */
public final class LoadStatistics {

    private LoadStatistics() {}

    /**
     * Coefficient of variation of each component's seconds across ranks, in the
     * order components first appear. Components without positive mean time are omitted.
     */
    public static List<ComponentImbalance> imbalance(List<ProcessorLoadSample> samples) {
        Map<String, List<ProcessorLoadSample>> byComponent = new LinkedHashMap<>();
        for (ProcessorLoadSample sample : samples) {
            if (!Double.isNaN(sample.seconds())) {
                byComponent.computeIfAbsent(sample.component(), k -> new ArrayList<>()).add(sample);
            }
        }
        List<ComponentImbalance> result = new ArrayList<>();
        for (Map.Entry<String, List<ProcessorLoadSample>> entry : byComponent.entrySet()) {
            List<ProcessorLoadSample> ranks = entry.getValue();
            double sum = 0.0;
            double maximum = Double.NEGATIVE_INFINITY;
            int busiest = -1;
            for (ProcessorLoadSample sample : ranks) {
                sum += sample.seconds();
                if (sample.seconds() > maximum) {
                    maximum = sample.seconds();
                    busiest = sample.rank();
                }
            }
            double mean = sum / ranks.size();
            if (mean <= 0.0) {
                continue;
            }
            double squares = 0.0;
            for (ProcessorLoadSample sample : ranks) {
                double delta = sample.seconds() - mean;
                squares += delta * delta;
            }
            double deviation = Math.sqrt(squares / ranks.size());
            result.add(new ComponentImbalance(entry.getKey(), ranks.size(), mean, maximum, busiest, deviation / mean));
        }
        return result;
    }

    /** Mean seconds per rank summed over all components. */
    public static double meanRankSeconds(List<ProcessorLoadSample> samples) {
        Map<Integer, Double> perRank = new LinkedHashMap<>();
        for (ProcessorLoadSample sample : samples) {
            if (!Double.isNaN(sample.seconds())) {
                perRank.merge(sample.rank(), sample.seconds(), Double::sum);
            }
        }
        return perRank.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
