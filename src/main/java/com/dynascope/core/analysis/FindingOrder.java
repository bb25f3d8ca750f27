package com.dynascope.core.analysis;

import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges the findings of several rules into observation order: by the simulated
 * time of their first timed evidence, rule order breaking ties. Findings with no
 * timed evidence keep their relative order after all timed ones.
 */
final class FindingOrder {

    private FindingOrder() {}

    static List<Finding> byObservation(List<Finding> findings) {
        List<Finding> ordered = new ArrayList<>(findings);
        ordered.sort(Comparator.comparingDouble(FindingOrder::observedAt));
        return ordered;
    }

    private static double observedAt(Finding finding) {
        for (Evidence evidence : finding.evidence()) {
            if (evidence.time() != null && !evidence.time().isNaN()) {
                return evidence.time();
            }
        }
        return Double.POSITIVE_INFINITY;
    }
}
