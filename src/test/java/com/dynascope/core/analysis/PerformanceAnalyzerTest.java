package com.dynascope.core.analysis;

import com.dynascope.core.model.ComponentImbalance;
import com.dynascope.core.model.ComponentTiming;
import com.dynascope.core.model.DecompositionMetrics;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.PerformanceProfile;
import com.dynascope.core.model.ProcessorLoadSample;
import com.dynascope.core.model.ProcessorTiming;
import com.dynascope.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceAnalyzerTest {

    private static ComponentTiming timing(String name, double percent) {
        return new ComponentTiming(name, percent, percent, percent, percent);
    }

    private static ParsedRun withComponents(ComponentTiming... components) {
        return ParsedRun.builder()
                .performance(new PerformanceProfile(List.of(components), List.of(), List.of(), DecompositionMetrics.empty()))
                .build();
    }

    // -- Component shares ------------------------------------------------------

    @Nested
    @DisplayName("component shares")
    class ComponentShares {

        @Test
        @DisplayName("contact above 40% is a warning and each component above 25% is a primary cost")
        void contactDominates() {
            Map<String, Double> shares = PerformanceAnalyzer.componentShares(withComponents(
                    timing("Element processing", 30.0), timing("Contact algorithm", 45.0), timing("Keyword Processing", 5.0)));

            List<Finding> primary = PerformanceAnalyzer.primaryCosts(shares, InputKind.HSP);
            List<Finding> contact = PerformanceAnalyzer.contactShare(shares, InputKind.HSP);

            assertEquals(List.of("Primary cost: Element processing", "Primary cost: Contact algorithm"),
                    primary.stream().map(Finding::title).toList());
            assertEquals(1, contact.size());
            assertEquals(Severity.WARNING, contact.get(0).severity());
        }

        @Test
        @DisplayName("sums the sharing components for the communication overhead")
        void sharing() {
            Map<String, Double> shares = Map.of("Force Shr", 15.0, "Misc sharing", 12.0, "Solids", 50.0);

            assertEquals(1, PerformanceAnalyzer.sharingOverhead(shares, InputKind.LOAD_PROFILE).size());
            assertTrue(PerformanceAnalyzer.sharingOverhead(Map.of("Force Shr", 15.0), InputKind.LOAD_PROFILE).isEmpty());
        }

        @Test
        @DisplayName("force gather above 10% is reported")
        void forceGather() {
            assertEquals(1, PerformanceAnalyzer.forceGather(Map.of("Force gather", 12.0), InputKind.HSP).size());
            assertTrue(PerformanceAnalyzer.forceGather(Map.of("Force gather", 8.0), InputKind.HSP).isEmpty());
        }

        @Test
        @DisplayName("falls back to mean load-profile percentages without a timing table")
        void profileShares() {
            ParsedRun run = ParsedRun.builder()
                    .processorLoad(List.of(new ProcessorLoadSample("contact", 0, 4.0, 40.0),
                            new ProcessorLoadSample("contact", 1, 5.0, 50.0)))
                    .build();

            assertEquals(45.0, PerformanceAnalyzer.componentShares(run).get("contact"), 1e-12);
        }
    }

    // -- Rank balance ----------------------------------------------------------

    @Nested
    @DisplayName("rank balance")
    class RankBalance {

        @Test
        @DisplayName("a component whose seconds vary over 8% across ranks is uneven")
        void loadVariation() {
            List<ProcessorLoadSample> samples = List.of(
                    new ProcessorLoadSample("solids", 0, 10.0, 60.0),
                    new ProcessorLoadSample("solids", 1, 14.0, 70.0),
                    new ProcessorLoadSample("contact", 0, 5.0, 30.0),
                    new ProcessorLoadSample("contact", 1, 5.0, 25.0));

            List<ComponentImbalance> imbalance = LoadStatistics.imbalance(samples);
            List<Finding> findings = PerformanceAnalyzer.loadVariation(samples);

            assertEquals(2, imbalance.size());
            assertEquals(1, imbalance.get(0).busiestRank());
            assertEquals(2.0 / 12.0, imbalance.get(0).coefficientOfVariation(), 1e-12);
            assertEquals(1, findings.size());
            assertEquals("Uneven load: solids", findings.get(0).title());
        }

        @Test
        @DisplayName("a CPU ratio spread above 0.15 is a load imbalance")
        void cpuRatioSpread() {
            List<Finding> findings = PerformanceAnalyzer.cpuRatioSpread(List.of(
                    new ProcessorTiming(0, "node01", 0.80, 100.0),
                    new ProcessorTiming(1, "node02", 1.00, 120.0)));

            assertEquals(1, findings.size());
            assertEquals("1", findings.get(0).evidence().get(0).ref());
        }

        @Test
        @DisplayName("grades decomposition imbalance")
        void decomposition() {
            assertEquals(Severity.CRITICAL,
                    PerformanceAnalyzer.decomposition(new DecompositionMetrics(40.0, 100.0, 0.0, 0, 0)).get(0).severity());
            assertEquals(Severity.WARNING,
                    PerformanceAnalyzer.decomposition(new DecompositionMetrics(60.0, 100.0, 0.0, 0, 0)).get(0).severity());
            assertTrue(PerformanceAnalyzer.decomposition(new DecompositionMetrics(80.0, 100.0, 0.0, 0, 0)).isEmpty());
        }
    }
}
