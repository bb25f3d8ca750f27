package com.dynascope.core.analysis;

import com.dynascope.core.config.DynascopeProperties;
import com.dynascope.core.mapping.ElementPartMapper;
import com.dynascope.core.model.BoundaryForceSample;
import com.dynascope.core.model.ElementAssociation;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.NodalSample;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongFunction;

import static com.dynascope.core.analysis.AnalysisFixtures.inputs;
import static org.junit.jupiter.api.Assertions.*;

class InstabilityAnalyzerTest {

    private static final LongFunction<String> LABEL = nodeId -> "Node " + nodeId;

    private static NodalSample nodal(long node, long cycle, double xVelocity) {
        return new NodalSample(node, cycle, cycle * 1.0e-6, 0.0, 0.0, 0.0, xVelocity, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    private static BoundaryForceSample boundary(long node, long cycle, double xForce) {
        return new BoundaryForceSample(node, cycle, cycle * 1.0e-6, xForce, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    /** Node 42 passes 1000 at one step, peaks at 1500 on the next, then settles; node 7 stays below the limit. */
    private static List<NodalSample> shootingSeries(int padding) {
        List<NodalSample> samples = new ArrayList<>();
        long cycle = 1;
        for (int i = 0; i < padding; i++, cycle++) {
            samples.add(nodal(42, cycle, 10.0));
            samples.add(nodal(7, cycle, 900.0));
        }
        long firstExceeding = cycle;
        for (double speed : new double[] {1200.0, 1500.0, 1100.0}) {
            samples.add(nodal(42, cycle, speed));
            samples.add(nodal(7, cycle, 900.0));
            cycle++;
        }
        for (int i = 0; i < padding; i++, cycle++) {
            samples.add(nodal(42, cycle, 10.0));
            samples.add(nodal(7, cycle, 900.0));
        }
        assertEquals(padding + 1, firstExceeding);
        return samples;
    }

    // -- Shooting nodes --------------------------------------------------------

    @Nested
    @DisplayName("shooting nodes")
    class ShootingNodes {

        @ParameterizedTest
        @ValueSource(ints = {0, 5, 500})
        @DisplayName("a speed peak of 1500 yields exactly one finding regardless of surrounding samples")
        void onePeak(int padding) {
            List<Finding> findings = InstabilityAnalyzer.shootingNodes(shootingSeries(padding).stream(), LABEL);

            assertEquals(1, findings.size());
            Finding finding = findings.get(0);
            assertEquals(Severity.CRITICAL, finding.severity());
            assertEquals("Shooting node 42", finding.title());
            assertEquals(padding + 1L, finding.evidence().get(0).cycle());
            assertEquals(padding + 2L, finding.evidence().get(1).cycle());
            assertTrue(finding.references(InputKind.NODOUT));
        }

        @Test
        @DisplayName("names the owning part of the node when the deck maps it")
        void nodeLabel() {
            ElementPartMapper mapper = ElementPartMapper.builder()
                    .add(new ElementAssociation("shell", 1, 5, List.of(42L, 43L, 44L, 45L)))
                    .build();
            AnalysisInputs inputs = inputs(ParsedRun.builder().build(), mapper,
                    TimeHistorySource.of(shootingSeries(3), List.of()));

            List<Finding> findings = new InstabilityAnalyzer(new DynascopeProperties()).analyze(inputs);

            assertEquals(1, findings.size());
            assertTrue(findings.get(0).message().startsWith("Node 42 (part 5) reaches a speed of 1500"));
        }
    }

    // -- Oscillation -----------------------------------------------------------

    @Nested
    @DisplayName("high-frequency oscillation")
    class HighFrequency {

        @Test
        @DisplayName("flags a node whose velocity changes sign every step, once")
        void alternatingVelocity() {
            List<NodalSample> samples = new ArrayList<>();
            for (long cycle = 1; cycle <= 40; cycle++) {
                samples.add(nodal(9, cycle, cycle % 2 == 0 ? 5.0 : -5.0));
                samples.add(nodal(10, cycle, 5.0 + cycle * 0.1));
            }

            List<Finding> findings = InstabilityAnalyzer.highFrequency(samples.stream(), 256, LABEL);

            assertEquals(1, findings.size());
            assertEquals("High-frequency oscillation at node 9", findings.get(0).title());
            assertEquals(10L, findings.get(0).evidence().get(0).cycle());
        }

        @Test
        @DisplayName("needs a minimum number of samples before judging")
        void tooFewSamples() {
            List<NodalSample> samples = new ArrayList<>();
            for (long cycle = 1; cycle < InstabilityAnalyzer.MIN_OSCILLATION_SAMPLES; cycle++) {
                samples.add(nodal(9, cycle, cycle % 2 == 0 ? 5.0 : -5.0));
            }

            assertTrue(InstabilityAnalyzer.highFrequency(samples.stream(), 256, LABEL).isEmpty());
        }
    }

    // -- Boundary forces -------------------------------------------------------

    @Nested
    @DisplayName("boundary forces")
    class BoundaryForces {

        @Test
        @DisplayName("one sample at 150 times the series mean yields one spike finding at that sample")
        void spike() {
            List<BoundaryForceSample> samples = new ArrayList<>();
            for (long cycle = 1; cycle <= 300; cycle++) {
                samples.add(boundary(11, cycle, cycle == 200 ? 299.0 : 1.0));
            }
            AnalysisInputs inputs = inputs(ParsedRun.builder().build(), ElementPartMapper.empty(),
                    TimeHistorySource.of(List.of(), samples));

            List<Finding> findings = new InstabilityAnalyzer(new DynascopeProperties()).analyze(inputs);

            assertEquals(1, findings.size());
            assertEquals("Boundary force spike at node 11", findings.get(0).title());
            assertEquals(200L, findings.get(0).evidence().get(0).cycle());
            assertTrue(findings.get(0).references(InputKind.BNDOUT));
        }

        @Test
        @DisplayName("a steady force has no spike")
        void steady() {
            List<BoundaryForceSample> samples = new ArrayList<>();
            for (long cycle = 1; cycle <= 50; cycle++) {
                samples.add(boundary(11, cycle, 10.0 + cycle % 3));
            }

            assertTrue(InstabilityAnalyzer.forceSpikes(samples.stream(), LABEL).isEmpty());
        }

        @Test
        @DisplayName("sustained alternating reaction forces are undamped, decaying ones are not")
        void damping() {
            List<BoundaryForceSample> samples = new ArrayList<>();
            for (long cycle = 1; cycle <= 40; cycle++) {
                double sign = cycle % 2 == 0 ? 1.0 : -1.0;
                samples.add(boundary(3, cycle, sign * 100.0));
                samples.add(boundary(4, cycle, sign * 100.0 * Math.pow(0.9, cycle)));
                if (cycle <= 12) {
                    samples.add(boundary(5, cycle, sign * 50.0));
                }
            }

            List<Finding> findings = InstabilityAnalyzer.dampingDeficiency(samples.stream(), 32, LABEL);

            assertEquals(List.of("Undamped force oscillation at node 3", "Undamped force oscillation at node 5"),
                    findings.stream().map(Finding::title).toList());
            assertEquals(32L, findings.get(0).evidence().get(0).cycle());
            assertEquals(12L, findings.get(1).evidence().get(0).cycle());
        }
    }
}
