package com.dynascope.core.analysis;

import com.dynascope.core.model.ControlSettings;
import com.dynascope.core.model.ControllingInterval;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.PartTimestepGroup;
import com.dynascope.core.model.Severity;
import com.dynascope.core.model.SmallestTimestep;
import com.dynascope.core.model.TimestepRecord;
import com.dynascope.core.model.TimestepSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.dynascope.core.analysis.AnalysisFixtures.timestep;
import static org.junit.jupiter.api.Assertions.*;

class TimestepAnalyzerTest {

    // -- Controlling intervals -------------------------------------------------

    @Nested
    @DisplayName("controlling intervals")
    class Intervals {

        @Test
        @DisplayName("partition the reported cycles without gaps or overlaps")
        void partition() {
            List<TimestepRecord> records = List.of(
                    timestep(0, "solid", 12, 3, 1.0e-6),
                    timestep(100, "solid", 12, 3, 9.0e-7),
                    timestep(200, "shell", 77, 2, 8.0e-7),
                    timestep(300, "shell", 77, 2, 8.0e-7),
                    timestep(400, "solid", 12, 3, 7.0e-7));

            List<ControllingInterval> intervals = ControllingIntervals.compress(records);

            assertEquals(3, intervals.size());
            assertEquals(new ControllingInterval(0, 199, "solid", 12, 3), intervals.get(0));
            assertEquals(new ControllingInterval(200, 399, "shell", 77, 2), intervals.get(1));
            assertEquals(new ControllingInterval(400, 400, "solid", 12, 3), intervals.get(2));
            long covered = intervals.stream().mapToLong(ControllingInterval::cycleCount).sum();
            assertEquals(401, covered);
        }

        @Test
        @DisplayName("ignore records that do not advance the cycle")
        void ignoresRepeatedCycles() {
            List<ControllingInterval> intervals = ControllingIntervals.compress(List.of(
                    timestep(100, "solid", 12, 3, 1.0e-6),
                    timestep(100, "shell", 77, 2, 1.0e-6),
                    timestep(50, "beam", 5, 1, 1.0e-6)));

            assertEquals(List.of(new ControllingInterval(100, 100, "solid", 12, 3)), intervals);
        }

        @Test
        @DisplayName("an empty record list has no intervals")
        void empty() {
            assertTrue(ControllingIntervals.compress(List.of()).isEmpty());
        }
    }

    // -- Rules -----------------------------------------------------------------

    @Nested
    @DisplayName("rules")
    class Rules {

        @Test
        @DisplayName("each cycle below 1e-11 is a collapse")
        void collapses() {
            List<Finding> findings = TimestepAnalyzer.collapses(List.of(
                    timestep(100, "solid", 12, 3, 1.0e-6),
                    timestep(200, "solid", 12, 3, 5.0e-12),
                    timestep(300, "solid", 12, 3, 1.0e-12)));

            assertEquals(2, findings.size());
            assertTrue(findings.stream().allMatch(f -> f.severity() == Severity.CRITICAL));
        }

        @Test
        @DisplayName("a collapse under a contact or an unnamed controller is still reported")
        void collapseWithoutElementController() {
            List<Finding> findings = TimestepAnalyzer.collapses(List.of(
                    timestep(500, "contact", 3, 0, 5.0e-12),
                    timestep(600, "", 0, 0, 4.0e-12)));

            assertEquals(2, findings.size());
            assertTrue(findings.get(0).message().contains("controlled by contact 3."));
            assertEquals("contact", findings.get(0).evidence().get(0).entity());
            assertEquals(500L, findings.get(0).evidence().get(0).cycle());
            assertTrue(findings.get(1).message().contains("an unreported controller"));
            assertEquals(600L, findings.get(1).evidence().get(0).cycle());
        }

        @Test
        @DisplayName("grades the drop from the first to the last timestep")
        void drop() {
            List<Finding> severe = TimestepAnalyzer.timestepDrop(List.of(
                    timestep(0, "solid", 12, 3, 1.0e-6), timestep(100, "solid", 12, 3, 5.0e-8)));
            List<Finding> notable = TimestepAnalyzer.timestepDrop(List.of(
                    timestep(0, "solid", 12, 3, 1.0e-6), timestep(100, "solid", 12, 3, 4.0e-7)));
            List<Finding> mild = TimestepAnalyzer.timestepDrop(List.of(
                    timestep(0, "solid", 12, 3, 1.0e-6), timestep(100, "solid", 12, 3, 8.0e-7)));

            assertEquals(Severity.WARNING, severe.get(0).severity());
            assertEquals(Severity.INFO, notable.get(0).severity());
            assertTrue(mild.isEmpty());
        }

        @Test
        @DisplayName("reports the first cycle controlled by a contact")
        void contactControl() {
            List<Finding> findings = TimestepAnalyzer.contactControl(List.of(
                    timestep(100, "solid", 12, 3, 1.0e-6),
                    timestep(200, "contact", 4, 0, 1.0e-6),
                    timestep(300, "contact", 4, 0, 1.0e-6)));

            assertEquals(1, findings.size());
            assertEquals(200L, findings.get(0).evidence().get(0).cycle());
        }

        @Test
        @DisplayName("warns when one part owns more than 80% of the smallest timesteps")
        void partDominance() {
            List<SmallestTimestep> rows = new ArrayList<>();
            for (int i = 0; i < 9; i++) {
                rows.add(new SmallestTimestep("solid", 100 + i, 3, 1.0e-7 + i * 1.0e-9));
            }
            rows.add(new SmallestTimestep("shell", 500, 2, 2.0e-7));

            List<Finding> findings = TimestepAnalyzer.partDominance(rows, id -> "part " + id);

            assertEquals(1, findings.size());
            assertTrue(findings.get(0).message().startsWith("Part 3"));
            assertTrue(TimestepAnalyzer.partDominance(rows.subList(0, 9), id -> "part " + id).isEmpty());
        }

        @Test
        @DisplayName("notes active mass scaling")
        void massScaling() {
            assertEquals(1, TimestepAnalyzer.massScaling(new ControlSettings(0.01, 0.9, -1.0e-6, 0.0)).size());
            assertTrue(TimestepAnalyzer.massScaling(new ControlSettings(0.01, 0.9, 0.0, 0.0)).isEmpty());
        }
    }

    @Test
    @DisplayName("summarises the timestep history with parts ordered by their smallest dt")
    void summary() {
        ParsedRun run = ParsedRun.builder()
                .timesteps(List.of(timestep(0, "solid", 12, 3, 1.0e-6), timestep(100, "shell", 77, 2, 4.0e-7),
                        timestep(200, "shell", 77, 2, 6.0e-7)))
                .smallestTimesteps(List.of(
                        new SmallestTimestep("solid", 12, 3, 3.0e-7),
                        new SmallestTimestep("shell", 77, 2, 2.0e-7),
                        new SmallestTimestep("solid", 13, 3, 2.5e-7)))
                .build();

        TimestepSummary summary = TimestepAnalyzer.summarize(run, id -> "part " + id);

        assertEquals(1.0e-6, summary.initialDt());
        assertEquals(6.0e-7, summary.finalDt());
        assertEquals(4.0e-7, summary.minimumDt());
        assertEquals(List.of(77L, 13L, 12L), summary.smallestElements().stream().map(SmallestTimestep::elementId).toList());
        assertEquals(List.of(2, 3), summary.partGroups().stream().map(PartTimestepGroup::partId).toList());
        assertEquals(2, summary.partGroups().get(1).elementCount());
        assertEquals(2, summary.intervals().size());
    }
}
