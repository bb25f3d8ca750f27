package com.dynascope.core.report;

import com.dynascope.core.analysis.AnalysisInputs;
import com.dynascope.core.analysis.TimeHistorySource;
import com.dynascope.core.config.DynascopeProperties;
import com.dynascope.core.knowledge.KnowledgeBase;
import com.dynascope.core.mapping.ElementPartMapper;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.Report;
import com.dynascope.core.model.RunBundle;
import com.dynascope.core.model.Severity;
import com.dynascope.core.model.TerminationState;
import com.dynascope.core.model.TerminationStatus;
import com.dynascope.core.model.WarningEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class ReportAggregatorTest {

    private static final Path RUN_DIR = Path.of("/runs/sled-07");

    private ReportAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new ReportAggregator(new DynascopeProperties());
    }

    private static AnalysisInputs inputs(ParsedRun run) {
        RunBundle bundle = new RunBundle(RUN_DIR, Map.of(InputKind.MESSAGE, RUN_DIR.resolve("messag")), new TreeMap<>());
        return new AnalysisInputs(bundle, run, ElementPartMapper.empty(),
                KnowledgeBase.loadDefault(new ObjectMapper()), TimeHistorySource.none());
    }

    private static WarningEvent event(int code) {
        return new WarningEvent(code, WarningEvent.Level.WARNING, WarningEvent.Condition.GENERAL,
                null, null, null, null, 0, "*** Warning " + code, InputKind.MESSAGE);
    }

    private static ParsedRun run() {
        return ParsedRun.builder()
                .termination(TerminationStatus.of(TerminationState.ERROR_TERMINATED))
                .addWarnings(List.of(event(50136), event(20200), event(50136), event(0)))
                .build();
    }

    @Test
    @DisplayName("refuses a run that no reader produced anything for")
    void emptyRun() {
        EmptyRunException e = assertThrows(EmptyRunException.class,
                () -> aggregator.aggregate(inputs(ParsedRun.builder().build()), List.of()));
        assertTrue(e.getMessage().contains("sled-07"));
    }

    @Test
    @DisplayName("keeps analyzer order and tags every finding with its analyzer")
    void analyzerOrder() {
        List<AnalyzerFindings> results = List.of(
                new AnalyzerFindings("termination", List.of(Finding.critical("termination", "Error termination", "x"))),
                new AnalyzerFindings("energy", List.of()),
                new AnalyzerFindings("warnings", List.of(
                        Finding.warning("warnings", "Warning 50136", "a"),
                        Finding.warning("warnings", "Warning 20200", "b"))));

        Report report = aggregator.aggregate(inputs(run()), results);

        assertEquals(List.of("termination", "warnings", "warnings"),
                report.findings().stream().map(Finding::analyzer).toList());
        assertEquals("Warning 50136", report.findings().get(1).title());
        assertEquals(1, report.count(Severity.CRITICAL));
        assertEquals(2, report.findingsIn("warnings").size());
        assertEquals("/runs/sled-07", report.directory());
    }

    @Test
    @DisplayName("counts warning codes in code order and ignores code 0")
    void warningCounts() {
        Report report = aggregator.aggregate(inputs(run()), List.of());

        assertEquals(List.of(20200, 50136), List.copyOf(report.warningCounts().keySet()));
        assertEquals(2L, report.warningCounts().get(50136));
    }

    @Test
    @DisplayName("aggregating the same inputs twice gives equal reports")
    void idempotent() {
        AnalysisInputs inputs = inputs(run());
        List<AnalyzerFindings> results = List.of(
                new AnalyzerFindings("termination", List.of(Finding.critical("termination", "Error termination", "x"))));

        assertEquals(aggregator.aggregate(inputs, results), aggregator.aggregate(inputs, results));
    }
}
