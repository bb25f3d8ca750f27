package com.dynascope.core.analysis;

import com.dynascope.core.mapping.ElementPartMapper;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.Severity;
import com.dynascope.core.model.RunRecord;
import com.dynascope.core.model.WarningEvent;
import com.dynascope.core.parser.CancellationToken;
import com.dynascope.core.parser.MessageReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static com.dynascope.core.analysis.AnalysisFixtures.inputs;
import static com.dynascope.core.analysis.AnalysisFixtures.negativeVolume;
import static com.dynascope.core.analysis.AnalysisFixtures.warning;
import static org.junit.jupiter.api.Assertions.*;

class FailureAnalyzerTest {

    private static AnalysisInputs inputsWith(List<WarningEvent> events) {
        ElementPartMapper mapper = ElementPartMapper.builder().put(5001L, 3).build();
        return inputs(ParsedRun.builder().addWarnings(events).build(), mapper, TimeHistorySource.none());
    }

    @Test
    @DisplayName("folds repeated reports of one element and traces it to its part")
    void foldsByElement() {
        List<Finding> findings = new FailureAnalyzer().analyze(inputsWith(List.of(
                negativeVolume(40509, 5001, null, 1200L, 0),
                negativeVolume(40509, 5001, null, 1201L, 1),
                negativeVolume(40509, 7002, 8, null, 1),
                warning(50135, 9000L, 0))));

        assertEquals(2, findings.size());
        Finding first = findings.get(0);
        assertEquals(Severity.CRITICAL, first.severity());
        assertEquals("Negative volume in element 5001", first.title());
        assertEquals(2, first.occurrences());
        assertTrue(first.message().contains("of part 3 at cycle 1200"));
        assertTrue(first.message().endsWith("reported 2 times on rank 0, rank 1."));
        assertEquals("5001", first.evidence().get(0).ref());
        assertTrue(findings.get(1).message().contains("element 7002 of part 8"));
    }

    @Test
    @DisplayName("uses the catalogue recommendation for catalogued codes")
    void catalogueRecommendation() {
        Finding catalogued = new FailureAnalyzer().analyze(inputsWith(List.of(
                negativeVolume(40509, 5001, null, null, 0)))).get(0);
        Finding bare = new FailureAnalyzer().analyze(inputsWith(List.of(
                negativeVolume(0, 5001, null, null, 0)))).get(0);

        assertEquals(AnalysisFixtures.knowledge().lookup(40509).recommendation(), catalogued.recommendation());
        assertTrue(bare.recommendation().startsWith("Refine or smooth the mesh"));
    }

    @Test
    @DisplayName("numerical failure codes without an element still produce a finding")
    void numericalCode() {
        WarningEvent nan = new WarningEvent(30100, WarningEvent.Level.ERROR, WarningEvent.Condition.GENERAL,
                null, null, null, null, WarningEvent.UNRANKED, "*** Error 30100", InputKind.MESSAGE);

        List<Finding> findings = new FailureAnalyzer().analyze(inputsWith(List.of(nan, nan)));

        assertEquals(1, findings.size());
        assertEquals("NaN in stress calculation (30100) in an unidentified element", findings.get(0).title());
        assertTrue(findings.get(0).message().endsWith("on the primary log."));
    }

    @Test
    @DisplayName("every element listed under one message header is its own critical finding")
    void elementsUnderOneHeader() {
        String text = """
                 *** Error 40509 (OTH+22)
                     negative volume in solid element # 101
                     negative volume in solid element # 102
                     negative volume in solid element # 103

                """;
        List<WarningEvent> events = new ArrayList<>();
        MessageReader reader = new MessageReader(new StringReader(text), "mes0000", 0, CancellationToken.none());
        reader.forEachRemaining((RunRecord record) -> {
            if (record instanceof WarningEvent event) {
                events.add(event);
            }
        });

        List<Finding> findings = new FailureAnalyzer().analyze(inputsWith(events));

        assertEquals(3, findings.size());
        assertTrue(findings.stream().allMatch(finding -> finding.severity() == Severity.CRITICAL));
        assertEquals(List.of("Negative volume in element 101", "Negative volume in element 102",
                "Negative volume in element 103"), findings.stream().map(Finding::title).toList());
    }

    @Test
    @DisplayName("different failure conditions on one element are reported separately")
    void conditionsOnOneElement() {
        WarningEvent nan = new WarningEvent(30100, WarningEvent.Level.ERROR, WarningEvent.Condition.CONSTRAINT_NAN,
                null, null, 5001L, 1300L, 0, "*** Error 30100 nan detected in constraint matrix for element 5001",
                InputKind.MESSAGE);

        List<Finding> findings = new FailureAnalyzer().analyze(inputsWith(List.of(
                negativeVolume(40509, 5001, null, 1200L, 0), nan)));

        assertEquals(2, findings.size());
        assertEquals("Negative volume in element 5001", findings.get(0).title());
        assertEquals("NaN in the constraint matrix in element 5001", findings.get(1).title());
        assertEquals(1, findings.get(1).occurrences());
    }
}
