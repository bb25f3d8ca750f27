package com.dynascope.core.analysis;

import com.dynascope.core.knowledge.CodeEntry;
import com.dynascope.core.knowledge.KnowledgeBase;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InitialPenetration;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.Severity;
import com.dynascope.core.model.WarningEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.dynascope.core.analysis.AnalysisFixtures.inputs;
import static com.dynascope.core.analysis.AnalysisFixtures.knowledge;
import static com.dynascope.core.analysis.AnalysisFixtures.warning;
import static org.junit.jupiter.api.Assertions.*;

class WarningCatalogueAnalyzerTest {

    @Test
    @DisplayName("one finding per distinct code in order of first appearance")
    void distinctCodes() {
        List<WarningEvent> events = List.of(
                warning(50135, 5001L, 0),
                warning(12345, null, 0),
                warning(50135, 7002L, 1),
                warning(0, null, 0),
                warning(50135, 7003L, 0));

        List<Finding> findings = WarningCatalogueAnalyzer.codes(events, knowledge());

        assertEquals(2, findings.size());
        Finding tied = findings.get(0);
        assertEquals("Warning 50135: Tracked node not constrained (tied interface)", tied.title());
        assertEquals(3, tied.occurrences());
        assertTrue(tied.message().endsWith("Seen 3 times on rank 0, rank 1."));
        Finding unknown = findings.get(1);
        assertEquals("Warning 12345: Code 12345", unknown.title());
        assertEquals(Severity.CRITICAL, unknown.severity());
    }

    @Test
    @DisplayName("escalates only above the volume threshold and never lowers a severity")
    void escalate() {
        assertEquals(Severity.WARNING, WarningCatalogueAnalyzer.escalate(50135, 1001, Severity.INFO));
        assertEquals(Severity.INFO, WarningCatalogueAnalyzer.escalate(50135, 1000, Severity.INFO));
        assertEquals(Severity.CRITICAL, WarningCatalogueAnalyzer.escalate(40509, 101, Severity.WARNING));
        assertEquals(Severity.CRITICAL, WarningCatalogueAnalyzer.escalate(50135, 5000, Severity.CRITICAL));
    }

    @Test
    @DisplayName("says so when volume raised the severity")
    void escalationMessage() {
        KnowledgeBase catalogue = KnowledgeBase.of(List.of(new CodeEntry(50136, "contact", Severity.INFO,
                "Tracked node too far from segment", "A tracked node is far from its segment.", "Check the tie.")));
        List<WarningEvent> events = new ArrayList<>();
        for (int i = 0; i < 101; i++) {
            events.add(warning(50136, (long) i, 0));
        }

        Finding finding = WarningCatalogueAnalyzer.codes(events, catalogue).get(0);

        assertEquals(Severity.WARNING, finding.severity());
        assertTrue(finding.message().endsWith("The volume of this message raises it to warning."));
    }

    @Test
    @DisplayName("sums initial penetrations per interface over ranks")
    void penetrations() {
        ParsedRun run = ParsedRun.builder()
                .addPenetrations(List.of(new InitialPenetration(2, 5, 0), new InitialPenetration(2, 3, 1),
                        new InitialPenetration(4, 1, 0)))
                .build();

        List<Finding> findings = new WarningCatalogueAnalyzer().analyze(inputs(run));

        assertEquals(2, findings.size());
        assertEquals("8 initial penetrations were found for interface 2.", findings.get(0).message());
        assertEquals(8, findings.get(0).occurrences());
        assertEquals("1 initial penetration was found for interface 4.", findings.get(1).message());
        assertEquals(ContactAnalyzer.CATEGORY, findings.get(1).category());
    }
}
