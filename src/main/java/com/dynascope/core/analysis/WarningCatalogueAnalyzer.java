package com.dynascope.core.analysis;

import com.dynascope.core.knowledge.CodeEntry;
import com.dynascope.core.knowledge.KnowledgeBase;
import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InitialPenetration;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.Severity;
import com.dynascope.core.model.WarningEvent;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Explains every distinct message code found in the logs using the knowledge base,
 * escalating codes whose sheer volume indicates a problem.
 */
@Component
@Order(9)
public class WarningCatalogueAnalyzer implements Analyzer {

    public static final String CATEGORY = "warnings";

    /** Escalation: code, occurrence count that must be exceeded, resulting severity. */
    record Escalation(int code, long above, Severity severity) {}

    static final List<Escalation> ESCALATIONS = List.of(
            new Escalation(40509, 100, Severity.CRITICAL),
            new Escalation(50135, 1000, Severity.WARNING),
            new Escalation(50136, 100, Severity.WARNING));

    @Override
    public String name() {
        return "warnings";
    }

    @Override
    public List<Finding> analyze(AnalysisInputs inputs) {
        List<Finding> findings = new ArrayList<>(codes(inputs.run().warnings(), inputs.knowledge()));
        findings.addAll(initialPenetrations(inputs.run().penetrations()));
        return findings;
    }

    /** One finding per distinct non-zero code, in order of first appearance. */
    static List<Finding> codes(List<WarningEvent> events, KnowledgeBase knowledge) {
        Map<Integer, CodeTally> tallies = new LinkedHashMap<>();
        for (WarningEvent event : events) {
            if (event.code() != 0) {
                tallies.computeIfAbsent(event.code(), code -> new CodeTally(event)).add(event);
            }
        }
        List<Finding> findings = new ArrayList<>();
        for (CodeTally tally : tallies.values()) {
            CodeEntry entry = knowledge.lookup(tally.first.code());
            Severity severity = escalate(entry.code(), tally.count, entry.severity());
            String message = String.format("%s Seen %d time%s on %s.", entry.description(), tally.count,
                    tally.count == 1 ? "" : "s", FailureAnalyzer.ranks(tally.ranks));
            if (severity != entry.severity()) {
                message += String.format(" The volume of this message raises it to %s.",
                        severity.name().toLowerCase(Locale.ROOT));
            }
            findings.add(Finding.of(severity, CATEGORY,
                            String.format("%s %d: %s", tally.first.level() == WarningEvent.Level.ERROR ? "Error" : "Warning",
                                    entry.code(), entry.title()), message)
                    .withRecommendation(entry.recommendation())
                    .withOccurrences(tally.count)
                    .withEvidence(new Evidence(tally.first.source(), "code", String.valueOf(entry.code()),
                            tally.first.cycle(), null)));
        }
        return findings;
    }

    static Severity escalate(int code, long count, Severity base) {
        for (Escalation escalation : ESCALATIONS) {
            if (escalation.code() == code && count > escalation.above()
                    && escalation.severity().compareTo(base) > 0) {
                return escalation.severity();
            }
        }
        return base;
    }

    /** One Warning per interface with initial penetrations, summed over ranks. */
    static List<Finding> initialPenetrations(List<InitialPenetration> penetrations) {
        Map<Integer, Long> byInterface = new LinkedHashMap<>();
        for (InitialPenetration penetration : penetrations) {
            byInterface.merge(penetration.interfaceId(), penetration.count(), Long::sum);
        }
        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<Integer, Long> entry : byInterface.entrySet()) {
            findings.add(Finding.warning(ContactAnalyzer.CATEGORY, "Initial penetrations in interface " + entry.getKey(),
                            String.format("%d initial penetration%s found for interface %d.", entry.getValue(),
                                    entry.getValue() == 1 ? " was" : "s were", entry.getKey()))
                    .withRecommendation("Move the surfaces apart, reduce the contact thickness, or enable "
                            + "initial penetration checking (IGNORE) for this interface.")
                    .withOccurrences(entry.getValue())
                    .withEvidence(Evidence.of(InputKind.MESSAGE, "interface", entry.getKey())));
        }
        return findings;
    }

    private static final class CodeTally {
        final WarningEvent first;
        final Set<Integer> ranks = new TreeSet<>();
        long count;

        CodeTally(WarningEvent first) {
            this.first = first;
        }

        void add(WarningEvent event) {
            count++;
            ranks.add(event.rank());
        }
    }
}
