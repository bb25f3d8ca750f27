package com.dynascope.core.analysis;

import com.dynascope.core.knowledge.CodeEntry;
import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.WarningEvent;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * Traces element failures (negative volume, NaN in the constraint matrix and catalogued
 * numerical failure codes) back to the part that owns the failing element.
 * Repeated reports of the same condition on the same element fold into one finding.
 */
@Component
@Order(8)
public class FailureAnalyzer implements Analyzer {

    public static final String CATEGORY = "failure";

    @Override
    public String name() {
        return "failure";
    }

    @Override
    public List<Finding> analyze(AnalysisInputs inputs) {
        return failingElements(inputs.run().warnings(), inputs);
    }

    /** One Critical per distinct failing element and condition, in order of first report. */
    static List<Finding> failingElements(List<WarningEvent> events, AnalysisInputs inputs) {
        Map<String, Occurrence> byElement = new LinkedHashMap<>();
        for (WarningEvent event : events) {
            if (!event.isFailure() && !inputs.knowledge().isFailureCode(event.code())) {
                continue;
            }
            String key = event.elementId() != null
                    ? event.condition() + ":element:" + event.elementId()
                    : event.condition() + ":" + event.code();
            byElement.computeIfAbsent(key, k -> new Occurrence(event)).add(event);
        }
        List<Finding> findings = new ArrayList<>();
        for (Occurrence occurrence : byElement.values()) {
            findings.add(toFinding(occurrence, inputs));
        }
        return findings;
    }

    private static Finding toFinding(Occurrence occurrence, AnalysisInputs inputs) {
        WarningEvent first = occurrence.first;
        String what = describe(first, inputs);
        String where = first.elementId() != null ? "element " + first.elementId() : "an unidentified element";
        String owner = owningPart(first, inputs)
                .stream()
                .mapToObj(part -> " of " + inputs.partName(part))
                .findFirst()
                .orElse("");
        String cycle = first.cycle() != null ? " at cycle " + first.cycle() : "";
        String recommendation = switch (first.condition()) {
            case NEGATIVE_VOLUME -> "Refine or smooth the mesh of this part, reduce the time step scale factor, "
                    + "or switch to a more robust element formulation.";
            case CONSTRAINT_NAN -> "Check the constraints and joints connected to this element for "
                    + "conflicting or redundant definitions.";
            case GENERAL -> inputs.knowledge().lookup(first.code()).recommendation();
        };
        if (first.code() != 0 && inputs.knowledge().isCatalogued(first.code())) {
            recommendation = inputs.knowledge().lookup(first.code()).recommendation();
        }
        String message = String.format("%s in %s%s%s, reported %d time%s on %s.", what, where, owner, cycle,
                occurrence.count, occurrence.count == 1 ? "" : "s", ranks(occurrence.ranks));
        return Finding.critical(CATEGORY, what + " in " + where, message)
                .withRecommendation(recommendation)
                .withOccurrences(occurrence.count)
                .withEvidence(new Evidence(first.source(), "element",
                        first.elementId() != null ? String.valueOf(first.elementId()) : "", first.cycle(), null));
    }

    private static String describe(WarningEvent event, AnalysisInputs inputs) {
        return switch (event.condition()) {
            case NEGATIVE_VOLUME -> "Negative volume";
            case CONSTRAINT_NAN -> "NaN in the constraint matrix";
            case GENERAL -> {
                CodeEntry entry = inputs.knowledge().lookup(event.code());
                yield entry.title() + " (" + event.code() + ")";
            }
        };
    }

    private static OptionalInt owningPart(WarningEvent event, AnalysisInputs inputs) {
        if (event.elementId() != null) {
            OptionalInt mapped = inputs.owningPart(event.elementId());
            if (mapped.isPresent()) {
                return mapped;
            }
        }
        return event.partId() != null ? OptionalInt.of(event.partId()) : OptionalInt.empty();
    }

    static String ranks(Set<Integer> ranks) {
        List<String> labels = new ArrayList<>();
        for (int rank : ranks) {
            labels.add(rank == WarningEvent.UNRANKED ? "the primary log" : "rank " + rank);
        }
        return String.join(", ", labels);
    }

    private static final class Occurrence {
        final WarningEvent first;
        final Set<Integer> ranks = new TreeSet<>();
        long count;

        Occurrence(WarningEvent first) {
            this.first = first;
        }

        void add(WarningEvent event) {
            count++;
            ranks.add(event.rank());
        }
    }
}
