package com.dynascope.core.analysis;

import com.dynascope.core.model.ContactDefinition;
import com.dynascope.core.model.ContactInterfaceSummary;
import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InitialPenetration;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.InterfaceLoadSample;
import com.dynascope.core.model.InterfaceTiming;
import com.dynascope.core.model.InterfaceWarningCount;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.WarningEvent;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Per-interface contact summary: warnings, initial penetrations and clock time,
 * with the interfaces ranked by cost.
 */
@Component
@Order(4)
public class ContactAnalyzer implements Analyzer {

    public static final String CATEGORY = "contact";

    static final long WARNING_COUNT_THRESHOLD = 100;
    static final double DOMINANT_SHARE = 0.50;

    @Override
    public String name() {
        return "contact";
    }

    @Override
    public List<Finding> analyze(AnalysisInputs inputs) {
        List<ContactInterfaceSummary> summaries = summarize(inputs.run());
        List<Finding> findings = new ArrayList<>(noisyInterfaces(summaries));
        findings.addAll(dominantInterface(summaries, timingSource(inputs.run())));
        return findings;
    }

    /**
     * One summary per interface id, ascending by id. Timing comes from the
     * high-speed-printer timing table when it lists interfaces, otherwise from
     * the contact profile (slowest rank).
     */
    public static List<ContactInterfaceSummary> summarize(ParsedRun run) {
        Map<Integer, ContactDefinition> definitions = new HashMap<>();
        for (ContactDefinition definition : run.contacts()) {
            definitions.putIfAbsent(definition.interfaceId(), definition);
        }
        Map<Integer, Long> summaryCounts = new HashMap<>();
        for (InterfaceWarningCount count : run.interfaceWarningCounts()) {
            summaryCounts.merge(count.interfaceId(), count.count(), Long::sum);
        }
        Map<Integer, Long> eventCounts = new HashMap<>();
        for (WarningEvent event : run.warnings()) {
            if (event.interfaceId() != null) {
                eventCounts.merge(event.interfaceId(), 1L, Long::sum);
            }
        }
        Map<Integer, Long> penetrations = new HashMap<>();
        for (InitialPenetration penetration : run.penetrations()) {
            penetrations.merge(penetration.interfaceId(), penetration.count(), Long::sum);
        }
        Map<Integer, InterfaceTiming> timings = new HashMap<>();
        for (InterfaceTiming timing : run.performance().interfaces()) {
            timings.putIfAbsent(timing.interfaceId(), timing);
        }
        Map<Integer, Double> profileSeconds = new HashMap<>();
        for (InterfaceLoadSample sample : run.interfaceLoad()) {
            profileSeconds.merge(sample.interfaceId(), sample.seconds(), Math::max);
        }
        double profileTotal = profileSeconds.values().stream().mapToDouble(Double::doubleValue).sum();

        TreeSet<Integer> ids = new TreeSet<>(definitions.keySet());
        ids.addAll(summaryCounts.keySet());
        ids.addAll(penetrations.keySet());
        ids.addAll(timings.keySet());
        ids.addAll(profileSeconds.keySet());

        List<ContactInterfaceSummary> summaries = new ArrayList<>();
        for (int id : ids) {
            ContactDefinition definition = definitions.get(id);
            String type = definition == null ? "" : ContactTypes.describe(definition.typeNumber(), definition.typePrefix());
            String title = definition == null ? "" : definition.title();
            long warnings = summaryCounts.containsKey(id) ? summaryCounts.get(id) : eventCounts.getOrDefault(id, 0L);
            double cpu = 0.0;
            double clock = 0.0;
            double percent = 0.0;
            InterfaceTiming timing = timings.get(id);
            if (timing != null) {
                cpu = timing.cpuSeconds();
                clock = timing.clockSeconds();
                percent = timing.clockPercent();
            } else if (profileSeconds.containsKey(id)) {
                clock = profileSeconds.get(id);
                percent = profileTotal > 0.0 ? clock / profileTotal * 100.0 : 0.0;
            }
            summaries.add(new ContactInterfaceSummary(id, type, title, warnings,
                    penetrations.getOrDefault(id, 0L), cpu, clock, percent));
        }
        return summaries;
    }

    /** Interfaces by clock time, most expensive first; ties by id. */
    public static List<ContactInterfaceSummary> rankByClock(List<ContactInterfaceSummary> summaries) {
        List<ContactInterfaceSummary> ranked = new ArrayList<>(summaries);
        ranked.sort(Comparator.comparingDouble(ContactInterfaceSummary::clockSeconds).reversed()
                .thenComparingInt(ContactInterfaceSummary::interfaceId));
        return ranked;
    }

    /** Warning per interface with more than 100 warnings. */
    static List<Finding> noisyInterfaces(List<ContactInterfaceSummary> summaries) {
        List<Finding> findings = new ArrayList<>();
        for (ContactInterfaceSummary summary : summaries) {
            if (summary.warningCount() > WARNING_COUNT_THRESHOLD) {
                findings.add(Finding.warning(CATEGORY, "Contact interface with many warnings",
                                String.format("Interface %d%s reported %d warnings.",
                                        summary.interfaceId(), label(summary), summary.warningCount()))
                        .withRecommendation("Check the interface for mesh incompatibility, initial penetrations and "
                                + "segment orientation; tied contacts may need a larger search distance.")
                        .withOccurrences(summary.warningCount())
                        .withEvidence(Evidence.of(InputKind.MESSAGE, "interface", summary.interfaceId())));
            }
        }
        return findings;
    }

    /** Info when the most expensive interface takes more than half of all contact clock time. */
    static List<Finding> dominantInterface(List<ContactInterfaceSummary> summaries, InputKind source) {
        double total = summaries.stream().mapToDouble(ContactInterfaceSummary::clockSeconds).sum();
        if (total <= 0.0) {
            return List.of();
        }
        ContactInterfaceSummary top = rankByClock(summaries).get(0);
        double share = top.clockSeconds() / total;
        if (share <= DOMINANT_SHARE) {
            return List.of();
        }
        return List.of(Finding.info(CATEGORY, "One interface dominates contact cost",
                        String.format("Interface %d%s takes %.1f%% of contact clock time (%.2f s).",
                                top.interfaceId(), label(top), share * 100.0, top.clockSeconds()))
                .withRecommendation("Restrict this contact to the parts that actually touch and "
                        + "review its bucket sort frequency.")
                .withEvidence(Evidence.of(source, "interface", top.interfaceId())));
    }

    private static InputKind timingSource(ParsedRun run) {
        return run.performance().interfaces().isEmpty() ? InputKind.CONTACT_PROFILE : InputKind.HSP;
    }

    private static String label(ContactInterfaceSummary summary) {
        StringBuilder label = new StringBuilder();
        if (!summary.type().isEmpty()) {
            label.append(" (").append(summary.type()).append(')');
        }
        if (!summary.title().isEmpty()) {
            label.append(" \"").append(summary.title()).append('"');
        }
        return label.toString();
    }
}
