package com.dynascope.dispatch.cli;

import com.dynascope.core.model.ComponentImbalance;
import com.dynascope.core.model.ComponentTiming;
import com.dynascope.core.model.ContactInterfaceSummary;
import com.dynascope.core.model.Coverage;
import com.dynascope.core.model.EnergySample;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.ModelSummary;
import com.dynascope.core.model.Report;
import com.dynascope.core.model.ScalingProjection;
import com.dynascope.core.model.Severity;
import com.dynascope.core.model.TerminationStatus;
import com.dynascope.core.model.TimestepSummary;
import picocli.CommandLine;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Terminal transcript of a {@link Report}. Findings are grouped by severity here;
 * the report itself keeps them in observation order.
 */
public final class ReportPrinter {

    private static final int TOP_ROWS = 5;

    private ReportPrinter() {}

    public static void print(Report report) {
        System.out.println();
        System.out.println("RESULT DIRECTORY " + report.directory());
        printRun(report.model(), report.termination());
        printCoverage(report.coverage());
        printEnergy(report);
        printTimestep(report.timestep());
        printContacts(report.contacts());
        printPerformance(report);
        printFindings(report);
    }

    private static void printRun(ModelSummary model, TerminationStatus termination) {
        ConsoleOutput.section("Run");
        if (model != null) {
            System.out.printf("  Solver:       %s %s (%s)%n", model.header().version(), model.header().revision(),
                    model.header().precision().isEmpty() ? "-" : model.header().precision());
            System.out.printf("  Processors:   %s%n", model.header().processors() > 0
                    ? String.valueOf(model.header().processors()) : "shared memory");
            System.out.printf("  Model:        %d nodes, %d elements, %d parts, %d contacts%n",
                    model.nodes(), model.elements(), model.parts(), model.contacts());
        }
        if (termination != null) {
            String state = switch (termination.state()) {
                case NORMAL -> "@|fg(green) normal termination|@";
                case ERROR_TERMINATED -> "@|fg(red),bold error termination|@";
                case INCOMPLETE -> "@|fg(yellow) incomplete|@";
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  Termination:  " + state));
            if (termination.problemTime() > 0.0) {
                System.out.printf("  Reached:      t=%.4E at cycle %d%n", termination.problemTime(), termination.cycles());
            }
            if (termination.elapsedSeconds() > 0.0) {
                System.out.printf("  Elapsed:      %.0f s%n", termination.elapsedSeconds());
            }
        }
    }

    private static void printCoverage(Coverage coverage) {
        if (!coverage.degraded()) {
            return;
        }
        ConsoleOutput.section("Coverage");
        if (!coverage.unavailable().isEmpty()) {
            ConsoleOutput.warn("Unavailable: " + coverage.unavailable().stream()
                    .map(InputKind::label)
                    .collect(Collectors.joining(", ")));
        }
        coverage.skippedRecords().forEach((kind, count) -> {
            if (count > 0) {
                ConsoleOutput.warn(count + " records skipped in " + kind.label());
            }
        });
    }

    private static void printEnergy(Report report) {
        if (report.energy().isEmpty()) {
            return;
        }
        ConsoleOutput.section("Energy");
        EnergySample last = report.energy().last().orElseThrow();
        System.out.printf("  Samples:      %d%n", report.energy().size());
        System.out.printf("  Final ratio:  %.4f%n", last.ratio());
        System.out.printf("  Hourglass:    %.1f%% of internal%n", last.hourglassRatio() * 100.0);
    }

    private static void printTimestep(TimestepSummary timestep) {
        if (timestep.intervals().isEmpty() && timestep.smallestElements().isEmpty()) {
            return;
        }
        ConsoleOutput.section("Time step");
        if (!Double.isNaN(timestep.initialDt())) {
            System.out.printf("  dt:           %.4E initial, %.4E final, %.4E minimum%n",
                    timestep.initialDt(), timestep.finalDt(), timestep.minimumDt());
        }
        System.out.printf("  Controllers:  %d intervals%n", timestep.intervals().size());
        timestep.partGroups().stream().limit(TOP_ROWS).forEach(group ->
                System.out.printf("    %-30s %4d elements, min dt %.4E%n",
                        group.partName(), group.elementCount(), group.minimumDt()));
    }

    private static void printContacts(List<ContactInterfaceSummary> contacts) {
        if (contacts.isEmpty()) {
            return;
        }
        ConsoleOutput.section("Contact");
        contacts.stream()
                .sorted(Comparator.comparingDouble(ContactInterfaceSummary::clockSeconds).reversed()
                        .thenComparingInt(ContactInterfaceSummary::interfaceId))
                .limit(TOP_ROWS)
                .forEach(c -> System.out.printf("  #%-6d %-28s %8.1f s  %6d warnings%n",
                        c.interfaceId(), c.type(), c.clockSeconds(), c.warningCount()));
    }

    private static void printPerformance(Report report) {
        List<ComponentTiming> components = report.performance().components();
        if (components.isEmpty() && report.loadBalance().isEmpty() && report.scaling().isEmpty()) {
            return;
        }
        ConsoleOutput.section("Performance");
        components.stream()
                .sorted(Comparator.comparingDouble(ComponentTiming::clockPercent).reversed())
                .limit(TOP_ROWS)
                .forEach(c -> System.out.printf("  %-30s %6.1f%% clock%n", c.component(), c.clockPercent()));
        for (ComponentImbalance imbalance : report.loadBalance()) {
            if (imbalance.coefficientOfVariation() > 0.08) {
                System.out.printf("  %-30s CoV %.2f across %d ranks (busiest rank %d)%n", imbalance.component(),
                        imbalance.coefficientOfVariation(), imbalance.ranks(), imbalance.busiestRank());
            }
        }
        for (ScalingProjection projection : report.scaling()) {
            System.out.printf("  Projected at %4d cores: speedup %.2fx, efficiency %.0f%% (%s)%n",
                    projection.cores(), projection.speedup(), projection.efficiency() * 100.0,
                    projection.band().name().toLowerCase(Locale.ROOT));
        }
    }

    private static void printFindings(Report report) {
        ConsoleOutput.section(String.format("Findings: %d critical, %d warning, %d info",
                report.count(Severity.CRITICAL), report.count(Severity.WARNING), report.count(Severity.INFO)));
        for (Severity severity : List.of(Severity.CRITICAL, Severity.WARNING, Severity.INFO)) {
            for (Finding finding : report.findings()) {
                if (finding.severity() != severity) {
                    continue;
                }
                String count = finding.occurrences() > 1 ? " (x" + finding.occurrences() + ")" : "";
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "  " + ConsoleOutput.severityTag(severity) + " " + finding.title() + count));
                System.out.println("      " + finding.message());
                if (!finding.recommendation().isEmpty()) {
                    System.out.println("      -> " + finding.recommendation());
                }
            }
        }
    }
}
