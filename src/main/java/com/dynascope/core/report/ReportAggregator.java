package com.dynascope.core.report;

import com.dynascope.core.analysis.AnalysisInputs;
import com.dynascope.core.analysis.ContactAnalyzer;
import com.dynascope.core.analysis.LoadStatistics;
import com.dynascope.core.analysis.ScalingAnalyzer;
import com.dynascope.core.analysis.TimestepAnalyzer;
import com.dynascope.core.config.DynascopeProperties;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.Report;
import com.dynascope.core.model.Severity;
import com.dynascope.core.model.WarningEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Joins the reader summaries and every analyzer's findings into one {@link Report}.
 * <p>
 * Runs once per diagnosis after all analyzers have finished. Findings keep analyzer
 * order and, within an analyzer, the order the analyzer produced them in; each is
 * tagged with the name of the analyzer that raised it.
 */
@Service
public class ReportAggregator {

    private static final Logger log = LoggerFactory.getLogger(ReportAggregator.class);

    private final DynascopeProperties properties;

    public ReportAggregator(DynascopeProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws EmptyRunException when no reader produced any usable summary
     */
    public Report aggregate(AnalysisInputs inputs, List<AnalyzerFindings> results) {
        ParsedRun run = inputs.run();
        String directory = inputs.bundle().directory().toString();
        if (run.isEmpty()) {
            throw new EmptyRunException(directory);
        }

        List<Finding> findings = new ArrayList<>();
        for (AnalyzerFindings result : results) {
            for (Finding finding : result.findings()) {
                findings.add(finding.withAnalyzer(result.analyzer()));
            }
        }

        Report report = new Report(
                directory,
                run.model(),
                run.termination(),
                run.coverage(),
                run.parts(),
                run.energy(),
                TimestepAnalyzer.summarize(run, inputs::partName),
                ContactAnalyzer.summarize(run),
                run.performance(),
                LoadStatistics.imbalance(run.processorLoad()),
                ScalingAnalyzer.project(run, properties),
                warningCounts(run.warnings()),
                findings);

        log.info("Run converged: {} findings ({} critical, {} warning, {} info), coverage {}",
                findings.size(), report.count(Severity.CRITICAL), report.count(Severity.WARNING),
                report.count(Severity.INFO), run.coverage().degraded() ? "degraded" : "complete");
        return report;
    }

    static Map<Integer, Long> warningCounts(List<WarningEvent> events) {
        Map<Integer, Long> counts = new TreeMap<>();
        for (WarningEvent event : events) {
            if (event.code() != 0) {
                counts.merge(event.code(), 1L, Long::sum);
            }
        }
        return counts;
    }
}
