package com.dynascope.core.engine;

import com.dynascope.core.analysis.AnalysisInputs;
import com.dynascope.core.analysis.Analyzer;
import com.dynascope.core.config.DynascopeProperties;
import com.dynascope.core.events.DiagnosisEvent;
import com.dynascope.core.events.EventBus;
import com.dynascope.core.knowledge.KnowledgeBase;
import com.dynascope.core.logging.MdcContext;
import com.dynascope.core.metrics.DiagnosisMetrics;
import com.dynascope.core.model.AnalysisOutcome;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.Report;
import com.dynascope.core.model.RunBundle;
import com.dynascope.core.parser.AnalysisCancelledException;
import com.dynascope.core.parser.CancellationToken;
import com.dynascope.core.report.AnalyzerFindings;
import com.dynascope.core.report.EmptyRunException;
import com.dynascope.core.report.ReportAggregator;
import com.dynascope.core.scanner.RunBundleScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one diagnosis end to end: scan the directory, drive every reader to completion
 * in parallel, join their outputs into a parsed run, run the analyzers in
 * parallel and aggregate the {@link Report}.
 * <p>
 * Data-quality problems never escape as exceptions. The caller always receives an
 * {@link AnalysisOutcome}: a report (complete or degraded), a fatal-input failure
 * naming what was missing, or an aborted run.
 */
@Service
public class DiagnosisEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final RunBundleScanner scanner;
    private final RunReaders readers;
    private final List<Analyzer> analyzers;
    private final ReportAggregator aggregator;
    private final KnowledgeBase knowledge;
    private final DynascopeProperties properties;
    private final ExecutorService executor;
    private final EventBus eventBus;
    private final DiagnosisMetrics metrics;

    public DiagnosisEngine(RunBundleScanner scanner, RunReaders readers, List<Analyzer> analyzers,
                           ReportAggregator aggregator, KnowledgeBase knowledge, DynascopeProperties properties,
                           ExecutorService diagnosisExecutor, EventBus eventBus, DiagnosisMetrics metrics) {
        this.scanner = scanner;
        this.readers = readers;
        this.analyzers = List.copyOf(analyzers);
        this.aggregator = aggregator;
        this.knowledge = knowledge;
        this.properties = properties;
        this.executor = diagnosisExecutor;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Diagnoses a result directory with the configured tracked-node cap.
     */
    public AnalysisOutcome diagnose(Path directory) {
        return diagnose(generateRunId(), directory, properties.getInput().getMaxTrackedNodes(), CancellationToken.none());
    }

    /**
     * Diagnoses a result directory.
     *
     * @param runId           identifier used in logs and progress events only
     * @param maxTrackedNodes cap on distinct nodes read from each time-history file
     * @param cancellation    cooperative cancellation signal polled by every reader and analyzer
     */
    public AnalysisOutcome diagnose(String runId, Path directory, int maxTrackedNodes, CancellationToken cancellation) {
        MdcContext.setRun(runId);
        try {
            log.info("Starting diagnosis {} of {}", runId, directory);
            publish("run.started", runId, null, Map.of("directory", directory.toString()));

            RunBundle bundle = scanner.scan(directory);
            if (!bundle.hasRequiredInputs()) {
                return fatal(runId, bundle.missingRequired(), "No high-speed-printer log or message log in " + directory);
            }

            RunReaders.Result read = readers.read(runId, bundle, maxTrackedNodes, cancellation);
            AnalysisInputs inputs = new AnalysisInputs(bundle, read.run(), read.mapper(), knowledge, read.timeHistory());

            cancellation.throwIfCancelled();
            List<AnalyzerFindings> results = runAnalyzers(runId, inputs, cancellation);
            cancellation.throwIfCancelled();

            Report report = aggregator.aggregate(inputs, results);
            for (Finding finding : report.findings()) {
                metrics.recordFinding(finding.analyzer(), finding.severity().name());
            }
            AnalysisOutcome outcome = AnalysisOutcome.completed(report);
            metrics.recordOutcome(outcome.status().name());
            publish("run.completed", runId, null, Map.of(
                    "status", outcome.status().name(),
                    "findings", report.findings().size()));
            log.info("Diagnosis {} finished with status {}", runId, outcome.status());
            return outcome;
        } catch (MissingInputException e) {
            return fatal(runId, e.getMissing(), e.getMessage());
        } catch (EmptyRunException e) {
            return fatal(runId, List.of(), e.getMessage());
        } catch (AnalysisCancelledException e) {
            log.info("Diagnosis {} aborted", runId);
            metrics.recordOutcome(AnalysisOutcome.Status.ABORTED.name());
            publish("run.aborted", runId, null, Map.of());
            return AnalysisOutcome.aborted(e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private List<AnalyzerFindings> runAnalyzers(String runId, AnalysisInputs inputs, CancellationToken cancellation) {
        List<CompletableFuture<AnalyzerFindings>> futures = new ArrayList<>();
        for (Analyzer analyzer : analyzers) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> runAnalyzer(runId, analyzer, inputs, cancellation), executor));
        }
        List<AnalyzerFindings> results = new ArrayList<>();
        for (CompletableFuture<AnalyzerFindings> future : futures) {
            results.add(join(future));
        }
        return results;
    }

    private AnalyzerFindings runAnalyzer(String runId, Analyzer analyzer, AnalysisInputs inputs,
                                         CancellationToken cancellation) {
        MdcContext.setAnalyzer(runId, analyzer.name());
        try {
            cancellation.throwIfCancelled();
            List<Finding> findings = analyzer.analyze(inputs);
            log.debug("Analyzer {} produced {} findings", analyzer.name(), findings.size());
            publish("analyzer.completed", runId, analyzer.name(), Map.of("findings", findings.size()));
            return new AnalyzerFindings(analyzer.name(), findings);
        } catch (AnalysisCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Analyzer {} failed: {}", analyzer.name(), e.getMessage(), e);
            return new AnalyzerFindings(analyzer.name(), List.of(Finding.warning("coverage",
                    "Analysis step " + analyzer.name() + " failed",
                    "The " + analyzer.name() + " checks could not be completed: " + e.getMessage()
                            + ". Findings of this category may be missing.")));
        } finally {
            MdcContext.clear();
        }
    }

    private AnalysisOutcome fatal(String runId, List<String> missing, String detail) {
        log.error("Diagnosis {} cannot proceed: {}", runId, detail);
        metrics.recordOutcome(AnalysisOutcome.Status.FATAL_INPUT.name());
        publish("run.completed", runId, null, Map.of("status", AnalysisOutcome.Status.FATAL_INPUT.name()));
        return AnalysisOutcome.fatal(missing, detail);
    }

    private void publish(String type, String runId, String subject, Map<String, Object> payload) {
        eventBus.publish(new DiagnosisEvent(type, runId, subject, payload, Instant.now()));
    }

    /** Unwraps the exception a worker task failed with. */
    static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Generates a run ID of the form DSC-NNNN, unique within this process.
     */
    public String generateRunId() {
        return String.format("DSC-%04d", RUN_COUNTER.incrementAndGet());
    }
}
