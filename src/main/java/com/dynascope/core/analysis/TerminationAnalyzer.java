package com.dynascope.core.analysis;

import com.dynascope.core.knowledge.CodeEntry;
import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.TerminationStatus;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports how the run ended: error termination, no termination banner at all,
 * or a normal termination short of the requested end time.
 */
@Component
@Order(1)
public class TerminationAnalyzer implements Analyzer {

    public static final String CATEGORY = "termination";

    static final double COMPLETION_THRESHOLD = 0.99;

    @Override
    public String name() {
        return "termination";
    }

    @Override
    public List<Finding> analyze(AnalysisInputs inputs) {
        TerminationStatus status = inputs.run().termination();
        if (status == null) {
            return List.of();
        }
        InputKind source = status.source();
        List<Finding> findings = new ArrayList<>();
        switch (status.state()) {
            case ERROR_TERMINATED -> findings.add(errorTermination(status, source, inputs));
            case INCOMPLETE -> findings.add(incomplete(status, source));
            case NORMAL -> {
                Finding early = earlyNormalTermination(status, source);
                if (early != null) {
                    findings.add(early);
                }
            }
        }
        return findings;
    }

    static Finding errorTermination(TerminationStatus status, InputKind source, AnalysisInputs inputs) {
        String cause = "";
        String recommendation = "Inspect the last warnings and errors before the termination and the elements they name.";
        if (status.errorCode() != 0) {
            CodeEntry entry = inputs.knowledge().lookup(status.errorCode());
            cause = String.format(" Last error: %d (%s).", status.errorCode(), entry.title());
            if (entry.isCatalogued()) {
                recommendation = entry.recommendation();
            }
        }
        return Finding.critical(CATEGORY, "Error termination",
                        String.format("The solver stopped with an error termination at cycle %d, t=%.4E.%s",
                                status.cycles(), status.problemTime(), cause))
                .withRecommendation(recommendation)
                .withEvidence(Evidence.at(source, "termination", status.state(), status.cycles(), status.problemTime()));
    }

    static Finding incomplete(TerminationStatus status, InputKind source) {
        return Finding.critical(CATEGORY, "Run did not terminate",
                        String.format("No termination banner was found; the last reported cycle is %d at t=%.4E. "
                                + "The run was killed, crashed, or is still running.", status.cycles(), status.problemTime()))
                .withRecommendation("Check the job scheduler and system logs for the reason the process ended.")
                .withEvidence(Evidence.at(source, "termination", status.state(), status.cycles(), status.problemTime()));
    }

    /** Normal termination that reached less than 99% of the requested end time, or {@code null}. */
    static Finding earlyNormalTermination(TerminationStatus status, InputKind source) {
        double completion = status.completionRatio();
        if (Double.isNaN(completion) || completion >= COMPLETION_THRESHOLD) {
            return null;
        }
        return Finding.warning(CATEGORY, "Terminated before the requested end time",
                        String.format("Normal termination at t=%.4E, %.1f%% of the termination time %.4E.",
                                status.problemTime(), completion * 100.0, status.targetTime()))
                .withRecommendation("Check for sense switches, a *TERMINATION keyword or a time step limit that stopped the run early.")
                .withEvidence(Evidence.at(source, "termination", status.state(), status.cycles(), status.problemTime()));
    }
}
