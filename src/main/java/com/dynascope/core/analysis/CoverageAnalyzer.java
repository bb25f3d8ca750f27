package com.dynascope.core.analysis;

import com.dynascope.core.model.Coverage;
import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports what the analysis could not see: inputs that were missing or unreadable,
 * and records that had to be skipped.
 * <p>
 * A missing input is reported without evidence pointing at it, so removing a file
 * never adds findings that reference that file.
 */
@Component
@Order(10)
public class CoverageAnalyzer implements Analyzer {

    public static final String CATEGORY = "coverage";

    @Override
    public String name() {
        return "coverage";
    }

    @Override
    public List<Finding> analyze(AnalysisInputs inputs) {
        Coverage coverage = inputs.run().coverage();
        List<Finding> findings = new ArrayList<>(unavailableInputs(coverage));
        findings.addAll(skippedRecords(coverage));
        return findings;
    }

    static List<Finding> unavailableInputs(Coverage coverage) {
        List<Finding> findings = new ArrayList<>();
        for (InputKind kind : coverage.unavailable()) {
            findings.add(Finding.info(CATEGORY, kind.label() + " not available",
                    String.format("No usable %s was found; %s.", kind.label(), consequence(kind))));
        }
        return findings;
    }

    static List<Finding> skippedRecords(Coverage coverage) {
        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<InputKind, Long> entry : coverage.skippedRecords().entrySet()) {
            long skipped = entry.getValue();
            if (skipped <= 0) {
                continue;
            }
            findings.add(Finding.warning(CATEGORY, "Unparsed records in " + entry.getKey().label(),
                            String.format("%d record%s in %s could not be parsed and %s skipped.", skipped,
                                    skipped == 1 ? "" : "s", entry.getKey().label(), skipped == 1 ? "was" : "were"))
                    .withRecommendation("Check whether the file was truncated or written by an unsupported solver version.")
                    .withOccurrences(skipped)
                    .withEvidence(Evidence.of(entry.getKey(), "file", entry.getKey().label())));
        }
        return findings;
    }

    static String consequence(InputKind kind) {
        return switch (kind) {
            case HSP -> "model statistics, part tables and timing are unavailable";
            case GLSTAT -> "energy checks fall back to the energy blocks of the high-speed-printer log";
            case STATUS -> "progress estimates are unavailable";
            case MATSUM -> "per-part energy checks are skipped";
            case MESSAGE -> "warnings and termination markers come only from the high-speed-printer log";
            case NODOUT -> "shooting-node and oscillation checks are skipped";
            case BNDOUT -> "boundary force checks are skipped";
            case LOAD_PROFILE -> "per-rank load balance is unavailable";
            case CONTACT_PROFILE -> "interface timing relies on the high-speed-printer timing table";
            case INPUT_DECK -> "element ownership relies on the timestep tables";
        };
    }
}
