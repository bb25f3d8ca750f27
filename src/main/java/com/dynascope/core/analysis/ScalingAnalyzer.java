package com.dynascope.core.analysis;

import com.dynascope.core.config.DynascopeProperties;
import com.dynascope.core.model.ComponentTiming;
import com.dynascope.core.model.Evidence;
import com.dynascope.core.model.Finding;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.ScalingProjection;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects parallel efficiency at larger core counts from the measured
 * compute/communication split. Every finding is a projection and says so.
 */
@Component
@Order(6)
public class ScalingAnalyzer implements Analyzer {

    public static final String CATEGORY = "scaling";

    private final DynascopeProperties properties;

    public ScalingAnalyzer(DynascopeProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "scaling";
    }

    @Override
    public List<Finding> analyze(AnalysisInputs inputs) {
        return findings(project(inputs.run(), properties));
    }

    /** Projections for the report; empty when cores, elapsed time or the timing table are unknown. */
    public static List<ScalingProjection> project(ParsedRun run, DynascopeProperties properties) {
        List<ComponentTiming> components = run.performance().components();
        if (components.isEmpty()) {
            return List.of();
        }
        return ScalingModel.project(ScalingModel.split(components), currentCores(run), elapsedSeconds(run),
                properties.getAnalysis().getScalingTargets(),
                properties.getAnalysis().getCommunicationGrowthExponent());
    }

    static List<Finding> findings(List<ScalingProjection> projections) {
        List<Finding> findings = new ArrayList<>();
        for (ScalingProjection projection : projections) {
            String message = String.format("Projected, not measured: at %d cores the run would take about %.0f s "
                            + "(speedup %.2fx, efficiency %.0f%%, communication %.0f%% of time).",
                    projection.cores(), projection.elapsedSeconds(), projection.speedup(),
                    projection.efficiency() * 100.0, projection.communicationShare() * 100.0);
            Evidence ref = Evidence.of(InputKind.HSP, "timing", "components");
            switch (projection.band()) {
                case SEVERE -> findings.add(Finding.warning(CATEGORY,
                                "Poor projected scaling at " + projection.cores() + " cores", message)
                        .withRecommendation("Adding cores beyond this point mostly adds communication; keep the current "
                                + "core count or reduce shared-node overhead first.")
                        .withEvidence(ref));
                case CAUTIONARY -> findings.add(Finding.info(CATEGORY,
                        "Marginal projected scaling at " + projection.cores() + " cores", message).withEvidence(ref));
                case ACCEPTABLE -> findings.add(Finding.info(CATEGORY,
                        "Acceptable projected scaling at " + projection.cores() + " cores", message).withEvidence(ref));
            }
        }
        return findings;
    }

    /** Processor count from the header, else the per-rank tables, else one. */
    static int currentCores(ParsedRun run) {
        if (run.model() != null && run.model().header().processors() > 0) {
            return run.model().header().processors();
        }
        if (!run.performance().processors().isEmpty()) {
            return run.performance().processors().size();
        }
        int ranks = (int) run.processorLoad().stream().mapToInt(s -> s.rank()).distinct().count();
        return Math.max(1, ranks);
    }

    static double elapsedSeconds(ParsedRun run) {
        if (run.termination() != null && run.termination().elapsedSeconds() > 0.0) {
            return run.termination().elapsedSeconds();
        }
        return run.performance().components().stream().mapToDouble(ComponentTiming::clockSeconds).sum();
    }
}
