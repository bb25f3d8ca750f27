package com.dynascope.core.analysis;

import com.dynascope.core.model.Finding;

import java.util.List;

/**
 * One diagnostic concern applied to a parsed run.
 * <p>
 * Implementations are stateless: {@link #analyze} reads its inputs, never
 * mutates them, and returns findings in the order their triggering evidence
 * appears. Severity ordering is left to renderers.
 */
public interface Analyzer {

    /** Short stable name, used to tag findings and in metrics. */
    String name();

    List<Finding> analyze(AnalysisInputs inputs);
}
