package com.dynascope.core.report;

import com.dynascope.core.model.Finding;

import java.util.List;

/**
 * The findings one analyzer produced, in its own observation order.
 */
public record AnalyzerFindings(String analyzer, List<Finding> findings) {

    public AnalyzerFindings {
        findings = List.copyOf(findings);
    }
}
