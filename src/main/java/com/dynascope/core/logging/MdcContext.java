package com.dynascope.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for diagnosis logging: {@code runId}, {@code input} and {@code analyzer}.
 * Worker threads set their own keys; callers clear them in a {@code finally} block.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String INPUT = "input";
    public static final String ANALYZER = "analyzer";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setInput(String runId, String input) {
        MDC.put(RUN_ID, runId);
        MDC.put(INPUT, input);
    }

    public static void setAnalyzer(String runId, String analyzer) {
        MDC.put(RUN_ID, runId);
        MDC.put(ANALYZER, analyzer);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(INPUT);
        MDC.remove(ANALYZER);
    }
}
