package com.dynascope.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("DSC-0001");
        assertEquals("DSC-0001", MDC.get("runId"));
    }

    @Test
    @DisplayName("setInput puts runId and input in MDC")
    void setInput() {
        MdcContext.setInput("DSC-0001", "mes0003");
        assertEquals("DSC-0001", MDC.get("runId"));
        assertEquals("mes0003", MDC.get("input"));
    }

    @Test
    @DisplayName("setAnalyzer puts runId and analyzer in MDC")
    void setAnalyzer() {
        MdcContext.setAnalyzer("DSC-0001", "energy");
        assertEquals("energy", MDC.get("analyzer"));
    }

    @Test
    @DisplayName("clear removes all dynascope MDC keys")
    void clear() {
        MdcContext.setInput("DSC-0001", "d3hsp");
        MdcContext.setAnalyzer("DSC-0001", "energy");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("input"));
        assertNull(MDC.get("analyzer"));
    }
}
