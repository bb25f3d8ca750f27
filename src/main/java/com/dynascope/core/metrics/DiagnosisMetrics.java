package com.dynascope.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for diagnosis runs.
 */
@Service
public class DiagnosisMetrics {

    private final MeterRegistry registry;

    public DiagnosisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordReaderDuration(String input, long ms) {
        Timer.builder("dynascope.reader.duration")
                .tag("input", input)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records malformed records a reader skipped. Nothing is registered for a clean file.
     */
    public void recordSkippedRecords(String input, long count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("dynascope.reader.skipped")
                .description("Malformed records skipped by readers")
                .tag("input", input)
                .register(registry)
                .increment(count);
    }

    public void recordFinding(String analyzer, String severity) {
        Counter.builder("dynascope.findings.total")
                .tag("analyzer", analyzer)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordOutcome(String status) {
        Counter.builder("dynascope.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
