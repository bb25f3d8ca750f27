package com.dynascope.core.config;

import com.dynascope.core.knowledge.KnowledgeBase;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure for the diagnosis pipeline: the worker pool readers and
 * analyzers run on, the knowledge base, and a fallback meter registry.
 */
@Configuration
public class AnalysisConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

    /**
     * Fixed pool of daemon workers sized by {@code dynascope.analysis.reader-threads}.
     * Readers are joined before analyzers are submitted, so one pool serves both.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService diagnosisExecutor(DynascopeProperties properties) {
        int threads = properties.getAnalysis().getReaderThreads();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "dynascope-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.debug("Creating diagnosis pool with {} threads", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }

    /** Without spring-web on the classpath Boot contributes no mapper of its own. */
    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public KnowledgeBase knowledgeBase(ObjectMapper objectMapper) {
        return KnowledgeBase.loadDefault(objectMapper);
    }

    /**
     * In-memory registry used when no monitoring backend contributes one.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
