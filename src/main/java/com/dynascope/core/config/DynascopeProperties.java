package com.dynascope.core.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for reading and analysing a result directory.
 * <p>
 * Binds {@code dynascope.*} from application.yml / environment variables.
 *
 * <pre>
 * dynascope:
 *   input:
 *     max-tracked-nodes: 1000
 *     sibling-gap: 8
 *   analysis:
 *     reader-threads: 4
 *     oscillation-window: 256
 *     scaling-targets: 32,64,128,256
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "dynascope")
public class DynascopeProperties {

    private static final Logger log = LoggerFactory.getLogger(DynascopeProperties.class);

    private Input input = new Input();
    private Analysis analysis = new Analysis();

    @PostConstruct
    void validate() {
        if (input.maxTrackedNodes < 1) {
            throw new IllegalStateException("dynascope.input.max-tracked-nodes must be at least 1");
        }
        if (input.siblingGap < 1) {
            throw new IllegalStateException("dynascope.input.sibling-gap must be at least 1");
        }
        if (analysis.readerThreads < 1) {
            throw new IllegalStateException("dynascope.analysis.reader-threads must be at least 1");
        }
        if (analysis.oscillationWindow < 2 || analysis.dampingWindow < 2) {
            throw new IllegalStateException("dynascope.analysis oscillation and damping windows need at least 2 samples");
        }
        log.debug("Analysis settings: {} reader threads, oscillation window {}, damping window {}, scaling targets {}",
                analysis.readerThreads, analysis.oscillationWindow, analysis.dampingWindow, analysis.scalingTargets);
    }

    public Input getInput() { return input; }
    public void setInput(Input input) { this.input = input; }
    public Analysis getAnalysis() { return analysis; }
    public void setAnalysis(Analysis analysis) { this.analysis = analysis; }

    public static class Input {
        /** Distinct nodes followed by the time-history readers; further nodes are ignored. */
        private int maxTrackedNodes = 1000;
        /** Consecutive missing ranks that end the probe for per-process message logs. */
        private int siblingGap = 8;
        private int maxSiblingRank = 9999;

        public int getMaxTrackedNodes() { return maxTrackedNodes; }
        public void setMaxTrackedNodes(int maxTrackedNodes) { this.maxTrackedNodes = maxTrackedNodes; }
        public int getSiblingGap() { return siblingGap; }
        public void setSiblingGap(int siblingGap) { this.siblingGap = siblingGap; }
        public int getMaxSiblingRank() { return maxSiblingRank; }
        public void setMaxSiblingRank(int maxSiblingRank) { this.maxSiblingRank = maxSiblingRank; }
    }

    public static class Analysis {
        private int readerThreads = 4;
        /** Trailing samples per node used for the zero-crossing frequency estimate. */
        private int oscillationWindow = 256;
        /** Trailing samples per boundary node used for the sign-alternation check. */
        private int dampingWindow = 32;
        private List<Integer> scalingTargets = new ArrayList<>(List.of(32, 64, 128, 256));
        /** Exponent g of the communication growth term (cores ratio)^g. */
        private double communicationGrowthExponent = 0.5;

        public int getReaderThreads() { return readerThreads; }
        public void setReaderThreads(int readerThreads) { this.readerThreads = readerThreads; }
        public int getOscillationWindow() { return oscillationWindow; }
        public void setOscillationWindow(int oscillationWindow) { this.oscillationWindow = oscillationWindow; }
        public int getDampingWindow() { return dampingWindow; }
        public void setDampingWindow(int dampingWindow) { this.dampingWindow = dampingWindow; }
        public List<Integer> getScalingTargets() { return scalingTargets; }
        public void setScalingTargets(List<Integer> scalingTargets) { this.scalingTargets = scalingTargets; }
        public double getCommunicationGrowthExponent() { return communicationGrowthExponent; }
        public void setCommunicationGrowthExponent(double exponent) { this.communicationGrowthExponent = exponent; }
    }
}
