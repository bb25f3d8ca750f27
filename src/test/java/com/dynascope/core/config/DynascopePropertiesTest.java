package com.dynascope.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DynascopePropertiesTest {

    @Test
    @DisplayName("defaults match the documented analysis settings")
    void defaults() {
        DynascopeProperties properties = new DynascopeProperties();

        assertEquals(1000, properties.getInput().getMaxTrackedNodes());
        assertEquals(8, properties.getInput().getSiblingGap());
        assertEquals(256, properties.getAnalysis().getOscillationWindow());
        assertEquals(32, properties.getAnalysis().getDampingWindow());
        assertEquals(List.of(32, 64, 128, 256), properties.getAnalysis().getScalingTargets());
        assertEquals(0.5, properties.getAnalysis().getCommunicationGrowthExponent());
        assertDoesNotThrow(properties::validate);
    }

    @Test
    @DisplayName("rejects a node cap below one")
    void nodeCap() {
        DynascopeProperties properties = new DynascopeProperties();
        properties.getInput().setMaxTrackedNodes(0);

        var e = assertThrows(IllegalStateException.class, properties::validate);
        assertTrue(e.getMessage().contains("max-tracked-nodes"));
    }

    @Test
    @DisplayName("rejects windows too short to hold a sign change")
    void windows() {
        DynascopeProperties properties = new DynascopeProperties();
        properties.getAnalysis().setDampingWindow(1);

        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    @DisplayName("rejects an empty reader pool")
    void readerThreads() {
        DynascopeProperties properties = new DynascopeProperties();
        properties.getAnalysis().setReaderThreads(0);

        assertThrows(IllegalStateException.class, properties::validate);
    }
}
