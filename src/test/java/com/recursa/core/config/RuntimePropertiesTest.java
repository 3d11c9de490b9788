package com.recursa.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuntimePropertiesTest {

    @Test
    @DisplayName("defaults match the documented configuration")
    void defaults() {
        var props = new RuntimeProperties();
        assertEquals("main_agent", props.getRootAgent());
        assertEquals("final_output", props.getFinalAction());
        assertEquals(5, props.getMaxDepth());
        assertEquals(10, props.consolidationIntervalFor(0));
        assertEquals(3, props.getMaxMalformedRetries());
    }

    @Test
    @DisplayName("per-level interval overrides the global one and is never below 1")
    void intervalOverrides() {
        var props = new RuntimeProperties();
        props.setConsolidationInterval(8);
        props.setConsolidationIntervalByLevel(Map.of(2, 4, 3, 0));

        assertEquals(8, props.consolidationIntervalFor(1));
        assertEquals(4, props.consolidationIntervalFor(2));
        assertEquals(1, props.consolidationIntervalFor(3));
    }
}
