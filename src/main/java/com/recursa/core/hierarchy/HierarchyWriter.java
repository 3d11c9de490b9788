package com.recursa.core.hierarchy;

import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.HierarchyEntry;

import java.util.List;
import java.util.Map;

/**
 * Persists a candidate stack and hierarchy index before the manager makes them visible.
 */
@FunctionalInterface
public interface HierarchyWriter {

    /**
     * @throws com.recursa.core.persistence.StateStoreException if the write fails
     */
    void write(List<AgentFrame> stack, Map<String, HierarchyEntry> index);
}
