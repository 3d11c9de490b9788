package com.recursa.core.consolidation;

import com.recursa.core.model.ConsolidationSnapshot;

/**
 * Outcome of one consolidation event.
 *
 * @param snapshot the snapshot that replaces the rendered history
 * @param attempts model calls made
 * @param failure  last failure message when the snapshot is degraded, null otherwise
 */
public record ConsolidationResult(
    ConsolidationSnapshot snapshot,
    int attempts,
    String failure
) {

    public boolean degraded() {
        return snapshot.degraded();
    }
}
