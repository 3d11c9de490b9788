package com.recursa.core.history;

import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.ConsolidationSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * What the next decision prompt sees of a frame's past: the latest snapshot
 * followed by the loose records appended since it.
 *
 * @param snapshot latest snapshot, null before the first consolidation
 * @param entries  rendered records after the snapshot
 */
public record RenderedView(
    ConsolidationSnapshot snapshot,
    List<ActionRecord> entries
) {

    public RenderedView {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public Optional<ConsolidationSnapshot> latestSnapshot() {
        return Optional.ofNullable(snapshot);
    }
}
