package com.recursa.core.persistence;

import com.recursa.core.history.ActionHistory;
import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.ConsolidationSnapshot;

import java.io.Serializable;
import java.util.List;

/**
 * Persisted form of one frame's history: the full fact track, the latest
 * snapshot and the number of turns the frame has used.
 *
 * @param agentId        owning frame
 * @param facts          every recorded action, in sequence order
 * @param latestSnapshot latest consolidation snapshot, null if none yet
 * @param turnsCompleted turns used so far
 */
public record FrameHistoryRecord(
    String agentId,
    List<ActionRecord> facts,
    ConsolidationSnapshot latestSnapshot,
    int turnsCompleted
) implements Serializable {

    public FrameHistoryRecord {
        facts = facts == null ? List.of() : List.copyOf(facts);
    }

    public static FrameHistoryRecord of(ActionHistory history) {
        return new FrameHistoryRecord(history.agentId(), history.facts(),
                history.latestSnapshot().orElse(null), history.turnsCompleted());
    }

    public ActionHistory toHistory() {
        return ActionHistory.restore(agentId, facts, latestSnapshot, turnsCompleted);
    }
}
