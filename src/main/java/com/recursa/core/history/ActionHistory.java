package com.recursa.core.history;

import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.ConsolidationSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Dual-track action history owned by a single agent frame.
 * <p>
 * The <em>fact</em> track is append-only and is the canonical record of every
 * executed action. The <em>rendered</em> track is what decision prompts see; it
 * is emptied each time a consolidation snapshot replaces it. Not thread-safe:
 * only the frame's own executor touches it.
 */
public class ActionHistory {

    private final String agentId;
    private final List<ActionRecord> facts = new ArrayList<>();
    private final List<ActionRecord> rendered = new ArrayList<>();
    private ConsolidationSnapshot latestSnapshot;
    private int turnsCompleted;

    public ActionHistory(String agentId) {
        this.agentId = Objects.requireNonNull(agentId, "agentId must not be null");
    }

    /**
     * Rebuilds a history from persisted records. The rendered track becomes the
     * facts recorded after the snapshot's {@code throughSequence}, which is the
     * same view the frame had before the state was persisted.
     */
    public static ActionHistory restore(String agentId, List<ActionRecord> facts,
                                        ConsolidationSnapshot snapshot, int turnsCompleted) {
        var history = new ActionHistory(agentId);
        long covered = snapshot != null ? snapshot.throughSequence() : 0L;
        for (ActionRecord record : facts) {
            history.facts.add(record);
            if (record.sequenceNo() > covered) {
                history.rendered.add(record);
            }
        }
        history.latestSnapshot = snapshot;
        history.turnsCompleted = turnsCompleted;
        return history;
    }

    public String agentId() {
        return agentId;
    }

    public long lastSequenceNo() {
        return facts.isEmpty() ? 0L : facts.get(facts.size() - 1).sequenceNo();
    }

    public long nextSequenceNo() {
        return lastSequenceNo() + 1;
    }

    /**
     * Appends a record to both tracks.
     *
     * @throws IllegalArgumentException if the record is out of sequence
     */
    public void append(ActionRecord record) {
        if (record.sequenceNo() != nextSequenceNo()) {
            throw new IllegalArgumentException("Out-of-sequence record " + record.sequenceNo()
                    + " for agent " + agentId + ", expected " + nextSequenceNo());
        }
        facts.add(record);
        rendered.add(record);
    }

    /**
     * Replaces the rendered track with the given snapshot. Leaves zero loose entries.
     * The fact track is untouched.
     */
    public void resetTo(ConsolidationSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        if (snapshot.throughSequence() > lastSequenceNo()) {
            throw new IllegalArgumentException("Snapshot covers sequence " + snapshot.throughSequence()
                    + " but history of " + agentId + " ends at " + lastSequenceNo());
        }
        rendered.clear();
        latestSnapshot = snapshot;
    }

    public List<ActionRecord> facts() {
        return Collections.unmodifiableList(new ArrayList<>(facts));
    }

    public List<ActionRecord> rendered() {
        return Collections.unmodifiableList(new ArrayList<>(rendered));
    }

    public Optional<ConsolidationSnapshot> latestSnapshot() {
        return Optional.ofNullable(latestSnapshot);
    }

    public RenderedView renderedView() {
        return new RenderedView(latestSnapshot, rendered);
    }

    public int factCount() {
        return facts.size();
    }

    public int turnsCompleted() {
        return turnsCompleted;
    }

    public void recordTurn() {
        turnsCompleted++;
    }
}
