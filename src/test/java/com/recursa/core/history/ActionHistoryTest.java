package com.recursa.core.history;

import com.recursa.core.model.Action;
import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.ConsolidationSnapshot;
import com.recursa.core.model.FailureReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionHistoryTest {

    private ActionHistory history;

    @BeforeEach
    void setUp() {
        history = new ActionHistory("main_agent_abc");
    }

    private static ActionRecord ok(long seq) {
        return ActionRecord.success(seq, new Action("file_read", Map.of("path", "f" + seq)), "content " + seq);
    }

    private static ConsolidationSnapshot snapshotThrough(long seq) {
        return new ConsolidationSnapshot(List.of(), "facts", "1. keep going", "", false, seq, Instant.now());
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("adds the record to both tracks")
        void addsToBothTracks() {
            history.append(ok(1));
            history.append(ActionRecord.failure(2, new Action("web_search", Map.of()),
                    FailureReason.TOOL_ERROR, "timeout"));

            assertEquals(2, history.facts().size());
            assertEquals(2, history.rendered().size());
            assertEquals(2, history.lastSequenceNo());
            assertEquals(3, history.nextSequenceNo());
            assertTrue(history.facts().get(1).failed());
        }

        @Test
        @DisplayName("rejects a record out of sequence")
        void rejectsGap() {
            history.append(ok(1));
            assertThrows(IllegalArgumentException.class, () -> history.append(ok(3)));
            assertEquals(1, history.factCount());
        }

        @Test
        @DisplayName("returned views are not modifiable")
        void viewsAreImmutable() {
            history.append(ok(1));
            assertThrows(UnsupportedOperationException.class, () -> history.facts().clear());
            assertThrows(UnsupportedOperationException.class, () -> history.rendered().clear());
        }
    }

    @Nested
    @DisplayName("resetTo")
    class ResetTo {

        @Test
        @DisplayName("empties the rendered track and keeps every fact")
        void clearsRenderedOnly() {
            for (int i = 1; i <= 10; i++) {
                history.append(ok(i));
            }
            history.resetTo(snapshotThrough(10));

            assertTrue(history.rendered().isEmpty());
            assertEquals(10, history.facts().size());
            assertEquals(10, history.latestSnapshot().orElseThrow().throughSequence());
            assertSame(history.latestSnapshot().orElseThrow(), history.renderedView().snapshot());
        }

        @Test
        @DisplayName("entries after the reset are rendered again")
        void rendersNewEntries() {
            history.append(ok(1));
            history.resetTo(snapshotThrough(1));
            history.append(ok(2));

            assertEquals(List.of(2L), history.rendered().stream().map(ActionRecord::sequenceNo).toList());
            assertEquals(2, history.factCount());
        }

        @Test
        @DisplayName("rejects a snapshot beyond the recorded facts")
        void rejectsFutureSnapshot() {
            history.append(ok(1));
            assertThrows(IllegalArgumentException.class, () -> history.resetTo(snapshotThrough(5)));
            assertEquals(1, history.rendered().size());
            assertTrue(history.latestSnapshot().isEmpty());
        }
    }

    @Nested
    @DisplayName("restore")
    class Restore {

        @Test
        @DisplayName("renders only the facts after the snapshot")
        void rebuildsRenderedTrack() {
            List<ActionRecord> facts = List.of(ok(1), ok(2), ok(3), ok(4));

            ActionHistory restored = ActionHistory.restore("a", facts, snapshotThrough(2), 3);

            assertEquals(4, restored.factCount());
            assertEquals(List.of(3L, 4L), restored.rendered().stream().map(ActionRecord::sequenceNo).toList());
            assertEquals(3, restored.turnsCompleted());
            assertEquals(5, restored.nextSequenceNo());
        }

        @Test
        @DisplayName("without a snapshot every fact is rendered")
        void noSnapshot() {
            ActionHistory restored = ActionHistory.restore("a", List.of(ok(1), ok(2)), null, 0);

            assertEquals(2, restored.rendered().size());
            assertTrue(restored.latestSnapshot().isEmpty());
        }
    }

    @Test
    @DisplayName("counts completed turns")
    void countsTurns() {
        history.recordTurn();
        history.recordTurn();
        assertEquals(2, history.turnsCompleted());
    }
}
