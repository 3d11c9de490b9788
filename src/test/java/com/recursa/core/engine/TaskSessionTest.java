package com.recursa.core.engine;

import com.recursa.core.history.ActionHistory;
import com.recursa.core.model.Action;
import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.ConsolidationSnapshot;
import com.recursa.core.model.TodoItem;
import com.recursa.core.model.TodoStatus;
import com.recursa.core.persistence.FileStateStore;
import com.recursa.core.persistence.PersistedTaskState;
import com.recursa.core.persistence.StateStoreException;
import com.recursa.core.persistence.InMemoryStateStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskSessionTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("persist, crash and restore rebuild stack, index and rendered history exactly")
    void restoreIsDeterministic() {
        var store = new FileStateStore(dir);
        TaskSession session = TaskSession.create("task-1", "main_agent", "write a report", store, 5);
        AgentFrame root = session.hierarchy().push(null, "main_agent", "write a report", Map.of());
        AgentFrame child = session.hierarchy().push(root.agentId(), "researcher", "find sources",
                Map.of("task", "find sources"));

        ActionHistory rootHistory = session.historyFor(root.agentId());
        ActionHistory childHistory = session.historyFor(child.agentId());
        for (int i = 1; i <= 3; i++) {
            childHistory.append(ActionRecord.success(i, new Action("web_search", Map.of("q", "s" + i)), "r" + i));
        }
        childHistory.resetTo(new ConsolidationSnapshot(List.of(new TodoItem("search", TodoStatus.ONGOING)),
                "facts", "1. search more", "", false, 2, Instant.now()));
        childHistory.append(ActionRecord.success(4, new Action("file_read", Map.of()), "r4"));
        childHistory.recordTurn();
        session.checkpoint();

        TaskSession restored = TaskSession.restore(store.load("task-1").orElseThrow(), store, 5);

        assertEquals(session.hierarchy().stack(), restored.hierarchy().stack());
        assertEquals(session.hierarchy().index(), restored.hierarchy().index());
        ActionHistory restoredChild = restored.historyFor(child.agentId());
        assertEquals(childHistory.facts(), restoredChild.facts());
        assertEquals(childHistory.latestSnapshot(), restoredChild.latestSnapshot());
        assertEquals(childHistory.turnsCompleted(), restoredChild.turnsCompleted());
        assertEquals(List.of(4L), restoredChild.rendered().stream().map(ActionRecord::sequenceNo).toList());
        assertEquals(rootHistory.facts(), restored.historyFor(root.agentId()).facts());
        assertEquals(session.version(), restored.version());
        assertEquals("write a report", restored.initialInput());
    }

    @Test
    @DisplayName("every write bumps the version")
    void versions() {
        var store = new InMemoryStateStore();
        TaskSession session = TaskSession.create("task-1", "main_agent", "x", store, 5);
        session.hierarchy().push(null, "main_agent", "x", Map.of());
        session.checkpoint();

        PersistedTaskState state = store.load("task-1").orElseThrow();
        assertEquals(2, state.version());
        assertEquals(2, session.version());
        assertEquals(2, store.persistCount());
    }

    @Test
    @DisplayName("a failed write keeps the previous document and version")
    void failedWrite() {
        var store = new InMemoryStateStore();
        TaskSession session = TaskSession.create("task-1", "main_agent", "x", store, 5);
        AgentFrame root = session.hierarchy().push(null, "main_agent", "x", Map.of());
        store.failAfter(0);

        assertThrows(StateStoreException.class,
                () -> session.hierarchy().push(root.agentId(), "writer", "y", Map.of()));

        assertEquals(1, session.version());
        assertEquals(1, session.hierarchy().depth());
        assertEquals(1, store.load("task-1").orElseThrow().stack().size());
    }
}
