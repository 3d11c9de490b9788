package com.recursa.core.engine;

import com.recursa.core.consolidation.SnapshotDraft;
import com.recursa.core.context.Prompt;
import com.recursa.core.hierarchy.StackInvariant;
import com.recursa.core.llm.ModelAuthorizationException;
import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.FailureReason;
import com.recursa.core.model.FrameStatus;
import com.recursa.core.model.HierarchyEntry;
import com.recursa.core.model.TaskOutcome;
import com.recursa.core.persistence.FrameHistoryRecord;
import com.recursa.core.persistence.PersistedTaskState;
import com.recursa.core.persistence.StateStore;
import com.recursa.core.persistence.StateStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.recursa.core.engine.ScriptedModelInvoker.call;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AgentRuntimeTest {

    private static final String TASK = "task-42";

    private EngineFixture fx;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("runs the root to completion and pops it")
        void completes() {
            fx.model.script("main_agent").then(call("final_output", "output", "the report"));

            TaskOutcome outcome = fx.runtime().start(TASK, "write a report");

            assertTrue(outcome.completed());
            assertEquals("the report", outcome.payload());
            assertTrue(outcome.partialFactHistory().isEmpty());
            PersistedTaskState state = fx.store.load(TASK).orElseThrow();
            assertTrue(state.stack().isEmpty());
            assertEquals(FrameStatus.COMPLETED, state.taskStatus());
            assertEquals(outcome.rootAgentId(), state.rootEntry().orElseThrow().agentId());
            assertEquals(List.of("task.started", "frame.pushed", "task.completed"), fx.eventTypes());
            assertEquals(1.0, fx.registry.get("recursa.tasks.total").tag("status", "completed").counter().count());
        }

        @Test
        @DisplayName("a failed root yields a failed outcome with the partial fact history")
        void failedRoot() {
            fx.properties.setMaxTurns(3);
            fx.model.script("main_agent").otherwise(call("file_read", "path", "notes.md"));

            TaskOutcome outcome = fx.runtime().start(TASK, "write a report");

            assertFalse(outcome.completed());
            assertEquals(FailureReason.TURN_BUDGET_EXCEEDED, outcome.reason());
            assertEquals(3, outcome.partialFactHistory().size());
            assertEquals(FrameStatus.FAILED, fx.store.load(TASK).orElseThrow().taskStatus());
            assertTrue(fx.eventTypes().contains("task.failed"));
        }

        @Test
        @DisplayName("start(input) derives the task id from root agent and input")
        void derivesTaskId() {
            fx.model.script("main_agent").then(call("final_output", "output", "ok"));

            TaskOutcome outcome = fx.runtime().start("Write a Report!");

            assertEquals(AgentRuntime.deriveTaskId("main_agent", "Write a Report!"), outcome.taskId());
            assertTrue(outcome.taskId().endsWith("_write-a-report"));
        }

        @Test
        @DisplayName("a finished task returns its recorded outcome without calling the model")
        void finishedTaskIsNotRerun() {
            fx.model.script("main_agent").then(call("final_output", "output", "first"));
            fx.runtime().start(TASK, "write a report");

            TaskOutcome again = fx.runtime().start(TASK, "write a report");

            assertTrue(again.completed());
            assertEquals("first", again.payload());
            assertEquals(1, fx.model.callsFor("main_agent"));
        }

        @Test
        @DisplayName("the stack invariant holds whenever a frame is pushed or popped")
        void stackInvariantObserved() {
            List<Boolean> observations = new ArrayList<>();
            fx.eventBus.subscribeAll(event -> {
                if (event.eventType().startsWith("frame.")) {
                    observations.add(StackInvariant.holds(fx.store.load(TASK).orElseThrow().stack()));
                }
            });
            fx.model.script("main_agent")
                    .then(call("researcher", "task", "find sources"))
                    .then(call("final_output", "output", "report"));
            fx.model.script("researcher")
                    .then(call("writer", "task", "summarise"))
                    .then(call("final_output", "output", "sources"));
            fx.model.script("writer").then(call("final_output", "output", "summary"));

            assertTrue(fx.runtime().start(TASK, "write a report").completed());

            assertEquals(5, observations.size());
            assertFalse(observations.contains(false));
        }
    }

    @Nested
    @DisplayName("resume")
    class Resume {

        @Test
        @DisplayName("an unknown task is reported as UNKNOWN_TASK")
        void unknownTask() {
            TaskOutcome outcome = fx.runtime().resume("never-started");

            assertEquals(FailureReason.UNKNOWN_TASK, outcome.reason());
            assertNull(outcome.rootAgentId());
        }

        @Test
        @DisplayName("a crash inside a child resumes from the child and finishes the parent")
        void crashAndResume() {
            fx.model.script("main_agent")
                    .then(call("researcher", "task", "find sources"))
                    .then(call("final_output", "output", "report"));
            fx.model.script("researcher")
                    .then(call("web_search", "query", "sources"))
                    .then(call("final_output", "output", "X"));
            when(fx.tools.execute(eq("web_search"), anyMap(), any())).thenAnswer(inv -> {
                fx.store.failAfter(0);
                return "three sources";
            });

            TaskOutcome crashed = fx.runtime().start(TASK, "write a report");

            assertEquals(FailureReason.STATE_STORE_IO_ERROR, crashed.reason());
            PersistedTaskState atCrash = fx.store.load(TASK).orElseThrow();
            assertEquals(2, atCrash.stack().size());
            assertEquals(FrameStatus.RUNNING, atCrash.taskStatus());

            fx.store.healthy();
            TaskOutcome resumed = fx.runtime().resume(TASK);

            assertTrue(resumed.completed());
            assertEquals("report", resumed.payload());
            PersistedTaskState done = fx.store.load(TASK).orElseThrow();
            assertTrue(done.stack().isEmpty());
            HierarchyEntry root = done.rootEntry().orElseThrow();
            assertEquals(FrameStatus.COMPLETED, root.status());
            HierarchyEntry child = done.hierarchy().get(root.children().get(0));
            assertEquals(FrameStatus.COMPLETED, child.status());
            assertEquals("X", child.finalOutput());
            List<ActionRecord> rootFacts = done.histories().get(root.agentId()).facts();
            assertEquals(List.of("researcher", "final_output"), rootFacts.stream().map(ActionRecord::actionName).toList());
            assertEquals("X", rootFacts.get(0).result());
        }

        @Test
        @DisplayName("facts persisted before the crash are kept and not repeated")
        void resumeKeepsFacts() {
            fx.model.script("main_agent")
                    .then(call("file_read", "path", "a.md"))
                    .then(call("file_read", "path", "b.md"));
            when(fx.tools.execute(anyString(), anyMap(), any())).thenAnswer(inv -> {
                if ("b.md".equals(((Map<?, ?>) inv.getArgument(1)).get("path"))) {
                    fx.store.failAfter(0);
                }
                return "content";
            });

            TaskOutcome crashed = fx.runtime().start(TASK, "summarise");
            assertEquals(FailureReason.STATE_STORE_IO_ERROR, crashed.reason());
            assertEquals(1, fx.store.load(TASK).orElseThrow().histories().values().iterator().next().facts().size());

            fx.store.healthy();
            fx.model.script("main_agent")
                    .then(call("file_read", "path", "b.md"))
                    .then(call("final_output", "output", "done"));
            TaskOutcome resumed = fx.runtime().resume(TASK);

            assertTrue(resumed.completed());
            PersistedTaskState done = fx.store.load(TASK).orElseThrow();
            List<ActionRecord> facts = done.histories().get(resumed.rootAgentId()).facts();
            assertEquals(List.of(1L, 2L, 3L), facts.stream().map(ActionRecord::sequenceNo).toList());
        }

        @Test
        @DisplayName("a consolidation lost to a crash runs before the first decision after resume")
        void consolidationLostToCrashRunsOnResume() {
            fx.properties.setConsolidationInterval(2);
            int[] consolidations = {0};
            when(fx.llm.structuredCall(anyString(), anyString(), eq(SnapshotDraft.class))).thenAnswer(inv -> {
                if (consolidations[0]++ == 0) {
                    fx.store.failAfter(0);
                }
                return EngineFixture.draft("1. write the report");
            });
            fx.model.script("main_agent")
                    .then(call("file_read", "path", "a.md"))
                    .then(call("file_read", "path", "b.md"));

            TaskOutcome crashed = fx.runtime().start(TASK, "summarise");

            assertEquals(FailureReason.STATE_STORE_IO_ERROR, crashed.reason());
            FrameHistoryRecord atCrash = fx.store.load(TASK).orElseThrow().histories().get(crashed.rootAgentId());
            assertEquals(2, atCrash.facts().size());
            assertNull(atCrash.latestSnapshot());

            fx.store.healthy();
            fx.model.script("main_agent").then(call("final_output", "output", "done"));
            TaskOutcome resumed = fx.runtime().resume(TASK);

            assertTrue(resumed.completed());
            assertEquals(2, consolidations[0]);
            Prompt afterResume = fx.model.promptsFor("main_agent").get(2);
            assertEquals(0, afterResume.includedEntries());
            assertTrue(afterResume.systemPrompt().contains("1. write the report"));
            FrameHistoryRecord done = fx.store.load(TASK).orElseThrow().histories().get(resumed.rootAgentId());
            assertEquals(2, done.latestSnapshot().throughSequence());
            assertEquals(3, done.facts().size());
        }

        @Test
        @DisplayName("start on an unfinished task resumes it")
        void startResumes() {
            fx.model.script("main_agent").thenThrow(new ModelAuthorizationException("401 Unauthorized", null));

            TaskOutcome aborted = fx.runtime().start(TASK, "write a report");

            assertEquals(FailureReason.MODEL_AUTHORIZATION, aborted.reason());
            assertEquals(FrameStatus.RUNNING, fx.store.load(TASK).orElseThrow().taskStatus());

            fx.model.script("main_agent").then(call("final_output", "output", "after fixing the key"));
            TaskOutcome resumed = fx.runtime().start(TASK, "write a report");

            assertTrue(resumed.completed());
            assertEquals("after fixing the key", resumed.payload());
        }

        @Test
        @DisplayName("resuming a failed task reports the recorded failure")
        void resumeFinishedFailure() {
            fx.properties.setMaxTurns(1);
            fx.model.script("main_agent").otherwise(call("file_read"));
            fx.runtime().start(TASK, "write a report");

            TaskOutcome outcome = fx.runtime().resume(TASK);

            assertEquals(FailureReason.TURN_BUDGET_EXCEEDED, outcome.reason());
            assertTrue(outcome.detail().startsWith("Turn budget of 1 exhausted"));
            assertEquals(1, outcome.partialFactHistory().size());
        }

        @Test
        @DisplayName("a store that cannot be read yields STATE_STORE_IO_ERROR")
        void unreadableStore() {
            var store = mock(StateStore.class);
            when(store.load(TASK)).thenThrow(new StateStoreException("disk gone"));
            var runtime = new AgentRuntime(store, fx.services(), fx.capabilities);

            assertEquals(FailureReason.STATE_STORE_IO_ERROR, runtime.resume(TASK).reason());
            assertEquals(FailureReason.STATE_STORE_IO_ERROR, runtime.start(TASK, "x").reason());
        }
    }

    @Test
    @DisplayName("cancel of a task that is not running returns false")
    void cancelIdle() {
        AgentRuntime runtime = fx.runtime();
        assertFalse(runtime.cancel(TASK));
        assertFalse(runtime.isRunning(TASK));
    }

    @Test
    @DisplayName("cancel stops a running task at the next turn boundary")
    void cancelRunning() {
        AgentRuntime runtime = fx.runtime();
        fx.model.script("main_agent").respond(prompt -> {
            assertTrue(runtime.isRunning(TASK));
            assertTrue(runtime.cancel(TASK));
            return List.of(call("file_read"));
        });

        TaskOutcome outcome = runtime.start(TASK, "write a report");

        assertEquals(FailureReason.CANCELLED, outcome.reason());
        assertFalse(runtime.isRunning(TASK));
    }

    @Test
    @DisplayName("a second start or resume of a running task is rejected with an outcome")
    void secondStartWhileRunning() {
        AgentRuntime runtime = fx.runtime();
        List<TaskOutcome> nested = new ArrayList<>();
        fx.model.script("main_agent")
                .then(call("file_read", "path", "notes.md"))
                .then(call("final_output", "output", "report"));
        when(fx.tools.execute(eq("file_read"), anyMap(), any())).thenAnswer(inv -> {
            nested.add(runtime.start(TASK, "write a report"));
            nested.add(runtime.resume(TASK));
            return "notes";
        });

        TaskOutcome outcome = runtime.start(TASK, "write a report");

        assertTrue(outcome.completed());
        assertEquals("report", outcome.payload());
        assertEquals(2, nested.size());
        for (TaskOutcome rejected : nested) {
            assertFalse(rejected.completed());
            assertEquals(FailureReason.TASK_ALREADY_RUNNING, rejected.reason());
        }
        assertEquals(2, fx.model.callsFor("main_agent"));
        assertFalse(fx.eventTypes().contains("task.failed"));
    }

    @Test
    @DisplayName("task ids are deterministic and slugged")
    void taskIds() {
        String id = AgentRuntime.deriveTaskId("main_agent", "Summarise five papers");
        assertEquals(id, AgentRuntime.deriveTaskId("main_agent", "Summarise five papers"));
        assertNotEquals(id, AgentRuntime.deriveTaskId("writer", "Summarise five papers"));
        assertTrue(id.matches("[0-9a-f]{8}_summarise-five-papers"));
        assertTrue(AgentRuntime.deriveTaskId("main_agent", "???").endsWith("_task"));
        assertTrue(AgentRuntime.deriveTaskId("main_agent", "a".repeat(100)).length() <= 8 + 1 + 32);
    }

    @Test
    @DisplayName("recorded failure output is split into reason and detail")
    void parsesRecordedFailure() {
        assertEquals(FailureReason.CHILD_FAILED, AgentRuntime.reasonOf("[CHILD_FAILED] researcher gave up"));
        assertEquals("researcher gave up", AgentRuntime.detailOf("[CHILD_FAILED] researcher gave up"));
        assertNull(AgentRuntime.reasonOf("[NOT_A_REASON] x"));
        assertEquals("plain", AgentRuntime.detailOf("plain"));
    }
}
