package com.recursa.cli;

import com.recursa.core.engine.AgentRuntime;
import com.recursa.core.events.EventBus;
import com.recursa.core.model.FailureReason;
import com.recursa.core.model.TaskOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RunCommandTest {

    @Test
    @DisplayName("event families become type prefixes")
    void eventFamily() {
        assertNull(ConsoleOutput.eventFamily(null));
        assertNull(ConsoleOutput.eventFamily(" "));
        assertEquals("consolidation.", ConsoleOutput.eventFamily("consolidation"));
        assertEquals("frame.", ConsoleOutput.eventFamily("frame."));
    }


    private AgentRuntime runtime;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        runtime = mock(AgentRuntime.class);
        commandLine = new CommandLine(new RunCommand(runtime, new EventBus()));
    }

    @Test
    @DisplayName("exit code 0 when the task completes")
    void completed() {
        when(runtime.taskIdFor("write a report")).thenReturn("1a2b3c4d_write-a-report");
        when(runtime.start("1a2b3c4d_write-a-report", "write a report"))
                .thenReturn(TaskOutcome.completed("1a2b3c4d_write-a-report", "main_agent_000000000001", "done"));

        assertEquals(0, commandLine.execute("--events", "consolidation", "write a report"));
        verify(runtime).start("1a2b3c4d_write-a-report", "write a report");
    }

    @Test
    @DisplayName("an explicit task id is passed through and failure exits with 1")
    void explicitTaskId() {
        when(runtime.start("t-9", "write a report"))
                .thenReturn(TaskOutcome.failed("t-9", "main_agent_000000000001",
                        FailureReason.TURN_BUDGET_EXCEEDED, "turn limit 5 reached", List.of()));

        assertEquals(1, commandLine.execute("--task-id", "t-9", "-q", "write a report"));
        verify(runtime).start("t-9", "write a report");
        verify(runtime, never()).taskIdFor(anyString());
    }
}
