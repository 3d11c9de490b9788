package com.recursa.core.logging;

import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.FrameStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    private static final AgentFrame CHILD = new AgentFrame("writer_1", "writer", "main_agent_1", 1, "x",
            Map.of(), FrameStatus.RUNNING, Instant.EPOCH);

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTask puts taskId in MDC")
    void setTask() {
        MdcContext.setTask("task-1");
        assertEquals("task-1", MDC.get("taskId"));
    }

    @Test
    @DisplayName("setFrame puts task, agent id, agent name and level in MDC")
    void setFrame() {
        MdcContext.setFrame("task-1", CHILD);
        assertEquals("task-1", MDC.get("taskId"));
        assertEquals("writer_1", MDC.get("agentId"));
        assertEquals("writer", MDC.get("agentName"));
        assertEquals("1", MDC.get("level"));
    }

    @Test
    @DisplayName("restore brings back the parent's keys after a child frame")
    void restoreAfterChild() {
        MdcContext.setTask("task-1");
        Map<String, String> outer = MdcContext.capture();
        MdcContext.setFrame("task-1", CHILD);

        MdcContext.restore(outer);

        assertEquals("task-1", MDC.get("taskId"));
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("level"));
    }

    @Test
    @DisplayName("clear removes all runtime MDC keys")
    void clear() {
        MdcContext.setFrame("task-1", CHILD);
        MdcContext.clear();
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("agentName"));
        assertNull(MDC.get("level"));
    }
}
