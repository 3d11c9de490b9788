package com.recursa.core.logging;

import com.recursa.core.model.AgentFrame;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing runtime-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String AGENT_ID = "agentId";
    public static final String AGENT_NAME = "agentName";
    public static final String LEVEL = "level";

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put(TASK_ID, taskId);
    }

    public static void setFrame(String taskId, AgentFrame frame) {
        MDC.put(TASK_ID, taskId);
        MDC.put(AGENT_ID, frame.agentId());
        MDC.put(AGENT_NAME, frame.name());
        MDC.put(LEVEL, String.valueOf(frame.level()));
    }

    /**
     * Current values of the runtime keys, for restoring after a child frame returns.
     */
    public static Map<String, String> capture() {
        Map<String, String> all = MDC.getCopyOfContextMap();
        return all != null ? all : Map.of();
    }

    public static void restore(Map<String, String> captured) {
        for (String key : new String[] {TASK_ID, AGENT_ID, AGENT_NAME, LEVEL}) {
            String value = captured.get(key);
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        }
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_ID);
        MDC.remove(AGENT_NAME);
        MDC.remove(LEVEL);
    }
}
