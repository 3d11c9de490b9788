package com.recursa.core.hierarchy;

import com.recursa.core.model.AgentFrame;

import java.util.List;

/**
 * Checks the parent/level chaining of an active stack.
 */
public final class StackInvariant {

    private StackInvariant() {}

    /**
     * True when the root is at level 0 with no parent and every later frame's
     * parent is the frame below it, one level deeper.
     */
    public static boolean holds(List<AgentFrame> stack) {
        if (stack.isEmpty()) {
            return true;
        }
        AgentFrame root = stack.get(0);
        if (root.parentId() != null || root.level() != 0) {
            return false;
        }
        for (int i = 1; i < stack.size(); i++) {
            AgentFrame below = stack.get(i - 1);
            AgentFrame frame = stack.get(i);
            if (!below.agentId().equals(frame.parentId()) || frame.level() != below.level() + 1) {
                return false;
            }
        }
        return true;
    }
}
