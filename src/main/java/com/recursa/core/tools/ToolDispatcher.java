package com.recursa.core.tools;

import com.recursa.core.config.AgentCatalog;
import com.recursa.core.context.PromptSections;
import com.recursa.core.hierarchy.DepthExceededException;
import com.recursa.core.hierarchy.HierarchyStackManager;
import com.recursa.core.model.Action;
import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.FailureReason;
import com.recursa.core.model.FrameResult;
import com.recursa.core.security.CapabilityTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Executes the actions of one frame.
 * <p>
 * The capability check always comes first: a denied action is recorded as a
 * violation and never reaches a tool or spawns a child. An action named after
 * a catalog agent pushes a child frame and runs it to completion; any other
 * action goes to the {@link ToolCollaborator}. A finished child is left on top
 * of the stack; the caller pops it after recording its result. One instance per
 * frame, since consecutive violations are counted per frame.
 */
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    static final String FINAL_OUTPUT_ARGUMENT = "output";

    private final AgentFrame frame;
    private final CapabilityTable capabilities;
    private final AgentCatalog catalog;
    private final ToolCollaborator tools;
    private final HierarchyStackManager hierarchy;
    private final ChildRunner childRunner;
    private final Path workspaceRoot;
    private final int maxConsecutiveViolations;
    private int consecutiveViolations;

    public ToolDispatcher(AgentFrame frame, CapabilityTable capabilities, AgentCatalog catalog,
                          ToolCollaborator tools, HierarchyStackManager hierarchy, ChildRunner childRunner,
                          Path workspaceRoot, int maxConsecutiveViolations) {
        this.frame = frame;
        this.capabilities = capabilities;
        this.catalog = catalog;
        this.tools = tools;
        this.hierarchy = hierarchy;
        this.childRunner = childRunner;
        this.workspaceRoot = workspaceRoot;
        this.maxConsecutiveViolations = maxConsecutiveViolations;
    }

    public DispatchOutcome dispatch(Action action) {
        if (!capabilities.isPermitted(frame.level(), frame.name(), action.name())) {
            consecutiveViolations++;
            log.warn("Capability violation: {} (level {}) is not permitted to run '{}' ({} consecutive)",
                    frame.name(), frame.level(), action.name(), consecutiveViolations);
            String error = "Action '" + action.name() + "' is not permitted for " + frame.name()
                    + " at level " + frame.level() + ". Permitted: "
                    + capabilities.permittedActions(frame.level(), frame.name());
            return DispatchOutcome.violation(error, consecutiveViolations > maxConsecutiveViolations);
        }
        consecutiveViolations = 0;

        if (capabilities.finalAction().equals(action.name())) {
            String output = action.stringArgument(FINAL_OUTPUT_ARGUMENT);
            if (output == null) {
                output = PromptSections.arguments(action.arguments());
            }
            return DispatchOutcome.success(DispatchOutcome.Kind.FINAL, output);
        }
        if (catalog.isAgent(action.name())) {
            return spawn(action);
        }
        return callTool(action);
    }

    private DispatchOutcome spawn(Action action) {
        AgentFrame child;
        try {
            child = hierarchy.push(frame.agentId(), action.name(), childInput(action), action.arguments());
        } catch (DepthExceededException e) {
            log.warn("Cannot spawn {} from {}: {}", action.name(), frame.agentId(), e.getMessage());
            return DispatchOutcome.failure(DispatchOutcome.Kind.CHILD, FailureReason.DEPTH_EXCEEDED, e.getMessage());
        }
        log.info("Spawned {} (level {}) from {}", child.agentId(), child.level(), frame.agentId());
        FrameResult result = childRunner.run(child);
        return DispatchOutcome.fromChild(result);
    }

    private DispatchOutcome callTool(Action action) {
        try {
            String result = tools.execute(action.name(), action.arguments(), workspaceRoot);
            return DispatchOutcome.success(DispatchOutcome.Kind.TOOL, result != null ? result : "");
        } catch (ToolExecutionException e) {
            log.info("Tool '{}' failed: {}", action.name(), e.getMessage());
            return DispatchOutcome.failure(DispatchOutcome.Kind.TOOL, FailureReason.TOOL_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Tool '{}' threw unexpectedly: {}", action.name(), e.toString(), e);
            return DispatchOutcome.failure(DispatchOutcome.Kind.TOOL, FailureReason.TOOL_ERROR, e.toString());
        }
    }

    /**
     * The child's task text: the {@code task} or {@code input} argument, or all arguments rendered.
     */
    static String childInput(Action action) {
        String task = action.stringArgument("task");
        if (task == null) {
            task = action.stringArgument("input");
        }
        return task != null ? task : PromptSections.arguments(action.arguments());
    }

    public int consecutiveViolations() {
        return consecutiveViolations;
    }
}
