package com.recursa.core.engine;

import com.recursa.core.events.RecursaEvent;
import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.FrameResult;
import com.recursa.core.security.CapabilityTable;
import com.recursa.core.tools.ChildRunner;

import java.util.Map;

/**
 * Creates frame executors for one task and runs spawned children with them.
 */
public class AgentExecutorFactory implements ChildRunner {

    private final TaskSession session;
    private final ExecutionServices services;
    private final CapabilityTable capabilities;

    public AgentExecutorFactory(TaskSession session, ExecutionServices services, CapabilityTable capabilities) {
        this.session = session;
        this.services = services;
        this.capabilities = capabilities;
    }

    public AgentExecutor create(AgentFrame frame) {
        return new AgentExecutor(session, frame, services, capabilities, this);
    }

    @Override
    public FrameResult run(AgentFrame child) {
        services.eventBus().publish(RecursaEvent.of("frame.pushed", session.taskId(), child.agentId(),
                Map.of("name", child.name(), "level", child.level(), "parentId", child.parentId())));
        services.metrics().recordStackDepth(session.hierarchy().depth());
        return create(child).run();
    }
}
