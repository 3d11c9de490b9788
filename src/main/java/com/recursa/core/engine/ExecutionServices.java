package com.recursa.core.engine;

import com.recursa.core.config.AgentCatalog;
import com.recursa.core.config.RuntimeProperties;
import com.recursa.core.consolidation.ConsolidationAgent;
import com.recursa.core.context.ContextBuilder;
import com.recursa.core.events.EventBus;
import com.recursa.core.llm.ModelInvoker;
import com.recursa.core.metrics.RecursaMetrics;
import com.recursa.core.tools.ToolCollaborator;

/**
 * Collaborators shared by every frame executor of a runtime.
 */
public record ExecutionServices(
    ContextBuilder contextBuilder,
    ModelInvoker modelInvoker,
    ConsolidationAgent consolidationAgent,
    ToolCollaborator tools,
    AgentCatalog catalog,
    RuntimeProperties properties,
    EventBus eventBus,
    RecursaMetrics metrics
) {
}
