package com.recursa.core.engine;

import com.recursa.core.config.AgentCatalog;
import com.recursa.core.config.RuntimeProperties;
import com.recursa.core.consolidation.ConsolidationAgent;
import com.recursa.core.context.ContextBuilder;
import com.recursa.core.events.EventBus;
import com.recursa.core.llm.BackoffPolicy;
import com.recursa.core.llm.ChatClientModelInvoker;
import com.recursa.core.llm.LlmService;
import com.recursa.core.llm.ModelInvoker;
import com.recursa.core.llm.ResilientModelInvoker;
import com.recursa.core.metrics.RecursaMetrics;
import com.recursa.core.tools.ToolCollaborator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the model invoker chain and the collaborators shared by frame executors.
 */
@Configuration
public class EngineConfig {

    @Bean
    public ResilientModelInvoker modelInvoker(LlmService llmService, RuntimeProperties properties,
                                              RecursaMetrics metrics) {
        return new ResilientModelInvoker(new ChatClientModelInvoker(llmService),
                BackoffPolicy.from(properties.getModelRetry()), properties.getModelCallTimeout(), metrics);
    }

    @Bean
    public ExecutionServices executionServices(ContextBuilder contextBuilder, ModelInvoker modelInvoker,
                                               ConsolidationAgent consolidationAgent, ToolCollaborator tools,
                                               AgentCatalog catalog, RuntimeProperties properties,
                                               EventBus eventBus, RecursaMetrics metrics) {
        return new ExecutionServices(contextBuilder, modelInvoker, consolidationAgent, tools, catalog,
                properties, eventBus, metrics);
    }
}
