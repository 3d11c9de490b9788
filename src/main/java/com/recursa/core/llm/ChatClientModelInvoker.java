package com.recursa.core.llm;

import com.recursa.core.context.Prompt;
import com.recursa.core.model.Action;
import com.recursa.core.model.ActionSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ModelInvoker} backed by {@link LlmService}. The permitted actions are
 * described in the system prompt and the answer is parsed as an {@link ActionBatch}.
 */
public class ChatClientModelInvoker implements ModelInvoker {

    private static final Logger log = LoggerFactory.getLogger(ChatClientModelInvoker.class);

    private final LlmService llmService;

    public ChatClientModelInvoker(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public List<Action> invoke(Prompt prompt, List<ActionSchema> permittedActions) {
        String system = prompt.systemPrompt() + "\n\n" + describeActions(permittedActions);
        ActionBatch batch;
        try {
            batch = llmService.structuredCall(system, prompt.userMessage(), ActionBatch.class);
        } catch (RuntimeException e) {
            throw ModelErrorClassifier.classify(e);
        }
        if (batch == null || batch.actions() == null || batch.actions().isEmpty()) {
            throw new MalformedModelOutputException("Model answer contained no actions");
        }
        if (batch.thinking() != null && !batch.thinking().isBlank()) {
            log.debug("Model thinking: {}", batch.thinking());
        }
        List<Action> actions = new ArrayList<>();
        for (ActionBatch.Call call : batch.actions()) {
            if (call == null || call.name() == null || call.name().isBlank()) {
                throw new MalformedModelOutputException("Model answer contained an action without a name");
            }
            actions.add(new Action(call.name().strip(), call.arguments()));
        }
        return actions;
    }

    static String describeActions(List<ActionSchema> permittedActions) {
        var sb = new StringBuilder("<available_actions>\n");
        for (ActionSchema schema : permittedActions) {
            sb.append("- ").append(schema.name()).append(" (").append(schema.kind().name().toLowerCase()).append(")");
            if (!schema.parameters().isEmpty()) {
                sb.append(" args: ").append(String.join(", ", schema.parameters()));
            }
            if (schema.description() != null && !schema.description().isBlank()) {
                sb.append(": ").append(schema.description());
            }
            sb.append("\n");
        }
        return sb.append("</available_actions>").toString();
    }
}
