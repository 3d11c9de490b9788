package com.recursa.mcp;

import com.recursa.core.tools.ToolCollaborator;
import com.recursa.core.tools.ToolExecutionException;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Executes tool actions by calling the tool of the same name on a configured MCP server.
 * Text content of the result becomes the action result; an error result or an
 * unknown tool becomes a {@link ToolExecutionException}.
 */
@Component
public class McpToolCollaborator implements ToolCollaborator {

    private static final Logger log = LoggerFactory.getLogger(McpToolCollaborator.class);

    private final McpClientManager clientManager;
    private final McpProperties props;

    public McpToolCollaborator(McpClientManager clientManager, McpProperties props) {
        this.clientManager = clientManager;
        this.props = props;
    }

    @Override
    public String execute(String actionName, Map<String, Object> arguments, Path workspaceRoot) {
        if (!clientManager.isConfigured()) {
            throw new ToolExecutionException("No tool backend is configured for '" + actionName + "'");
        }
        McpClientManager.ToolLocation location = clientManager.locate(actionName)
                .orElseThrow(() -> new ToolExecutionException("Unknown tool '" + actionName + "'"));
        McpSyncClient client = clientManager.clientFor(location.server())
                .orElseThrow(() -> new ToolExecutionException("MCP server '" + location.server()
                        + "' is unreachable"));

        Map<String, Object> callArguments = new LinkedHashMap<>(arguments);
        String workspaceArgument = props.getWorkspaceArgument();
        if (workspaceArgument != null && !workspaceArgument.isBlank() && workspaceRoot != null) {
            callArguments.putIfAbsent(workspaceArgument, workspaceRoot.toString());
        }

        McpSchema.CallToolResult result;
        try {
            result = client.callTool(new McpSchema.CallToolRequest(actionName, callArguments));
        } catch (RuntimeException e) {
            throw new ToolExecutionException("Calling tool '" + actionName + "' failed: " + e.getMessage(), e);
        }
        String text = textOf(result);
        if (Boolean.TRUE.equals(result.isError())) {
            throw new ToolExecutionException(text.isBlank() ? "Tool '" + actionName + "' reported an error" : text);
        }
        log.debug("Tool '{}' on '{}' returned {} chars", actionName, location.server(), text.length());
        return text;
    }

    @Override
    public Optional<String> describe(String actionName) {
        if (!clientManager.isConfigured()) {
            return Optional.empty();
        }
        return clientManager.locate(actionName)
                .map(location -> location.tool().description())
                .filter(description -> description != null && !description.isBlank());
    }

    static String textOf(McpSchema.CallToolResult result) {
        if (result == null || result.content() == null) {
            return "";
        }
        return result.content().stream()
                .filter(McpSchema.TextContent.class::isInstance)
                .map(c -> ((McpSchema.TextContent) c).text())
                .collect(Collectors.joining("\n"));
    }
}
