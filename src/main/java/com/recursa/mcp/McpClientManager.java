package com.recursa.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.spec.McpSchema;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages one MCP sync client per configured server and an index of which
 * server offers which tool.
 * <p>
 * Clients are created lazily on first use. The tool index is built from
 * {@code tools/list} and refreshed when an unknown tool is requested.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;
    private final Map<String, McpSyncClient> clients = new ConcurrentHashMap<>();
    private volatile Map<String, ToolLocation> toolIndex = Map.of();

    /**
     * @param server server name
     * @param tool   tool as advertised by the server
     */
    public record ToolLocation(String server, McpSchema.Tool tool) {}

    public McpClientManager(McpProperties props) {
        this.props = props;
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    /**
     * Finds the server offering {@code toolName}, refreshing the index once if it is unknown.
     */
    public Optional<ToolLocation> locate(String toolName) {
        ToolLocation location = toolIndex.get(toolName);
        if (location == null && isConfigured()) {
            refreshTools();
            location = toolIndex.get(toolName);
        }
        return Optional.ofNullable(location);
    }

    public Optional<McpSyncClient> clientFor(String serverName) {
        if (!isConfigured()) {
            return Optional.empty();
        }
        McpProperties.ServerConfig config = props.getServers().get(serverName);
        if (config == null || config.getUrl() == null || config.getUrl().isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.computeIfAbsent(serverName, name -> createClient(name, config)));
    }

    /**
     * Rebuilds the tool index from every configured server. Servers that cannot be
     * reached are skipped.
     */
    public synchronized void refreshTools() {
        Map<String, ToolLocation> index = new LinkedHashMap<>();
        for (String serverName : props.getServers().keySet()) {
            Optional<McpSyncClient> client = clientFor(serverName);
            if (client.isEmpty()) {
                continue;
            }
            try {
                McpSchema.ListToolsResult result = client.get().listTools();
                if (result.tools() != null) {
                    for (McpSchema.Tool tool : result.tools()) {
                        index.putIfAbsent(tool.name(), new ToolLocation(serverName, tool));
                    }
                }
                log.info("MCP server '{}' offers {} tool(s)", serverName,
                        result.tools() != null ? result.tools().size() : 0);
            } catch (RuntimeException e) {
                log.warn("Listing tools of MCP server '{}' failed: {}", serverName, e.getMessage());
            }
        }
        toolIndex = Collections.unmodifiableMap(index);
    }

    public Map<String, ToolLocation> tools() {
        return toolIndex;
    }

    public Map<String, McpSyncClient> getClients() {
        return Collections.unmodifiableMap(clients);
    }

    private McpSyncClient createClient(String serverName, McpProperties.ServerConfig config) {
        try {
            var transportBuilder = HttpClientStreamableHttpTransport.builder(config.getUrl());
            String token = config.getToken();
            if (token != null && !token.isBlank()) {
                transportBuilder.customizeRequest(req -> req.header("Authorization", "Bearer " + token));
            }
            var client = McpClient.sync(transportBuilder.build())
                    .requestTimeout(props.getRequestTimeout())
                    .build();
            client.initialize();
            log.info("MCP client connected to server '{}' at {}", serverName, config.getUrl());
            return client;
        } catch (Exception e) {
            log.warn("Failed to connect to MCP server '{}': {}", serverName, e.getMessage());
            return null;
        }
    }

    @PreDestroy
    void shutdown() {
        for (var entry : clients.entrySet()) {
            try {
                entry.getValue().close();
                log.info("MCP client disconnected (server: {})", entry.getKey());
            } catch (Exception e) {
                log.debug("Error closing MCP client '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        clients.clear();
    }
}
