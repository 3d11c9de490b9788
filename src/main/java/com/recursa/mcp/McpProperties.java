package com.recursa.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * MCP servers used as the tool backend.
 *
 * <pre>
 * recursa:
 *   mcp:
 *     enabled: true
 *     workspace-argument: workspace_root
 *     servers:
 *       files:
 *         url: http://localhost:8090/mcp
 *         token: ...
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "recursa.mcp")
public class McpProperties {

    private boolean enabled = false;
    private Duration requestTimeout = Duration.ofSeconds(60);
    /** Argument name under which the workspace root is passed to tools; blank to omit. */
    private String workspaceArgument = "";
    private Map<String, ServerConfig> servers = new LinkedHashMap<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public String getWorkspaceArgument() { return workspaceArgument; }
    public void setWorkspaceArgument(String workspaceArgument) { this.workspaceArgument = workspaceArgument; }
    public Map<String, ServerConfig> getServers() { return servers; }
    public void setServers(Map<String, ServerConfig> servers) { this.servers = servers; }

    /**
     * Returns {@code true} when MCP is enabled and at least one server has a URL.
     */
    public boolean isConfigured() {
        return enabled && servers.values().stream()
                .anyMatch(s -> s.getUrl() != null && !s.getUrl().isBlank());
    }

    public static class ServerConfig {
        private String url = "";
        private String token = "";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
    }
}
