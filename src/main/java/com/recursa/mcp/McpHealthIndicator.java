package com.recursa.mcp;

import io.modelcontextprotocol.client.McpSyncClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the MCP tool backend. Only active when
 * {@code recursa.mcp.enabled=true}.
 */
@Component("mcpHealthIndicator")
@ConditionalOnProperty(prefix = "recursa.mcp", name = "enabled", havingValue = "true")
public class McpHealthIndicator implements HealthIndicator {

    private final McpClientManager clientManager;

    public McpHealthIndicator(McpClientManager clientManager) {
        this.clientManager = clientManager;
    }

    @Override
    public Health health() {
        if (!clientManager.isConfigured()) {
            return Health.unknown().withDetail("reason", "no server configured").build();
        }
        var builder = Health.up().withDetail("tools", clientManager.tools().size());
        if (clientManager.getClients().isEmpty()) {
            return builder.withDetail("status", "configured (no active connections yet)").build();
        }
        boolean anyDown = false;
        for (var entry : clientManager.getClients().entrySet()) {
            McpSyncClient client = entry.getValue();
            try {
                client.ping();
                builder.withDetail(entry.getKey(), "UP");
            } catch (Exception e) {
                builder.withDetail(entry.getKey(), "DOWN: " + e.getMessage());
                anyDown = true;
            }
        }
        return anyDown ? builder.status("DEGRADED").build() : builder.build();
    }
}
