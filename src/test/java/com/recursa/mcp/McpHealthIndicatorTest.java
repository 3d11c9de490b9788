package com.recursa.mcp;

import io.modelcontextprotocol.client.McpSyncClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class McpHealthIndicatorTest {

    @Test
    @DisplayName("UNKNOWN when no server is configured")
    void unconfigured() {
        var manager = mock(McpClientManager.class);
        when(manager.isConfigured()).thenReturn(false);

        assertEquals(Status.UNKNOWN, new McpHealthIndicator(manager).health().getStatus());
    }

    @Test
    @DisplayName("DEGRADED when a connected server does not answer a ping")
    void degraded() {
        var manager = mock(McpClientManager.class);
        var healthy = mock(McpSyncClient.class);
        var broken = mock(McpSyncClient.class);
        when(broken.ping()).thenThrow(new RuntimeException("timeout"));
        when(manager.isConfigured()).thenReturn(true);
        when(manager.tools()).thenReturn(Map.of());
        when(manager.getClients()).thenReturn(Map.of("files", healthy, "search", broken));

        var health = new McpHealthIndicator(manager).health();

        assertEquals("DEGRADED", health.getStatus().getCode());
        assertEquals("UP", health.getDetails().get("files"));
        assertEquals("DOWN: timeout", health.getDetails().get("search"));
    }
}
