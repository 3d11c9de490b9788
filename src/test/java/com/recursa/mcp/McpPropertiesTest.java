package com.recursa.mcp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class McpPropertiesTest {

    @Test
    @DisplayName("is configured only when enabled with at least one server")
    void configured() {
        var props = new McpProperties();
        assertFalse(props.isConfigured());

        var server = new McpProperties.ServerConfig();
        server.setUrl("http://localhost:8931/mcp");
        props.setServers(Map.of("files", server));
        props.setEnabled(true);

        assertTrue(props.isConfigured());
    }
}
