package com.example.nodelearn.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    @Tool(description = "List available tool names for introspection")
    public Map<String, Object> capabilities_list() {
        // Static list; reflecting over the provider would be circular
        return Map.of(
                "server", Map.of("name", "nodelearn-engine", "version", "0.1.0"),
                "tools", List.of("tree_expand", "tree_explain", "tree_snapshot",
                        "archive_search", "archive_listByOwner", "archive_ownerStats", "capabilities_list")
        );
    }
}
