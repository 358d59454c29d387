package com.example.nodelearn.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final ExplorationTools explorationTools;
    private final ArchiveTools archiveTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(ExplorationTools explorationTools, ArchiveTools archiveTools, CapabilitiesTools capTools) {
        this.explorationTools = explorationTools;
        this.archiveTools = archiveTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(explorationTools, archiveTools, capTools)
                .build();
    }
}
