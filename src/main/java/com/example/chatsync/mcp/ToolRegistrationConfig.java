package com.example.chatsync.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    private final SessionTools sessionTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(SessionTools sessionTools, CapabilitiesTools capTools) {
        this.sessionTools = sessionTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(sessionTools, capTools)
                .build();
    }
}
