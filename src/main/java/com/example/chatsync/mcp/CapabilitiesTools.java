package com.example.chatsync.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    @Tool(description = "List available tool names and server capabilities for introspection")
    public Map<String, Object> capabilities_list() {
        // static on purpose: the provider bean depends on this one
        return Map.of(
                "server", Map.of("name", "chat-session-sync", "version", "0.1.0"),
                "tools", List.of(
                        "session_append_message",
                        "session_list_messages",
                        "session_list_sessions",
                        "session_message_count",
                        "capabilities_list"),
                "capabilities", Map.of(
                        "tools", true,
                        "resources", false,
                        "prompts", false,
                        "websocket_sync", true)
        );
    }
}
