package com.example.chatsync.mcp;

import com.example.chatsync.model.ChatMessage;
import com.example.chatsync.model.ChatSession;
import com.example.chatsync.protocol.WireMessage;
import com.example.chatsync.store.NewMessage;
import com.example.chatsync.store.SessionStore;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session history tools for the agent runtime.
 */
@Service
public class SessionTools {

    private final SessionStore store;

    public SessionTools(SessionStore store) {
        this.store = store;
    }

    @Tool(description = "Append a message (role user, assistant or system) to a chat session; creates the session if needed")
    public Map<String, Object> session_append_message(String sessionId,
                                                      String role,
                                                      String content,
                                                      @ToolParam(required = false) String agentName,
                                                      @ToolParam(required = false) Map<String, Object> metadata) {
        ChatMessage message = store.appendMessage(sessionId,
                new NewMessage(role, content, agentName, null, metadata));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("ok", true);
        result.put("message_id", message.getId());
        result.put("timestamp", message.getTimestamp().toEpochMilli());
        return result;
    }

    @Tool(description = "List messages of a session in chronological order")
    public List<WireMessage> session_list_messages(String sessionId,
                                                   @ToolParam(required = false, description = "max 500, default 200") Integer limit,
                                                   @ToolParam(required = false) Integer offset) {
        List<WireMessage> messages = new ArrayList<>();
        for (ChatMessage message : store.listMessages(sessionId, limit, offset)) {
            messages.add(message.toWire());
        }
        return messages;
    }

    @Tool(description = "List active sessions, most recently active first")
    public List<Map<String, Object>> session_list_sessions(@ToolParam(required = false) String userId,
                                                           @ToolParam(required = false) Integer limit,
                                                           @ToolParam(required = false) Integer offset) {
        List<Map<String, Object>> sessions = new ArrayList<>();
        for (ChatSession session : store.listSessions(userId, limit, offset)) {
            sessions.add(session.toMap());
        }
        return sessions;
    }

    @Tool(description = "Count the messages stored for a session")
    public Map<String, Object> session_message_count(String sessionId) {
        return Map.of("session_id", sessionId, "count", store.getMessageCount(sessionId));
    }
}
