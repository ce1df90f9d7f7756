package com.example.chatsync.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("sessions")
public class ChatSession {

    public static final int PREVIEW_LENGTH = 100;
    private static final String ELLIPSIS = "...";

    @Id
    private String sessionId;
    private String name;
    private String userId;
    private Instant createdAt;
    private Instant lastMessageAt;
    private String preview;
    private boolean active;
    // lastMessageAt, else createdAt; the listing sort key
    private Instant activityAt;

    public static ChatSession create(String sessionId, String name, String userId, Instant now) {
        return ChatSession.builder()
                .sessionId(sessionId)
                .name(name != null ? name : defaultName())
                .userId(userId)
                .createdAt(now)
                .activityAt(now)
                .active(true)
                .build();
    }

    public static String defaultName() {
        return "Session " + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    /**
     * Applies the side effects of a successful append. System messages leave the
     * preview and last-message time untouched.
     */
    public void recordMessage(ChatMessage message) {
        if (!message.getRole().updatesPreview()) {
            return;
        }
        this.lastMessageAt = message.getTimestamp();
        this.activityAt = message.getTimestamp();
        this.preview = truncatePreview(message.getContent());
    }

    public void resetPreview() {
        this.preview = null;
    }

    public static String truncatePreview(String content) {
        if (content == null) return null;
        if (content.length() <= PREVIEW_LENGTH) return content;
        return content.substring(0, PREVIEW_LENGTH) + ELLIPSIS;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("session_id", sessionId);
        map.put("name", name);
        map.put("user_id", userId);
        map.put("created_at", toMillis(createdAt));
        map.put("last_message_at", toMillis(lastMessageAt));
        map.put("preview", preview);
        map.put("is_active", active);
        return map;
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }
}
