package com.example.chatsync.model;

import com.example.chatsync.protocol.WireMessage;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * A persisted conversation message. Rows are immutable once written; only a
 * deliberate session reset removes them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("messages")
@CompoundIndexes({
    @CompoundIndex(name = "session_order", def = "{'sessionId': 1, 'timestamp': 1, 'seq': 1}"),
    @CompoundIndex(name = "session_client_id", def = "{'sessionId': 1, 'clientId': 1}", sparse = true)
})
public class ChatMessage {
    @Id
    private String id;
    private String sessionId;
    private MessageRole role;
    private String content;
    private String agentName;
    private String userId;
    private Instant timestamp;
    // per-session append order, breaks timestamp ties
    private long seq;
    // copied from metadata.client_id for idempotent retries
    private String clientId;
    private Map<String, Object> metadata;

    public WireMessage toWire() {
        return WireMessage.builder()
                .id(id)
                .sessionId(sessionId)
                .role(role.getValue())
                .content(content)
                .agentName(agentName)
                .userId(userId)
                .timestamp(timestamp == null ? null : timestamp.toEpochMilli())
                .metadata(metadata)
                .build();
    }
}
