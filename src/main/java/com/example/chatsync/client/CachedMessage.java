package com.example.chatsync.client;

import com.example.chatsync.protocol.Envelope;
import com.example.chatsync.protocol.WireMessage;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.util.Map;

/**
 * Client-side copy of a message. Pending entries carry a provisional id that is
 * also stored as {@code metadata.client_id}; the server echoes it back so the
 * confirmed copy can replace the provisional one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CachedMessage {
    private String id;
    private String sessionId;
    private String role;
    private String content;
    private String agentName;
    private String userId;
    private Long timestamp;
    private Map<String, Object> metadata;
    private SyncState syncState;

    @JsonIgnore
    public boolean isConfirmed() {
        return syncState == SyncState.CONFIRMED;
    }

    @JsonIgnore
    public String getClientId() {
        if (metadata == null) return null;
        Object value = metadata.get(Envelope.CLIENT_ID_KEY);
        return value == null ? null : value.toString();
    }

    public static CachedMessage confirmed(WireMessage message, String sessionId) {
        return CachedMessage.builder()
                .id(message.getId())
                .sessionId(message.getSessionId() != null ? message.getSessionId() : sessionId)
                .role(message.getRole())
                .content(message.getContent())
                .agentName(message.getAgentName())
                .userId(message.getUserId())
                .timestamp(message.getTimestamp())
                .metadata(message.getMetadata())
                .syncState(SyncState.CONFIRMED)
                .build();
    }

    public static CachedMessage confirmed(Envelope envelope, String sessionId) {
        return CachedMessage.builder()
                .id(envelope.getId())
                .sessionId(sessionId)
                .role(envelope.getRole())
                .content(envelope.getContent())
                .agentName(envelope.getAgentName())
                .userId(envelope.getUserId())
                .timestamp(envelope.getTimestamp())
                .metadata(envelope.getMetadata())
                .syncState(SyncState.CONFIRMED)
                .build();
    }
}
