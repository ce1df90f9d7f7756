package com.example.chatsync.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.util.List;
import java.util.Map;

/**
 * One frame on the sync channel: {@code {type, ...type-specific fields}}.
 * Unused fields are left null and omitted from the JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Envelope {

    public static final String CLIENT_ID_KEY = "client_id";
    public static final String CLIENT_TIMESTAMP_KEY = "client_timestamp";

    private String type;

    // message
    private String id;
    private String role;
    private String content;
    private String agentName;
    private String userId;
    private Long timestamp;
    private Map<String, Object> metadata;

    // history_request
    private Integer limit;

    // sync_request
    private String lastMessageId;

    // history / sync_response
    private List<WireMessage> messages;

    // error
    private String code;
    private String reason;

    @JsonIgnore
    public EnvelopeType resolvedType() {
        return EnvelopeType.fromWire(type);
    }

    public static Envelope heartbeat() {
        return Envelope.builder().type(EnvelopeType.HEARTBEAT.wireName()).build();
    }

    public static Envelope historyRequest(int limit) {
        return Envelope.builder().type(EnvelopeType.HISTORY_REQUEST.wireName()).limit(limit).build();
    }

    public static Envelope syncRequest(String lastMessageId, Long timestamp) {
        return Envelope.builder()
                .type(EnvelopeType.SYNC_REQUEST.wireName())
                .lastMessageId(lastMessageId)
                .timestamp(timestamp)
                .build();
    }

    public static Envelope history(List<WireMessage> messages) {
        return Envelope.builder().type(EnvelopeType.HISTORY.wireName()).messages(messages).build();
    }

    public static Envelope syncResponse(List<WireMessage> messages) {
        return Envelope.builder().type(EnvelopeType.SYNC_RESPONSE.wireName()).messages(messages).build();
    }

    public static Envelope error(String code, String reason) {
        return Envelope.builder().type(EnvelopeType.ERROR.wireName()).code(code).reason(reason).build();
    }

    public static Envelope confirmation(WireMessage message) {
        return Envelope.builder()
                .type(EnvelopeType.MESSAGE.wireName())
                .id(message.getId())
                .role(message.getRole())
                .content(message.getContent())
                .agentName(message.getAgentName())
                .userId(message.getUserId())
                .timestamp(message.getTimestamp())
                .metadata(message.getMetadata())
                .build();
    }
}
