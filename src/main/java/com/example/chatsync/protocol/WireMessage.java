package com.example.chatsync.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.util.Map;

/**
 * A message as it travels inside {@code history} and {@code sync_response} envelopes.
 * Timestamps are epoch milliseconds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WireMessage {
    private String id;
    private String sessionId;
    private String role;
    private String content;
    private String agentName;
    private String userId;
    private Long timestamp;
    private Map<String, Object> metadata;
}
