package com.example.chatsync.controller.dto;

import com.example.chatsync.store.NewMessage;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageRequest {
    private String role;
    private String content;
    private String agentName;
    private String userId;
    private Map<String, Object> metadata;

    public NewMessage toNewMessage() {
        return new NewMessage(role, content, agentName, userId, metadata);
    }
}
