package com.example.chatsync.store;

import java.util.Map;

/**
 * The tuple a producer (user, agent runtime, batch import) hands to the store.
 */
public record NewMessage(String role,
                         String content,
                         String agentName,
                         String userId,
                         Map<String, Object> metadata) {

    public static NewMessage of(String role, String content) {
        return new NewMessage(role, content, null, null, null);
    }
}
