package com.example.chatsync.model;

import com.example.chatsync.store.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Only user and assistant messages move a session's preview and last-message time.
     */
    public boolean updatesPreview() {
        return this != SYSTEM;
    }

    public static boolean isValid(String value) {
        if (value == null) return false;
        for (MessageRole role : values()) {
            if (role.value.equals(value)) return true;
        }
        return false;
    }

    public static MessageRole fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (MessageRole role : values()) {
                if (role.value.equals(normalized)) return role;
            }
        }
        throw new ValidationException("Invalid role: " + value + " (expected user, assistant or system)");
    }
}
