package com.example.chatsync.protocol;

public enum EnvelopeType {
    MESSAGE("message"),
    HISTORY_REQUEST("history_request"),
    HISTORY("history"),
    SYNC_REQUEST("sync_request"),
    SYNC_RESPONSE("sync_response"),
    HEARTBEAT("heartbeat"),
    ERROR("error");

    private final String wireName;

    EnvelopeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static EnvelopeType fromWire(String wireName) {
        for (EnvelopeType type : values()) {
            if (type.wireName.equals(wireName)) return type;
        }
        return null;
    }
}
