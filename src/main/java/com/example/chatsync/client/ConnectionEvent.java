package com.example.chatsync.client;

/**
 * Input to the connection state machine. Events tagged with a connection
 * generation are dropped once that connection has been replaced.
 */
public record ConnectionEvent(Type type, long generation, String frame, Throwable error) {

    public static final long ANY_GENERATION = -1;

    public enum Type {
        CONNECT_REQUESTED,
        TRANSPORT_OPENED,
        FRAME_RECEIVED,
        TRANSPORT_CLOSED,
        LIVENESS_LOST,
        RECONNECT_DUE,
        CLOSE_REQUESTED
    }

    public static ConnectionEvent connectRequested() {
        return new ConnectionEvent(Type.CONNECT_REQUESTED, ANY_GENERATION, null, null);
    }

    public static ConnectionEvent closeRequested() {
        return new ConnectionEvent(Type.CLOSE_REQUESTED, ANY_GENERATION, null, null);
    }

    public static ConnectionEvent opened(long generation) {
        return new ConnectionEvent(Type.TRANSPORT_OPENED, generation, null, null);
    }

    public static ConnectionEvent frame(long generation, String frame) {
        return new ConnectionEvent(Type.FRAME_RECEIVED, generation, frame, null);
    }

    public static ConnectionEvent closed(long generation, Throwable error) {
        return new ConnectionEvent(Type.TRANSPORT_CLOSED, generation, null, error);
    }

    public static ConnectionEvent livenessLost(long generation) {
        return new ConnectionEvent(Type.LIVENESS_LOST, generation, null, null);
    }

    public static ConnectionEvent reconnectDue(long generation) {
        return new ConnectionEvent(Type.RECONNECT_DUE, generation, null, null);
    }
}
