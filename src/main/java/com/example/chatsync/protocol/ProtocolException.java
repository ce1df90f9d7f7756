package com.example.chatsync.protocol;

/**
 * A frame that cannot be understood: not JSON, no {@code type}, or an unknown type.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
