package com.example.chatsync.store;

/**
 * A request that can never succeed as sent: malformed session id, unknown role,
 * missing content. Rejected immediately and never retried.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
