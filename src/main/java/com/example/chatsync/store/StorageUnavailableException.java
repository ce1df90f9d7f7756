package com.example.chatsync.store;

/**
 * The persistence backend failed. Expected to be rare and transient.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
