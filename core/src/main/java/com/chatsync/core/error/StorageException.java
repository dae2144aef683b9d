package com.chatsync.core.error;

/**
 * Failure talking to the shared directory or object-storage bucket.
 */
public class StorageException extends ChatSyncException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
