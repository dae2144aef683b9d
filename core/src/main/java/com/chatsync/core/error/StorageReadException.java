package com.chatsync.core.error;

public class StorageReadException extends StorageException {

    public StorageReadException(String key, Throwable cause) {
        super("Failed to read " + key + ": " + cause.getMessage(), cause);
    }
}
