package com.chatsync.core.error;

public class StorageWriteException extends StorageException {

    public StorageWriteException(String key, Throwable cause) {
        super("Failed to write " + key + ": " + cause.getMessage(), cause);
    }
}
