package com.chatsync.core.error;

/**
 * Base type for every error the chat core reports to its callers.
 * The message is short and human readable so a UI layer can show it as-is.
 */
public abstract class ChatSyncException extends RuntimeException {

    protected ChatSyncException(String message) {
        super(message);
    }

    protected ChatSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
