package com.chatsync.core.error;

public class MalformedEnvelopeException extends ChatSyncException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
