package com.chatsync.core.error;

public class AttachmentRejectedException extends ChatSyncException {

    public AttachmentRejectedException(String message) {
        super(message);
    }
}
