package com.chatsync.core.error;

import lombok.Getter;

@Getter
public class TargetOfflineException extends ChatSyncException {

    private final String targetId;

    public TargetOfflineException(String targetId) {
        super("User '" + targetId + "' is not online");
        this.targetId = targetId;
    }
}
