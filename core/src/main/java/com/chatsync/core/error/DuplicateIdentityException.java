package com.chatsync.core.error;

import lombok.Getter;

/**
 * A join was attempted with a user ID that already holds a live connection.
 */
@Getter
public class DuplicateIdentityException extends ChatSyncException {

    private final String userId;

    public DuplicateIdentityException(String userId) {
        super("User ID '" + userId + "' is already in use, please choose another ID");
        this.userId = userId;
    }
}
