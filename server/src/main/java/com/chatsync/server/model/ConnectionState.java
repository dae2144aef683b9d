package com.chatsync.server.model;

/**
 * Lifecycle of one push connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    JOINING,
    JOINED
}
