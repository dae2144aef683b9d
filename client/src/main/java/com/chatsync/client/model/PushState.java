package com.chatsync.client.model;

public enum PushState {
    DISCONNECTED,
    JOINING,
    JOINED
}
