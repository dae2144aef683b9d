package com.chatsync.core.channel;

import lombok.Value;

@Value
public class StorageStats {

    int publicMessages;

    int privateMessages;

    int heartbeats;

    public int getTotalFiles() {
        return publicMessages + privateMessages + heartbeats;
    }
}
