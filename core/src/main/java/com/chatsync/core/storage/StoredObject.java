package com.chatsync.core.storage;

import lombok.Value;

import java.time.Instant;

@Value
public class StoredObject {

    /** Key relative to the chat room root, e.g. {@code public/msg_20240101_120000_000_alice.json}. */
    String key;

    /** Last path segment of the key. */
    String name;

    Instant lastModified;

    long size;
}
