package com.chatsync.core.retention;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SweepReport {

    Instant cutoff;

    int publicDeleted;

    int privateDeleted;

    int heartbeatsDeleted;

    int directoriesRemoved;

    /** Entries that could not be listed, read or deleted. */
    int failed;

    /**
     * Number of message and heartbeat files removed. Directories are not counted.
     */
    public int getDeleted() {
        return publicDeleted + privateDeleted + heartbeatsDeleted;
    }
}
