package com.chatsync.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class HeartbeatRecord {

    public static final String STATUS_ONLINE = "online";
    public static final String STATUS_OFFLINE = "offline";

    String userId;

    String displayName;

    Instant lastActive;

    String status;

    public Duration ageAt(Instant now) {
        return Duration.between(lastActive, now);
    }

    public boolean isOffline() {
        return STATUS_OFFLINE.equals(status);
    }
}
