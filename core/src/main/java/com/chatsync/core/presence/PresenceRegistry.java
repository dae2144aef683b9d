package com.chatsync.core.presence;

import com.chatsync.core.model.OnlineUser;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Which users are currently present. Push transports know this exactly; pull transports
 * approximate it from heartbeat age, which is why {@code ttl} is a parameter.
 */
public interface PresenceRegistry {

    void deregister(String userId);

    /**
     * @param now reference time for heartbeat age
     * @param ttl maximum heartbeat age still counted as online; ignored by exact registries
     */
    Set<OnlineUser> listOnline(Instant now, Duration ttl);
}
