package com.chatsync.core.model;

/**
 * Presence of a user as observed by others through heartbeat age.
 */
public enum PresenceState {
    /** Heartbeat younger than the TTL. */
    ONLINE,
    /** Heartbeat missed: older than the TTL but younger than twice the TTL. */
    STALE,
    /** No heartbeat, an explicit offline heartbeat, or one older than twice the TTL. */
    OFFLINE
}
