package com.chatsync.core.channel;

import com.chatsync.core.model.MessageId;

/**
 * Directory layout of a chat room below its root.
 */
public final class StorageLayout {

    public static final String PUBLIC_DIR = "public";
    public static final String PRIVATE_DIR = "private";
    public static final String USERS_DIR = "users";
    public static final String FILES_DIR = "files";
    public static final String IMAGES_DIR = "images";
    public static final String LOGS_DIR = "logs";

    public static final String HEARTBEAT_SUFFIX = "_heartbeat.json";

    private StorageLayout() {
    }

    public static String publicKey(MessageId id) {
        return PUBLIC_DIR + "/" + id.getFileName();
    }

    public static String privateDirectory(String pairKey) {
        return PRIVATE_DIR + "/" + pairKey;
    }

    public static String privateKey(String pairKey, MessageId id) {
        return privateDirectory(pairKey) + "/" + id.getFileName();
    }

    public static String heartbeatKey(String userId) {
        return USERS_DIR + "/" + userId + HEARTBEAT_SUFFIX;
    }

    public static boolean isHeartbeatName(String name) {
        return name.endsWith(HEARTBEAT_SUFFIX) && name.length() > HEARTBEAT_SUFFIX.length();
    }

    /**
     * Rejects ids that would escape their directory or break the file naming scheme.
     */
    public static void requireValidUserId(String userId, String field) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (userId.contains("/") || userId.contains("\\") || userId.equals(".") || userId.equals("..")) {
            throw new IllegalArgumentException(field + " must not contain path separators: " + userId);
        }
    }
}
