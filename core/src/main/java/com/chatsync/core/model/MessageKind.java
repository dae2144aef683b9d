package com.chatsync.core.model;

public enum MessageKind {
    PUBLIC("public"),
    PRIVATE("private");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @return the kind for a stored {@code type} value, or null when unknown
     */
    public static MessageKind fromWireName(String wireName) {
        for (MessageKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        return null;
    }
}
