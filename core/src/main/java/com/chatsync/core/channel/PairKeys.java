package com.chatsync.core.channel;

/**
 * Canonical names for two-party private channels.
 */
public final class PairKeys {

    public static final String SEPARATOR = "_";

    private PairKeys() {
    }

    /**
     * Joins the two user ids in sorted order, so {@code pairKey(a, b) == pairKey(b, a)}.
     */
    public static String pairKey(String userA, String userB) {
        if (userA.compareTo(userB) <= 0) {
            return userA + SEPARATOR + userB;
        }
        return userB + SEPARATOR + userA;
    }

    /**
     * Whether {@code userId} could be one of the two members of {@code pairKey}. Ids that contain
     * the separator make this ambiguous, so callers still check the decoded message parties.
     */
    public static boolean involves(String pairKey, String userId) {
        if (pairKey.startsWith(userId + SEPARATOR)) {
            String other = pairKey.substring(userId.length() + SEPARATOR.length());
            return !other.isEmpty() && userId.compareTo(other) <= 0;
        }
        if (pairKey.endsWith(SEPARATOR + userId)) {
            String other = pairKey.substring(0, pairKey.length() - userId.length() - SEPARATOR.length());
            return !other.isEmpty() && other.compareTo(userId) <= 0;
        }
        return false;
    }
}
