package com.chatsync.core.sync;

import com.chatsync.core.error.ChatSyncException;
import com.chatsync.core.model.Message;
import com.chatsync.core.model.OnlineUser;

import java.util.List;
import java.util.Set;

/**
 * Receives what the sync loop finds. All callbacks run on the sync thread, one at a time, so an
 * implementation only has to hand results over to its own UI thread.
 */
public interface SyncListener {

    /**
     * @param messages newly seen messages, oldest first; never empty
     */
    void onMessages(List<Message> messages);

    default void onOnlineUsers(Set<OnlineUser> users) {
    }

    /**
     * A poll failed; the loop keeps running and retries on the next interval.
     */
    default void onError(ChatSyncException error) {
    }
}
