package com.chatsync.core.sync;

import com.chatsync.core.attachment.AttachmentStore;
import com.chatsync.core.channel.ShareChannelStore;
import com.chatsync.core.codec.ChatJson;
import com.chatsync.core.codec.MessageCodec;
import com.chatsync.core.codec.MessageIdFormat;
import com.chatsync.core.config.ShareConfig;
import com.chatsync.core.presence.HeartbeatPresenceRegistry;
import com.chatsync.core.retention.RetentionSweeper;
import com.chatsync.core.retention.SweepHistory;
import com.chatsync.core.storage.ObjectStore;
import com.chatsync.core.storage.ObjectStores;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;

import java.time.Clock;

/**
 * One chat room on shared storage with all of its services wired together.
 */
@Getter
public class ShareChatRoom {

    private final ShareConfig config;
    private final ObjectStore store;
    private final Clock clock;
    private final MessageCodec codec;
    private final MessageIdFormat idFormat;
    private final ShareChannelStore channelStore;
    private final HeartbeatPresenceRegistry presence;
    private final AttachmentStore attachments;
    private final RetentionSweeper sweeper;

    public ShareChatRoom(ShareConfig config, ObjectStore store, Clock clock) {
        this.config = config;
        this.store = store;
        this.clock = clock;

        ObjectMapper objectMapper = ChatJson.newObjectMapper();
        this.codec = new MessageCodec(objectMapper, config.getZone());
        this.idFormat = new MessageIdFormat();
        this.channelStore = new ShareChannelStore(store, codec, idFormat, clock);
        this.presence = new HeartbeatPresenceRegistry(store, codec, clock);
        this.attachments = new AttachmentStore(store, codec, clock);
        this.sweeper = new RetentionSweeper(store, codec, idFormat, new SweepHistory(store, objectMapper), clock);
    }

    /**
     * Opens the room described by {@code config} using the system clock.
     */
    public static ShareChatRoom open(ShareConfig config) {
        return new ShareChatRoom(config, ObjectStores.create(config), Clock.systemUTC());
    }

    public SyncClient newClient(String userId, String displayName, SyncListener listener) {
        return new SyncClient(this, userId, displayName, listener);
    }
}
