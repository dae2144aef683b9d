package com.chatsync.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A frame sent by a push client, decoded by its {@code type} field.
 * Adding a subtype means adding a method to {@link Visitor}, so every handler has to deal with it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type", visible = true)
@JsonSubTypes({
        @JsonSubTypes.Type(value = JoinFrame.class, name = JoinFrame.TYPE),
        @JsonSubTypes.Type(value = ChatFrame.class, name = ChatFrame.TYPE),
        @JsonSubTypes.Type(value = PrivateChatFrame.class, name = PrivateChatFrame.TYPE),
        @JsonSubTypes.Type(value = PingFrame.class, name = PingFrame.TYPE)
})
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ClientFrame {

    String getType();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {

        R visitJoin(JoinFrame frame);

        R visitChat(ChatFrame frame);

        R visitPrivateChat(PrivateChatFrame frame);

        R visitPing(PingFrame frame);
    }
}
