package com.chatsync.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chat line for a single recipient. Delivered to the target and echoed to the sender.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PrivateChatFrame implements ClientFrame {

    public static final String TYPE = "private_chat";

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("username")
    private String username;

    @JsonProperty("target_user_id")
    private String targetUserId;

    @JsonProperty("message")
    private String message;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPrivateChat(this);
    }
}
