package com.chatsync.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A frame received from the push server.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushMessage {

    @JsonProperty("type")
    private String type;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("username")
    private String username;

    @JsonProperty("target_user_id")
    private String targetUserId;

    @JsonProperty("message")
    private String message;

    @JsonProperty("online_users")
    private List<String> onlineUsers;

    @JsonProperty("timestamp")
    private String timestamp;
}
