package com.chatsync.core.model;

import lombok.Value;

@Value
public class OnlineUser {

    String userId;

    String displayName;
}
