package com.chatsync.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PingFrame implements ClientFrame {

    public static final String TYPE = "ping";

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPing(this);
    }
}
