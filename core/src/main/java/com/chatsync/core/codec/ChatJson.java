package com.chatsync.core.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson setup: unknown fields are ignored so newer writers never break older readers.
 */
public final class ChatJson {

    private ChatJson() {
    }

    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
