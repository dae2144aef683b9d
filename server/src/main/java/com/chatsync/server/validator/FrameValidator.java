package com.chatsync.server.validator;

import com.chatsync.server.model.ChatFrame;
import com.chatsync.server.model.JoinFrame;
import com.chatsync.server.model.PrivateChatFrame;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Field checks for client frames. Each method returns an error message for the client, or null
 * when the frame is valid.
 */
@Component
public class FrameValidator {

    private static final int MAX_USER_ID_LENGTH = 64;
    private static final int MAX_USERNAME_LENGTH = 64;

    @Value("${chat.message.max-length:1000}")
    private int maxMessageLength = 1000;

    public String validate(JoinFrame frame) {
        if (isBlank(frame.getUserId()) || isBlank(frame.getUsername())) {
            return "user_id and username must not be empty";
        }
        if (frame.getUserId().length() > MAX_USER_ID_LENGTH) {
            return "user_id must be at most " + MAX_USER_ID_LENGTH + " characters";
        }
        if (!frame.getUserId().equals(frame.getUserId().trim())) {
            return "user_id must not start or end with whitespace";
        }
        if (frame.getUsername().length() > MAX_USERNAME_LENGTH) {
            return "username must be at most " + MAX_USERNAME_LENGTH + " characters";
        }
        return null;
    }

    public String validate(ChatFrame frame) {
        return validateBody(frame.getMessage());
    }

    public String validate(PrivateChatFrame frame) {
        if (isBlank(frame.getTargetUserId())) {
            return "target_user_id is required";
        }
        return validateBody(frame.getMessage());
    }

    private String validateBody(String message) {
        if (message == null || message.trim().isEmpty()) {
            return "message must not be empty";
        }
        if (message.length() > maxMessageLength) {
            return "message must be at most " + maxMessageLength + " characters";
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
