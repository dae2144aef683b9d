package com.chatsync.server.validator;

import com.chatsync.server.model.ChatFrame;
import com.chatsync.server.model.JoinFrame;
import com.chatsync.server.model.PrivateChatFrame;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class FrameValidatorTest {

    private final FrameValidator validator = new FrameValidator();

    @Test
    void joinNeedsIdAndName() {
        assertThat(validator.validate(new JoinFrame("alice", "Alice"))).isNull();
        assertThat(validator.validate(new JoinFrame(null, "Alice"))).isEqualTo("user_id and username must not be empty");
        assertThat(validator.validate(new JoinFrame("alice", "  "))).isEqualTo("user_id and username must not be empty");
        assertThat(validator.validate(new JoinFrame(" alice", "Alice"))).contains("whitespace");
        assertThat(validator.validate(new JoinFrame("a".repeat(65), "Alice"))).contains("at most 64");
    }

    @Test
    void chatBodyMustFitTheLimit() {
        ReflectionTestUtils.setField(validator, "maxMessageLength", 5);

        assertThat(validator.validate(new ChatFrame("alice", "Alice", "hello"))).isNull();
        assertThat(validator.validate(new ChatFrame("alice", "Alice", "hello!"))).isEqualTo("message must be at most 5 characters");
        assertThat(validator.validate(new ChatFrame("alice", "Alice", " "))).isEqualTo("message must not be empty");
    }

    @Test
    void privateChatNeedsATarget() {
        assertThat(validator.validate(new PrivateChatFrame("alice", "Alice", null, "hi"))).isEqualTo("target_user_id is required");
        assertThat(validator.validate(new PrivateChatFrame("alice", "Alice", "bob", "hi"))).isNull();
    }
}
