package com.chatsync.core.channel;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PairKeysTest {

    @Test
    void pairKeyIsIndependentOfArgumentOrder() {
        assertThat(PairKeys.pairKey("alice", "bob")).isEqualTo("alice_bob");
        assertThat(PairKeys.pairKey("bob", "alice")).isEqualTo("alice_bob");

        String[][] pairs = {{"u1", "u2"}, {"zed", "amy"}, {"A", "a"}, {"x", "x"}, {"user_1", "user"}};
        for (String[] pair : pairs) {
            assertThat(PairKeys.pairKey(pair[0], pair[1])).isEqualTo(PairKeys.pairKey(pair[1], pair[0]));
        }
    }

    @Test
    void involvesMatchesWholeMembersOnly() {
        String key = PairKeys.pairKey("bob", "alice");

        assertThat(PairKeys.involves(key, "alice")).isTrue();
        assertThat(PairKeys.involves(key, "bob")).isTrue();
        assertThat(PairKeys.involves(key, "ali")).isFalse();
        assertThat(PairKeys.involves(key, "ob")).isFalse();
        assertThat(PairKeys.involves(PairKeys.pairKey("bobby", "carol"), "bob")).isFalse();
    }
}
