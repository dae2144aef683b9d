package com.chatsync.server.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketWriteManagerTest {

    private WebSocketWriteManager writeManager;

    @BeforeEach
    void setUp() {
        writeManager = new WebSocketWriteManager();
        ReflectionTestUtils.setField(writeManager, "writerThreads", 2);
        ReflectionTestUtils.setField(writeManager, "queueCapacity", 100);
        writeManager.init();
    }

    @AfterEach
    void tearDown() {
        writeManager.shutdown();
    }

    @Test
    void framesArriveInQueueOrder() throws Exception {
        WebSocketSession session = openSession("s1");
        writeManager.registerSession(session);

        for (int i = 0; i < 50; i++) {
            assertThat(writeManager.send(session, "frame-" + i)).isTrue();
        }

        verify(session, timeout(2000).times(50)).sendMessage(any());
        ArgumentCaptor<TextMessage> frames = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(50)).sendMessage(frames.capture());
        assertThat(frames.getAllValues().stream().map(TextMessage::getPayload).collect(Collectors.toList()))
                .startsWith("frame-0", "frame-1", "frame-2")
                .endsWith("frame-49");
        assertThat(writeManager.getTotalFramesQueued()).isEqualTo(50);
    }

    @Test
    void unregisteredSessionsAreDropped() {
        WebSocketSession session = openSession("ghost");

        assertThat(writeManager.send(session, "hello")).isFalse();
        assertThat(writeManager.getTotalFramesDropped()).isEqualTo(1);
    }

    @Test
    void failedWriteClosesAndUnregistersTheSession() throws Exception {
        WebSocketSession session = openSession("s1");
        doThrow(new IOException("broken pipe")).when(session).sendMessage(any());
        writeManager.registerSession(session);

        writeManager.send(session, "hello");

        verify(session, timeout(2000)).close(CloseStatus.SESSION_NOT_RELIABLE);
        assertThat(writeManager.getTotalWriteErrors()).isEqualTo(1);
        assertThat(writeManager.getActiveSessionCount()).isZero();
        assertThat(writeManager.send(session, "again")).isFalse();
        verify(session, times(1)).sendMessage(any());
    }

    private static WebSocketSession openSession(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }
}
