package com.chatsync.server.controller;

import com.chatsync.core.retention.SweepReport;
import com.chatsync.server.handler.ChatWebSocketHandler;
import com.chatsync.server.retention.RetentionScheduler;
import com.chatsync.server.service.ConnectionRegistry;
import com.chatsync.server.service.WebSocketWriteManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@Slf4j
public class HealthController {

    @Autowired
    private ChatWebSocketHandler webSocketHandler;

    @Autowired
    private ConnectionRegistry registry;

    @Autowired
    private WebSocketWriteManager writeManager;

    @Autowired(required = false)
    private RetentionScheduler retentionScheduler;

    @Value("${server.id:chatsync-1}")
    private String serverId;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("serverId", serverId);
        health.put("timestamp", System.currentTimeMillis());
        health.put("onlineUsers", registry.getOnlineCount());
        health.put("retentionEnabled", retentionScheduler != null);
        health.put("status", "UP");
        return ResponseEntity.ok(health);
    }

    /**
     * Counters of the handler, the connection registry, the write manager and the retention sweep.
     */
    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("serverId", serverId);
        metrics.put("timestamp", System.currentTimeMillis());

        Map<String, Object> handlerMetrics = new HashMap<>();
        handlerMetrics.put("framesReceived", webSocketHandler.getFramesReceived());
        handlerMetrics.put("chatsRelayed", webSocketHandler.getChatsRelayed());
        handlerMetrics.put("privateChatsRelayed", webSocketHandler.getPrivateChatsRelayed());
        handlerMetrics.put("errorsSent", webSocketHandler.getErrorsSent());
        metrics.put("handler", handlerMetrics);

        Map<String, Object> presenceMetrics = new HashMap<>();
        presenceMetrics.put("onlineUsers", registry.onlineUserIds());
        presenceMetrics.put("framesBroadcast", registry.getFramesBroadcast());
        presenceMetrics.put("broadcastFailures", registry.getBroadcastFailures());
        presenceMetrics.put("duplicateJoins", registry.getDuplicateJoins());
        metrics.put("presence", presenceMetrics);

        Map<String, Object> writeMetrics = new HashMap<>();
        writeMetrics.put("framesSent", writeManager.getTotalFramesSent());
        writeMetrics.put("framesQueued", writeManager.getTotalFramesQueued());
        writeMetrics.put("framesDropped", writeManager.getTotalFramesDropped());
        writeMetrics.put("writeErrors", writeManager.getTotalWriteErrors());
        writeMetrics.put("activeSessions", writeManager.getActiveSessionCount());
        writeMetrics.put("activeWriterThreads", writeManager.getActiveWriterThreadCount());
        metrics.put("writeManager", writeMetrics);

        if (retentionScheduler != null) {
            Map<String, Object> retentionMetrics = new HashMap<>();
            retentionMetrics.put("sweepsRun", retentionScheduler.getSweepsRun());
            retentionMetrics.put("sweepsFailed", retentionScheduler.getSweepsFailed());
            SweepReport last = retentionScheduler.getLastReport();
            if (last != null) {
                retentionMetrics.put("lastCutoff", last.getCutoff().toString());
                retentionMetrics.put("lastDeleted", last.getDeleted());
                retentionMetrics.put("lastFailed", last.getFailed());
            }
            metrics.put("retention", retentionMetrics);
        }

        return ResponseEntity.ok(metrics);
    }
}
